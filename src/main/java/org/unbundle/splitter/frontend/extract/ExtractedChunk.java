package org.unbundle.splitter.frontend.extract;

/**
 * The parts of a chunk push wrapper isolated by {@link ChunkExtractor}.
 *
 * @param chunkId         The numeric chunk id.
 * @param globalName      The global array name, e.g. {@code webpackChunkmy_app}.
 * @param moduleMapSource The raw module map object literal, braces included.
 */
public record ExtractedChunk(int chunkId, String globalName, String moduleMapSource) {

    /**
     * The module map wrapped as a single parseable expression statement: {@code (<map>, 0)}.
     */
    public String wrappedModuleMapSource() {
        return "(" + moduleMapSource + ", 0)";
    }
}
