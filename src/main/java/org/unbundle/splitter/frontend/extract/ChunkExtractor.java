package org.unbundle.splitter.frontend.extract;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phase 0: recognizes the webpack chunk push wrapper in raw text.
 *
 * <p>This is a text-based scan; it does not invoke the parser. The recognized shape is</p>
 * <pre>
 * (self.webpackChunkNAME=self.webpackChunkNAME||[]).push([[ID],{MODULES}]);
 * (self.webpackChunkNAME=self.webpackChunkNAME||[]).push([[ID],{MODULES},RUNTIME]);
 * </pre>
 * <p>The optional runtime callback is swallowed into the module map source by the greedy match
 * and later ignored, because only the first element of the wrapped sequence is read.</p>
 */
public final class ChunkExtractor {

    private static final Pattern CHUNK_PATTERN = Pattern.compile(
            "\\(\\s*(self\\.(webpackChunk\\w*))\\s*=\\s*\\1\\s*\\|\\|\\s*\\[\\s*]\\s*\\)\\s*\\.push\\(\\s*"
                    + "\\[\\s*\\[\\s*(\\d+)\\s*]\\s*,\\s*(\\{.+})\\s*]\\s*\\)\\s*;?",
            Pattern.DOTALL);

    /**
     * Probes raw chunk text.
     *
     * @param chunkSource The raw file content.
     * @return The isolated chunk parts, or empty if the text is not a webpack chunk.
     */
    public Optional<ExtractedChunk> extract(String chunkSource) {
        if (chunkSource == null) {
            return Optional.empty();
        }
        Matcher matcher = CHUNK_PATTERN.matcher(chunkSource);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int chunkId;
        try {
            chunkId = Integer.parseInt(matcher.group(3));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedChunk(chunkId, matcher.group(2), matcher.group(4)));
    }
}
