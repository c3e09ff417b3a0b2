package org.unbundle.splitter.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads emitted chunk files from disk.
 */
public final class ChunkSourceLoader {

    /**
     * A loaded chunk file.
     *
     * @param content     The file content without byte order mark, line endings normalized to {@code \n}.
     * @param logicalName The path the content was read from, with forward slashes.
     */
    public record LoadedChunk(String content, String logicalName) {}

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private ChunkSourceLoader() {}

    /**
     * @param location Path of the chunk file.
     * @return The loaded chunk.
     * @throws IOException If the file cannot be read.
     */
    public static LoadedChunk load(String location) throws IOException {
        Path path = Path.of(location).toAbsolutePath().normalize();
        String content = Files.readString(path, StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }
        return new LoadedChunk(content.replace("\r\n", "\n").replace('\r', '\n'),
                path.toString().replace('\\', '/'));
    }

    /**
     * The file name of a chunk location, e.g. {@code 123.abc.js} for {@code build/static/js/123.abc.js}.
     */
    public static String fileName(String location) {
        int slash = Math.max(location.lastIndexOf('/'), location.lastIndexOf('\\'));
        return slash >= 0 ? location.substring(slash + 1) : location;
    }
}
