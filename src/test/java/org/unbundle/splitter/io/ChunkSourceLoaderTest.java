package org.unbundle.splitter.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChunkSourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsFileAndNormalizesLineEndings() throws IOException {
        Path file = tempDir.resolve("12.abc.js");
        Files.writeString(file, "a\r\nb\rc\n");

        ChunkSourceLoader.LoadedChunk loaded = ChunkSourceLoader.load(file.toString());

        assertThat(loaded.content()).isEqualTo("a\nb\nc\n");
        assertThat(loaded.logicalName()).endsWith("/12.abc.js");
    }

    @Test
    void stripsByteOrderMark() throws IOException {
        Path file = tempDir.resolve("47.js");
        Files.writeString(file, "\uFEFF(self.webpackChunkapp=self.webpackChunkapp||[]).push([[47],{}]);",
                StandardCharsets.UTF_8);

        assertThat(ChunkSourceLoader.load(file.toString()).content()).startsWith("(self.webpackChunkapp");
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> ChunkSourceLoader.load(tempDir.resolve("missing.js").toString()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void derivesFileNames() {
        assertThat(ChunkSourceLoader.fileName("build/static/js/9.js")).isEqualTo("9.js");
        assertThat(ChunkSourceLoader.fileName("build\\static\\js\\123.abc.js")).isEqualTo("123.abc.js");
        assertThat(ChunkSourceLoader.fileName("9.js")).isEqualTo("9.js");
    }
}
