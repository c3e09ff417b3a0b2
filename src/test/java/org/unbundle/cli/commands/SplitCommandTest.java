package org.unbundle.cli.commands;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.unbundle.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the split command.
 * Runs the command line exactly as the entry point does, against the bundled fixture chunks.
 */
@Tag("integration")
public class SplitCommandTest {

    @TempDir
    Path tempDir;

    private Path chunkFile;
    private Path plainFile;
    private Path outDir;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        chunkFile = copyResource("chunks/webpack-chunk-47.js", "47.a1b2c3.js");
        plainFile = copyResource("chunks/not-a-chunk.js", "main.js");
        outDir = tempDir.resolve("out");
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("unbundle.logging.format");
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKey("split");
    }

    @Test
    void testHelpOutput() {
        int exitCode = execute("split", "--help");

        String output = out.toString() + err.toString();
        assertThat(exitCode).isEqualTo(0);
        assertThat(output).contains("split");
        assertThat(output).contains("--out");
        assertThat(output).contains("--graph");
        assertThat(output).contains("--threads");
    }

    @Test
    void testSplitChunk() {
        int exitCode = execute("split", "-o", outDir.toString(), chunkFile.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString())
            .contains("Chunk 47 (47.a1b2c3.js): 3 modules")
            .contains("3 modules, 3 graph nodes, 2 edges, 0 warnings");
        assertThat(outDir.resolve("chunk-47.js")).exists();
        assertThat(outDir.resolve("1001.js")).exists();
        assertThat(outDir.resolve("2002.js")).exists();
        assertThat(outDir.resolve("3004.js")).exists();
    }

    @Test
    void testNonChunkInputIsSkipped() {
        int exitCode = execute("split", "-o", outDir.toString(), plainFile.toString(), chunkFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
            .contains("Skipped main.js: not a webpack chunk")
            .contains("Chunk 47 (47.a1b2c3.js): 3 modules");
    }

    @Test
    void testMissingInputFails() {
        int exitCode = execute("split", "-o", outDir.toString(), tempDir.resolve("missing.js").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot read").contains("missing.js");
    }

    @Test
    void testGraphExport() throws IOException {
        Path graphFile = tempDir.resolve("graph/deps.json");

        int exitCode = execute("split", "-o", outDir.toString(), "--graph", graphFile.toString(),
                "--threads", "2", chunkFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Dependency graph written to " + graphFile);
        JsonObject graph = JsonParser.parseString(Files.readString(graphFile, StandardCharsets.UTF_8)).getAsJsonObject();
        assertThat(graph.getAsJsonArray("nodes")).hasSize(3);
        assertThat(graph.getAsJsonArray("edges")).hasSize(2);
    }

    @Test
    void testEsmDefaultExportsCanBeDisabled() throws IOException {
        int exitCode = execute("split", "-o", outDir.toString(), "--no-esm-default-exports", chunkFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(Files.readString(outDir.resolve("3004.js"), StandardCharsets.UTF_8))
            .contains("module.exports = function");
    }

    @Test
    void testConfigFileIsApplied() throws IOException {
        Path configFile = copyResource("test-config.conf", "unbundle.conf");

        int exitCode = execute("--config", configFile.toString(), "split", "-o", outDir.toString(),
                "--graph", tempDir.resolve("graph.json").toString(), chunkFile.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(outDir.resolve("react.js")).exists();
        assertThat(outDir.resolve("2002.js")).doesNotExist();
        String helper = Files.readString(outDir.resolve("3004.js"), StandardCharsets.UTF_8);
        assertThat(helper).contains("module.exports = function").contains("_delete");
    }

    @Test
    void testMissingConfigFileFails() {
        int exitCode = execute("--config", tempDir.resolve("nope.conf").toString(), "split", chunkFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    void testInvalidThreadCountFails() {
        int exitCode = execute("split", "--threads", "0", chunkFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("--threads must be at least 1");
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        int exitCode = cmdLine.execute(args);
        cmdLine.getOut().flush();
        cmdLine.getErr().flush();
        return exitCode;
    }

    private Path copyResource(String resource, String fileName) throws IOException {
        Path target = tempDir.resolve(fileName);
        try (InputStream in = SplitCommandTest.class.getClassLoader().getResourceAsStream(resource)) {
            assertThat(in).describedAs("Test resource %s", resource).isNotNull();
            Files.copy(in, target);
        }
        return target;
    }
}
