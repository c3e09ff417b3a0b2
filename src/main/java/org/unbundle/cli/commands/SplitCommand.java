package org.unbundle.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unbundle.cli.CommandLineInterface;
import org.unbundle.cli.config.SplitterConfig;
import org.unbundle.splitter.ChunkSplitter;
import org.unbundle.splitter.SplitterOptions;
import org.unbundle.splitter.api.Chunk;
import org.unbundle.splitter.graph.GraphJsonExporter;
import org.unbundle.splitter.graph.ModuleGraph;
import org.unbundle.splitter.io.ChunkSourceLoader;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that splits one or more webpack chunks.
 * <p>
 * Every module of a recognized chunk is written to {@code <out>/<moduleId>.js}, and the chunk's
 * formatted module map to {@code <out>/chunk-<id>.js}. All chunks share one dependency graph,
 * which is written as JSON when {@code --graph} (or {@code unbundle.output.graph-file}) is set.
 * Inputs that are not webpack chunks are reported as skipped.
 */
@Command(
    name = "split",
    mixinStandardHelpOptions = true,
    description = "Split webpack chunks into one source file per bundled module"
)
public class SplitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SplitCommand.class);

    @Parameters(
        arity = "1..*",
        paramLabel = "<chunk>",
        description = "Chunk files to split"
    )
    private List<String> chunks;

    @Option(
        names = {"-o", "--out"},
        description = "Output directory (default: unbundle.output.directory)"
    )
    private Path outputDirectory;

    @Option(
        names = {"--graph"},
        description = "Write the module dependency graph as JSON to this file"
    )
    private Path graphFile;

    @Option(
        names = {"--no-esm-default-exports"},
        description = "Keep module.exports assignments in ES modules instead of export default"
    )
    private boolean noEsmDefaultExports;

    @Option(
        names = {"--declaration-comments"},
        description = "Annotate variable declarations with /* Variable dec N */"
    )
    private boolean declarationComments;

    @Option(
        names = {"--reference-comments"},
        description = "Annotate variable references with /* Variable ref N */"
    )
    private boolean referenceComments;

    @Option(
        names = {"--threads"},
        description = "Number of chunks split in parallel. Default: 1",
        defaultValue = "1"
    )
    private int threads;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    /**
     * Outcome of one input.
     */
    private record ChunkReport(String location, Chunk chunk, String error) {}

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (threads < 1) {
            err.println("Error: --threads must be at least 1");
            return 1;
        }

        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException e) {
            err.println("Error: Failed to load or parse configuration: " + e.getMessage());
            return 1;
        }

        ModuleGraph graph = new ModuleGraph();
        SplitterOptions options;
        try {
            options = applyOverrides(SplitterConfig.toOptions(config)).withGraph(graph);
        } catch (ConfigException e) {
            err.println("Error: Invalid configuration: " + e.getMessage());
            return 1;
        }
        Path graphTarget = graphFile != null ? graphFile : SplitterConfig.graphFile(config).orElse(null);

        ChunkSplitter splitter = new ChunkSplitter(options);
        List<ChunkReport> reports = splitAll(splitter);

        int failures = 0;
        int moduleCount = 0;
        for (ChunkReport report : reports) {
            if (report.error() != null) {
                err.println("Error: " + report.error());
                failures++;
            } else if (report.chunk() == null) {
                out.println("Skipped " + report.location() + ": not a webpack chunk");
            } else {
                moduleCount += report.chunk().modules().size();
                out.printf("Chunk %d (%s): %d modules%n",
                        report.chunk().chunkId(), report.location(), report.chunk().modules().size());
            }
        }

        if (graphTarget != null) {
            try {
                new GraphJsonExporter().write(graph, graphTarget);
                out.println("Dependency graph written to " + graphTarget);
            } catch (IOException e) {
                err.println("Error: Cannot write dependency graph to " + graphTarget + ": " + e.getMessage());
                failures++;
            }
        }

        int warnings = splitter.diagnostics().warnings().size();
        out.printf("%d modules, %d graph nodes, %d edges, %d warnings%n",
                moduleCount, graph.nodeCount(), graph.edgeCount(), warnings);
        if (options.output().isPresent()) {
            out.println("Output written to " + options.output().get().toAbsolutePath());
        }
        return failures > 0 ? 1 : 0;
    }

    private SplitterOptions applyOverrides(SplitterOptions options) {
        SplitterOptions result = options.withVariableComments(
                options.includeVariableDeclarationComments() || declarationComments,
                options.includeVariableReferenceComments() || referenceComments);
        if (noEsmDefaultExports) {
            result = result.withEsmDefaultExports(false);
        }
        if (outputDirectory != null) {
            result = result.withOutputDirectory(outputDirectory);
        }
        return result;
    }

    private List<ChunkReport> splitAll(ChunkSplitter splitter) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ChunkReport>> futures = new ArrayList<>();
            for (String location : chunks) {
                futures.add(executor.submit(() -> splitOne(splitter, location)));
            }
            List<ChunkReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                reports.add(await(futures.get(i), chunks.get(i)));
            }
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ChunkReport splitOne(ChunkSplitter splitter, String location) {
        ChunkSourceLoader.LoadedChunk loaded;
        try {
            loaded = ChunkSourceLoader.load(location);
        } catch (IOException e) {
            return new ChunkReport(location, null, "Cannot read " + location + ": " + e.getMessage());
        }
        log.debug("Splitting {}", loaded.logicalName());
        Optional<Chunk> chunk = splitter.split(loaded.content());
        return new ChunkReport(ChunkSourceLoader.fileName(location), chunk.orElse(null), null);
    }

    private static ChunkReport await(Future<ChunkReport> future, String location) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ChunkReport(location, null, "Interrupted while splitting " + location);
        } catch (ExecutionException e) {
            log.error("Splitting {} failed", location, e.getCause());
            return new ChunkReport(location, null, "Splitting " + location + " failed: " + e.getCause().getMessage());
        }
    }
}
