package org.unbundle.splitter;

import org.unbundle.splitter.api.ModuleTransformation;
import org.unbundle.splitter.graph.IDependencyGraphSink;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Settings for {@link ChunkSplitter}.
 *
 * @param esmDefaultExports                  Rewrite {@code module.exports = X} in ES modules as {@code export default X}.
 * @param includeVariableDeclarationComments Attach {@code Variable dec N} comments to declarations.
 * @param includeVariableReferenceComments   Attach {@code Variable ref N} comments to references.
 * @param moduleTransformations              Caller rename table keyed by module id.
 * @param graph                              Dependency graph sink, or {@code null} for none.
 * @param outputDirectory                    Directory to write split files to, or {@code null} to disable writing.
 * @param writeExecutor                      Executor for file writes, or {@code null} for a private pool per chunk.
 */
public record SplitterOptions(
        boolean esmDefaultExports,
        boolean includeVariableDeclarationComments,
        boolean includeVariableReferenceComments,
        Map<String, ModuleTransformation> moduleTransformations,
        IDependencyGraphSink graph,
        Path outputDirectory,
        Executor writeExecutor
) {

    public SplitterOptions {
        moduleTransformations = moduleTransformations == null ? Map.of() : Map.copyOf(moduleTransformations);
    }

    /**
     * ES default exports on, no comments, no renames, no graph, no output.
     */
    public static SplitterOptions defaults() {
        return new SplitterOptions(true, false, false, Map.of(), null, null, null);
    }

    public SplitterOptions withEsmDefaultExports(boolean enabled) {
        return new SplitterOptions(enabled, includeVariableDeclarationComments, includeVariableReferenceComments,
                moduleTransformations, graph, outputDirectory, writeExecutor);
    }

    public SplitterOptions withVariableComments(boolean declarations, boolean references) {
        return new SplitterOptions(esmDefaultExports, declarations, references,
                moduleTransformations, graph, outputDirectory, writeExecutor);
    }

    public SplitterOptions withModuleTransformations(Map<String, ModuleTransformation> transformations) {
        return new SplitterOptions(esmDefaultExports, includeVariableDeclarationComments,
                includeVariableReferenceComments, transformations, graph, outputDirectory, writeExecutor);
    }

    public SplitterOptions withGraph(IDependencyGraphSink sink) {
        return new SplitterOptions(esmDefaultExports, includeVariableDeclarationComments,
                includeVariableReferenceComments, moduleTransformations, sink, outputDirectory, writeExecutor);
    }

    public SplitterOptions withOutputDirectory(Path directory) {
        return new SplitterOptions(esmDefaultExports, includeVariableDeclarationComments,
                includeVariableReferenceComments, moduleTransformations, graph, directory, writeExecutor);
    }

    public SplitterOptions withWriteExecutor(Executor executor) {
        return new SplitterOptions(esmDefaultExports, includeVariableDeclarationComments,
                includeVariableReferenceComments, moduleTransformations, graph, outputDirectory, executor);
    }

    public Optional<IDependencyGraphSink> graphSink() {
        return Optional.ofNullable(graph);
    }

    public Optional<Path> output() {
        return Optional.ofNullable(outputDirectory);
    }
}
