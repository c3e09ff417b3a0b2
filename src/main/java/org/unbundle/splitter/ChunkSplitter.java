package org.unbundle.splitter;

import com.google.javascript.rhino.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unbundle.splitter.api.Chunk;
import org.unbundle.splitter.api.ChunkModule;
import org.unbundle.splitter.api.ModuleId;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.frontend.classify.ModuleClassifier;
import org.unbundle.splitter.frontend.classify.ModuleKind;
import org.unbundle.splitter.frontend.extract.ChunkExtractor;
import org.unbundle.splitter.frontend.extract.ExtractedChunk;
import org.unbundle.splitter.frontend.idiom.IdiomMatcher;
import org.unbundle.splitter.frontend.module.ModuleDescriptor;
import org.unbundle.splitter.frontend.module.ModuleMapReader;
import org.unbundle.splitter.frontend.module.ModuleResolver;
import org.unbundle.splitter.frontend.pass.IModulePass;
import org.unbundle.splitter.frontend.pass.ModuleContext;
import org.unbundle.splitter.frontend.pass.ModulePassRegistry;
import org.unbundle.splitter.graph.ModuleGraph;
import org.unbundle.splitter.js.JsToolchain;
import org.unbundle.splitter.output.ChunkOutputWriter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Splits a webpack chunk into one rewritten source file per bundled module.
 *
 * <p>The pipeline for one chunk is:</p>
 * <ol>
 *   <li>Phase 0: recognize the {@code self.webpackChunk...push(...)} wrapper ({@link ChunkExtractor}).</li>
 *   <li>Phase 1: parse the module map and validate each entry ({@link ModuleMapReader}).</li>
 *   <li>Phase 2: per module, lift the factory body into its own ES module tree, classify it
 *       ({@link ModuleClassifier}) and run the rewriting passes ({@link ModulePassRegistry}).</li>
 *   <li>Phase 3: print each module and submit the output files, then wait for the writes.</li>
 * </ol>
 *
 * <p>A chunk is processed on the calling thread. Separate {@code split} calls may run concurrently
 * as long as the configured graph sink supports it.</p>
 */
public class ChunkSplitter {

    private static final Logger log = LoggerFactory.getLogger(ChunkSplitter.class);

    private final SplitterOptions options;
    private final DiagnosticsEngine diagnostics;
    private final ChunkExtractor extractor = new ChunkExtractor();

    public ChunkSplitter(SplitterOptions options) {
        this(options, new DiagnosticsEngine());
    }

    /**
     * @param options     Splitting options.
     * @param diagnostics The engine receiving warnings and info messages of every split chunk.
     */
    public ChunkSplitter(SplitterOptions options, DiagnosticsEngine diagnostics) {
        this.options = options;
        this.diagnostics = diagnostics;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * Splits one chunk.
     *
     * @param chunkSource The chunk file content.
     * @return The split chunk, or empty if the text is not a webpack chunk or its module map
     *         cannot be read.
     */
    public Optional<Chunk> split(String chunkSource) {
        Optional<ExtractedChunk> extracted = extractor.extract(chunkSource);
        if (extracted.isEmpty()) {
            log.debug("Input does not contain a webpack chunk wrapper");
            return Optional.empty();
        }

        int chunkId = extracted.get().chunkId();
        DiagnosticsEngine.Scope chunkDiagnostics = diagnostics.forChunk(chunkId);
        JsToolchain toolchain = new JsToolchain(ChunkOutputWriter.chunkFileName(chunkId));

        Optional<Node> root = toolchain.parse(extracted.get().wrappedModuleMapSource());
        if (root.isEmpty()) {
            chunkDiagnostics.warn("Chunk module map could not be parsed");
            return Optional.empty();
        }
        Optional<Node> moduleMap = ModuleMapReader.locateModuleMap(root.get());
        if (moduleMap.isEmpty()) {
            chunkDiagnostics.warn("Chunk module map is not an object expression");
            return Optional.empty();
        }

        ChunkOutputWriter writer = options.output()
                .map(directory -> new ChunkOutputWriter(directory, chunkId, options.writeExecutor()))
                .orElse(null);
        if (writer != null) {
            writer.submitChunk(toolchain.print(moduleMap.get()));
        }

        ModuleResolver resolver = new ModuleResolver(options.moduleTransformations());
        ModuleMapReader reader = new ModuleMapReader(chunkId, resolver, options.graph(), chunkDiagnostics);
        IdiomMatcher matcher = new IdiomMatcher(reader.params());
        ModuleClassifier classifier = new ModuleClassifier(toolchain, matcher);
        ModulePassRegistry passes = ModulePassRegistry.initializeWithDefaults(reader.params());

        Map<ModuleId, ChunkModule> modules = new LinkedHashMap<>();
        for (Node property = moduleMap.get().getFirstChild(); property != null; property = property.getNext()) {
            Optional<ModuleDescriptor> descriptor = reader.read(property);
            if (descriptor.isEmpty()) {
                continue;
            }
            ModuleId moduleId = descriptor.get().id();
            DiagnosticsEngine.Scope moduleDiagnostics = chunkDiagnostics.forModule(moduleId);
            if (modules.containsKey(moduleId)) {
                moduleDiagnostics.warn("Duplicate module id, replacing the earlier module");
            }

            ModuleContext context = lift(descriptor.get(), root.get(), toolchain, classifier, matcher,
                    resolver, moduleDiagnostics);
            for (IModulePass pass : passes.passes()) {
                if (pass.isEnabled(context)) {
                    pass.run(context);
                }
            }

            ChunkModule module = new ChunkModule(moduleId, context.script(), toolchain.print(context.script()),
                    context.isCommonJs(), context.importedModules());
            modules.put(moduleId, module);
            if (writer != null) {
                writer.submitModule(module);
            }
        }

        if (writer != null) {
            int written = writer.awaitAll();
            log.debug("Chunk {}: {} output files submitted", chunkId, written);
        }
        log.info("Split chunk {} into {} modules", chunkId, modules.size());
        return Optional.of(new Chunk(chunkId, modules));
    }

    private ModuleContext lift(ModuleDescriptor descriptor, Node chunkRoot, JsToolchain toolchain,
                               ModuleClassifier classifier, IdiomMatcher matcher, ModuleResolver resolver,
                               DiagnosticsEngine.Scope moduleDiagnostics) {
        Node script = toolchain.newModuleScript(chunkRoot, descriptor.body().getFirstChild());
        ModuleKind kind = classifier.classify(script, moduleDiagnostics);
        if (kind.isCommonJs() && options.graph() != null) {
            options.graph().mergeNode(descriptor.id(), Map.of(ModuleGraph.TYPE, ModuleGraph.COMMON_JS_TYPE));
        }
        return new ModuleContext(descriptor.id(), script, kind, toolchain, matcher, resolver, options,
                moduleDiagnostics);
    }
}
