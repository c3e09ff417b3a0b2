package org.unbundle.splitter.frontend.module;

import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.api.ModuleId;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.graph.IDependencyGraphSink;
import org.unbundle.splitter.graph.ModuleGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates the entries of a chunk's module map and turns the valid ones into
 * {@link ModuleDescriptor}s.
 *
 * <p>Each entry must be a plain property with a numeric key whose value is a function with at
 * most three plain parameters (module, exports, require) and a block body. Entries failing a
 * check are reported and skipped; the chunk continues with the next entry. The reader owns the
 * chunk's {@link ModuleFunctionParams} contract.</p>
 */
public final class ModuleMapReader {

    private static final Pattern NUMERIC_KEY = Pattern.compile("\\d+");
    private static final Pattern FUSION_KEY = Pattern.compile("__fusion__(\\d+)");

    private final int chunkId;
    private final ModuleResolver resolver;
    private final IDependencyGraphSink graph;
    private final DiagnosticsEngine.Scope diagnostics;
    private final ModuleFunctionParams params = new ModuleFunctionParams();

    /**
     * @param chunkId     The chunk being read, recorded on every graph node.
     * @param resolver    Resolves raw keys through the rename table.
     * @param graph       The graph sink, or null if no graph is maintained.
     * @param diagnostics The chunk's reporting scope.
     */
    public ModuleMapReader(int chunkId, ModuleResolver resolver, IDependencyGraphSink graph,
                           DiagnosticsEngine.Scope diagnostics) {
        this.chunkId = chunkId;
        this.resolver = resolver;
        this.graph = graph;
        this.diagnostics = diagnostics;
    }

    /**
     * Locates the module map object literal in the parsed {@code (<map>, 0)} wrapper.
     *
     * @param root The parsed {@code SCRIPT}.
     * @return The {@code OBJECTLIT}, or empty if the tree does not have the expected shape.
     */
    public static Optional<Node> locateModuleMap(Node root) {
        if (root == null || !root.isScript() || !root.hasOneChild()) {
            return Optional.empty();
        }
        Node statement = root.getFirstChild();
        if (!statement.isExprResult() || !statement.getFirstChild().isComma()) {
            return Optional.empty();
        }
        Node first = statement.getFirstChild();
        while (first.isComma()) {
            first = first.getFirstChild();
        }
        return first.isObjectLit() ? Optional.of(first) : Optional.empty();
    }

    /**
     * Validates one module map entry.
     *
     * @param property A child of the module map object literal.
     * @return The descriptor, or empty if the entry was reported and skipped.
     */
    public Optional<ModuleDescriptor> read(Node property) {
        if (!property.isStringKey()) {
            diagnostics.warn("Chunk module is not an object property: {}", property.getToken());
            return Optional.empty();
        }

        String rawKey = property.getString();
        if (!NUMERIC_KEY.matcher(rawKey).matches()) {
            Matcher fusion = FUSION_KEY.matcher(rawKey);
            if (fusion.matches()) {
                diagnostics.forFusionModule(Integer.parseInt(fusion.group(1)))
                        .warn("Fusion modules not implemented");
            } else {
                diagnostics.warn("Invalid chunk module key: {}", rawKey);
            }
            return Optional.empty();
        }

        ModuleId moduleId = resolver.resolve(rawKey);
        DiagnosticsEngine.Scope moduleDiagnostics = diagnostics.forModule(moduleId);
        if (graph != null) {
            graph.mergeNode(moduleId, Map.of(ModuleGraph.CHUNK_ID, chunkId));
        }

        Node factory = property.getFirstChild();
        if (factory == null || !factory.isFunction()) {
            moduleDiagnostics.warn("Invalid chunk module value: {}",
                    factory == null ? "shorthand" : factory.getToken());
            return Optional.empty();
        }

        Node paramList = NodeUtil.getFunctionParameters(factory);
        if (paramList.getChildCount() > ModuleFunctionParams.MAX_PARAMS) {
            moduleDiagnostics.warn("Too many chunk module function params: {}", paramList.getChildCount());
            return Optional.empty();
        }

        List<String> paramNames = new ArrayList<>();
        for (Node param = paramList.getFirstChild(); param != null; param = param.getNext()) {
            if (!param.isName()) {
                moduleDiagnostics.warn("Invalid chunk module function param: {}", param.getToken());
                return Optional.empty();
            }
            paramNames.add(param.getString());
        }

        Optional<String> conflict = params.accept(paramNames);
        if (conflict.isPresent()) {
            moduleDiagnostics.warn("Invalid chunk module function param: {} (expected {})",
                    conflict.get(), params);
            return Optional.empty();
        }

        Node body = NodeUtil.getFunctionBody(factory);
        if (!body.isBlock()) {
            moduleDiagnostics.warn("Invalid chunk module function body: {}", body.getToken());
            return Optional.empty();
        }

        return Optional.of(new ModuleDescriptor(moduleId, rawKey, factory, body));
    }

    /**
     * The chunk's parameter contract as fixed so far.
     */
    public ModuleFunctionParams params() {
        return params;
    }
}
