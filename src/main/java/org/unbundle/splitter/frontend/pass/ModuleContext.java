package org.unbundle.splitter.frontend.pass;

import com.google.javascript.rhino.Node;
import org.unbundle.splitter.SplitterOptions;
import org.unbundle.splitter.api.ModuleId;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.frontend.classify.ModuleKind;
import org.unbundle.splitter.frontend.idiom.IdiomMatcher;
import org.unbundle.splitter.frontend.module.ModuleResolver;
import org.unbundle.splitter.graph.IDependencyGraphSink;
import org.unbundle.splitter.js.JsToolchain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-module state shared by the {@link IModulePass}es of one module.
 *
 * <p>The module tree is a {@code SCRIPT > MODULE_BODY} holding the statements lifted out of the
 * module factory. The kind is decided before the first pass runs and never changes.</p>
 */
public final class ModuleContext {

    private final ModuleId moduleId;
    private final Node script;
    private final ModuleKind kind;
    private final JsToolchain toolchain;
    private final IdiomMatcher matcher;
    private final ModuleResolver resolver;
    private final IDependencyGraphSink graph;
    private final SplitterOptions options;
    private final DiagnosticsEngine.Scope diagnostics;
    private final Set<ModuleId> importedModules = new LinkedHashSet<>();

    public ModuleContext(ModuleId moduleId, Node script, ModuleKind kind, JsToolchain toolchain,
                         IdiomMatcher matcher, ModuleResolver resolver, SplitterOptions options,
                         DiagnosticsEngine.Scope diagnostics) {
        this.moduleId = moduleId;
        this.script = script;
        this.kind = kind;
        this.toolchain = toolchain;
        this.matcher = matcher;
        this.resolver = resolver;
        this.graph = options.graph();
        this.options = options;
        this.diagnostics = diagnostics;
    }

    /**
     * Records an import of another module and mirrors it into the graph.
     *
     * @param rawModuleId The imported id as written in the bundle.
     * @return The resolved id of the imported module.
     */
    public ModuleId recordImport(String rawModuleId) {
        ModuleId target = resolver.resolve(rawModuleId);
        importedModules.add(target);
        if (graph != null) {
            graph.mergeNode(target);
            graph.addEdge(moduleId, target);
        }
        return target;
    }

    public ModuleId moduleId() {
        return moduleId;
    }

    public Node script() {
        return script;
    }

    public Node moduleBody() {
        return script.getFirstChild();
    }

    public ModuleKind kind() {
        return kind;
    }

    public boolean isCommonJs() {
        return kind.isCommonJs();
    }

    public JsToolchain toolchain() {
        return toolchain;
    }

    public IdiomMatcher matcher() {
        return matcher;
    }

    public ModuleResolver resolver() {
        return resolver;
    }

    public SplitterOptions options() {
        return options;
    }

    public DiagnosticsEngine.Scope diagnostics() {
        return diagnostics;
    }

    /**
     * Distinct imported modules in first-seen order.
     */
    public List<ModuleId> importedModules() {
        return List.copyOf(importedModules);
    }
}
