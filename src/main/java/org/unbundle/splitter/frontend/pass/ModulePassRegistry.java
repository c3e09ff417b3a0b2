package org.unbundle.splitter.frontend.pass;

import org.unbundle.splitter.frontend.module.ModuleFunctionParams;
import org.unbundle.splitter.frontend.rewrite.DefaultExportRewriter;
import org.unbundle.splitter.frontend.rewrite.ExportResynthesizer;
import org.unbundle.splitter.frontend.rewrite.ImportResynthesizer;
import org.unbundle.splitter.frontend.semantics.ScopeRenamer;
import org.unbundle.splitter.frontend.semantics.VariableAnnotator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of the passes applied to every module.
 */
public final class ModulePassRegistry {

    private final List<IModulePass> passes = new ArrayList<>();

    /**
     * Appends a pass; it runs after all passes registered before it.
     *
     * @param pass The pass instance.
     */
    public void register(IModulePass pass) {
        passes.add(pass);
    }

    public List<IModulePass> passes() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * Creates a registry with the default pipeline: exports, imports, default exports,
     * specifier renaming, then variable annotation.
     *
     * @param params The chunk's factory parameter contract.
     * @return A fully initialized registry.
     */
    public static ModulePassRegistry initializeWithDefaults(ModuleFunctionParams params) {
        ModulePassRegistry registry = new ModulePassRegistry();
        registry.register(new ExportResynthesizer(params));
        registry.register(new ImportResynthesizer());
        registry.register(new DefaultExportRewriter());
        registry.register(new ScopeRenamer());
        registry.register(new VariableAnnotator());
        return registry;
    }
}
