package org.unbundle.splitter.frontend.semantics;

import com.google.javascript.rhino.Node;
import org.unbundle.splitter.frontend.pass.IModulePass;
import org.unbundle.splitter.frontend.pass.ModuleContext;

import java.util.Optional;

/**
 * Renames the local side of import and export specifiers to match their external names.
 *
 * <p>{@code import { useState as a }} makes {@code a} become {@code useState} throughout the
 * module, and {@code export { b as render }} makes {@code b} become {@code render}. Reserved
 * words get a {@code _} prefix. A rename that would collide with any other name declared in
 * the module, or with a global it references, is reported and skipped.</p>
 */
public final class ScopeRenamer implements IModulePass {

    @Override
    public void run(ModuleContext context) {
        ModuleBindings bindings = BindingCollector.collect(context.toolchain(), context.script());

        for (Node statement = context.moduleBody().getFirstChild(); statement != null; statement = statement.getNext()) {
            if (statement.isImport() && statement.getSecondChild().isImportSpecs()) {
                for (Node spec = statement.getSecondChild().getFirstChild(); spec != null; spec = spec.getNext()) {
                    alignLocal(spec.getLastChild(), spec.getFirstChild().getString(), "import", bindings, context);
                }
            } else if (statement.isExport() && statement.hasChildren() && statement.getFirstChild().isExportSpecs()) {
                for (Node spec = statement.getFirstChild().getFirstChild(); spec != null; spec = spec.getNext()) {
                    alignLocal(spec.getFirstChild(), spec.getLastChild().getString(), "export", bindings, context);
                }
            }
        }
    }

    private static void alignLocal(Node local, String external, String kind, ModuleBindings bindings,
                                   ModuleContext context) {
        String current = local.getString();
        if (current.equals(external)) {
            return;
        }
        String renameTo = ReservedWords.toBindingName(external);
        if (current.equals(renameTo)) {
            return;
        }

        Optional<Binding> binding = bindings.bindingOf(local);
        if (binding.isEmpty()) {
            context.diagnostics().warn("Cannot rename {} to match {}, it is not declared in the module", current, kind);
            return;
        }
        if (bindings.isNameTaken(renameTo)) {
            context.diagnostics().warn("Cannot rename local to match {}, {} is already bound", kind, renameTo);
            return;
        }

        bindings.rename(binding.get(), renameTo);
        context.diagnostics().info("Renamed local {} to match {}: {}", current, kind, renameTo);
    }
}
