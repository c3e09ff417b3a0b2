package org.unbundle.splitter.frontend.semantics;

import com.google.javascript.jscomp.parsing.parser.util.SourcePosition;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.NonJSDocComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unbundle.splitter.SplitterOptions;
import org.unbundle.splitter.frontend.pass.IModulePass;
import org.unbundle.splitter.frontend.pass.ModuleContext;

import java.util.Map;

/**
 * Numbers the bindings of a module and optionally marks and renames them.
 *
 * <p>Indices are assigned in declaration order on the rewritten tree, so they are stable for a
 * given input and can key the caller's {@code renameVariables} table. Declarations can be marked
 * with a {@code Variable dec N} block comment and references with {@code Variable ref N}.</p>
 */
public final class VariableAnnotator implements IModulePass {

    private static final Logger log = LoggerFactory.getLogger(VariableAnnotator.class);

    /** Generated comments have no place in the input. */
    private static final SourcePosition SYNTHETIC = new SourcePosition(null, 0, 0, 0);

    @Override
    public boolean isEnabled(ModuleContext context) {
        SplitterOptions options = context.options();
        return options.includeVariableDeclarationComments()
                || options.includeVariableReferenceComments()
                || !context.resolver().variableRenames(context.moduleId()).isEmpty();
    }

    @Override
    public void run(ModuleContext context) {
        SplitterOptions options = context.options();
        Map<Integer, String> renames = context.resolver().variableRenames(context.moduleId());
        ModuleBindings bindings = BindingCollector.collect(context.toolchain(), context.script());

        for (Binding binding : bindings.bindings()) {
            if (options.includeVariableDeclarationComments()) {
                comment(binding.declaration(), "Variable dec " + binding.index());
            }
            if (options.includeVariableReferenceComments()) {
                for (Node reference : binding.references()) {
                    comment(reference, "Variable ref " + binding.index());
                }
            }

            String requested = renames.get(binding.index());
            if (requested == null || requested.isBlank()) {
                continue;
            }
            String renameTo = ReservedWords.toBindingName(requested);
            String current = binding.name();
            if (current.equals(renameTo)) {
                continue;
            }
            if (bindings.isNameTaken(renameTo)) {
                context.diagnostics().warn("Cannot rename variable {} to {}, it is already bound", current, renameTo);
                continue;
            }
            bindings.rename(binding, renameTo);
            log.debug("Renamed variable {} to {} in module {}", current, renameTo, context.moduleId());
        }
    }

    private static void comment(Node node, String text) {
        node.setNonJSDocComment(new NonJSDocComment(SYNTHETIC, SYNTHETIC, "/* " + text + " */"));
    }
}
