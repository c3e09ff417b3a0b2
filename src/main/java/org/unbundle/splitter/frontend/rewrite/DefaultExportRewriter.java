package org.unbundle.splitter.frontend.rewrite;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.frontend.idiom.BundlerIdiom;
import org.unbundle.splitter.frontend.pass.IModulePass;
import org.unbundle.splitter.frontend.pass.ModuleContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites {@code <module>.exports = X} assignments.
 *
 * <p>CommonJS modules (and ES modules when ES default exports are disabled) keep the assignment
 * with the parameter renamed to {@code module}. In an ES module a top-level assignment statement
 * becomes {@code export default X;}; an assignment nested in a larger top-level expression is
 * hoisted into {@code const _exports = X; export default _exports;}. Assignments inside functions
 * or blocks cannot carry an {@code export} and keep the CommonJS form.</p>
 */
public final class DefaultExportRewriter implements IModulePass {

    private static final String EXPORTS_TEMP = "_exports";

    @Override
    public void run(ModuleContext context) {
        List<BundlerIdiom.DefaultExportAssignment> assignments = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        context.toolchain().traverse(context.script(), new NodeTraversal.AbstractPostOrderCallback() {
            @Override
            public void visit(NodeTraversal t, Node n, Node parent) {
                if (n.isName() || n.isImportStar()) {
                    usedNames.add(n.getString());
                } else if (n.isAssign()
                        && context.matcher().match(n, t.getScope()) instanceof BundlerIdiom.DefaultExportAssignment assignment) {
                    assignments.add(assignment);
                }
            }
        });

        boolean esmDefaultExports = context.options().esmDefaultExports();
        for (BundlerIdiom.DefaultExportAssignment assignment : assignments) {
            if (context.isCommonJs() || !esmDefaultExports) {
                context.diagnostics().info("Rewriting default export as CommonJS");
                retarget(assignment.assignment());
            } else {
                rewriteAsExport(assignment, usedNames, context);
            }
        }
    }

    private static void rewriteAsExport(BundlerIdiom.DefaultExportAssignment assignment, Set<String> usedNames,
                                        ModuleContext context) {
        Node assign = assignment.assignment();
        Node statement = NodeUtil.getEnclosingStatement(assign);
        if (statement == null || statement.getParent() != context.moduleBody()
                || NodeUtil.getEnclosingFunction(assign) != null) {
            context.diagnostics().info("Default export is not at module level, keeping CommonJS form");
            retarget(assign);
            return;
        }

        context.diagnostics().info("Rewriting default export");
        Node value = assignment.value().detach();
        if (statement == assign.getParent() && statement.isExprResult()) {
            statement.replaceWith(ModuleSyntax.exportDefault(value).srcrefTree(statement));
            return;
        }

        String temp = uniqueName(usedNames);
        IR.constNode(IR.name(temp), value).srcrefTree(statement).insertBefore(statement);
        ModuleSyntax.exportDefault(IR.name(temp)).srcrefTree(statement).insertBefore(statement);
        assign.replaceWith(IR.name(temp).srcref(assign));
    }

    // e.exports = X -> module.exports = X
    private static void retarget(Node assign) {
        Node target = assign.getFirstChild();
        target.replaceWith(ModuleSyntax.moduleExports().srcrefTree(target));
    }

    private static String uniqueName(Set<String> usedNames) {
        String name = EXPORTS_TEMP;
        for (int i = 2; usedNames.contains(name); i++) {
            name = EXPORTS_TEMP + i;
        }
        usedNames.add(name);
        return name;
    }
}
