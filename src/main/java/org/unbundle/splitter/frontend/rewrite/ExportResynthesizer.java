package org.unbundle.splitter.frontend.rewrite;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.frontend.idiom.BundlerIdiom;
import org.unbundle.splitter.frontend.module.ModuleFunctionParams;
import org.unbundle.splitter.frontend.pass.IModulePass;
import org.unbundle.splitter.frontend.pass.ModuleContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rewrites {@code require.d(exports, { name: () => local })} into native export declarations.
 *
 * <p>Each getter entry becomes {@code export { local as name };} (or {@code export default local;}
 * for the {@code default} key), inserted before the statement holding the call. The call itself is
 * then removed, or replaced by {@code void 0} when it is part of a larger expression.</p>
 */
public final class ExportResynthesizer implements IModulePass {

    private static final String DEFAULT_EXPORT = "default";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final ModuleFunctionParams params;

    public ExportResynthesizer(ModuleFunctionParams params) {
        this.params = params;
    }

    @Override
    public void run(ModuleContext context) {
        List<Node> definitions = new ArrayList<>();
        context.toolchain().traverse(context.script(), new NodeTraversal.AbstractPostOrderCallback() {
            @Override
            public void visit(NodeTraversal t, Node n, Node parent) {
                if (n.isCall() && context.matcher().match(n, t.getScope()) instanceof BundlerIdiom.ExportDefinition) {
                    definitions.add(n);
                }
            }
        });

        for (Node call : definitions) {
            rewrite(call, context);
        }
    }

    private void rewrite(Node call, ModuleContext context) {
        DiagnosticsEngine.Scope diagnostics = context.diagnostics();
        int argumentCount = call.getChildCount() - 1;
        if (argumentCount != 2) {
            diagnostics.warn("Invalid export arguments: {}", argumentCount);
            return;
        }

        Node target = call.getSecondChild();
        if (!target.isName() || !target.getString().equals(params.exports().orElse(null))) {
            diagnostics.warn("Invalid export first argument: {}", target.getToken());
            return;
        }

        Node getters = target.getNext();
        if (!getters.isObjectLit()) {
            diagnostics.warn("Invalid exports: {}", getters.getToken());
            return;
        }

        Node statement = NodeUtil.getEnclosingStatement(call);
        if (statement == null || statement.getParent() != context.moduleBody()) {
            diagnostics.warn("Export definition is not at module level");
            return;
        }

        for (Node entry = getters.getFirstChild(); entry != null; entry = entry.getNext()) {
            String local = exportedLocal(entry, diagnostics);
            if (local == null) {
                continue;
            }
            String exportAs = entry.getString();
            diagnostics.info("Rewriting export {} as {}", local, exportAs);
            Node export = DEFAULT_EXPORT.equals(exportAs)
                    ? ModuleSyntax.exportDefault(IR.name(local))
                    : ModuleSyntax.exportNamed(local, exportAs);
            export.srcrefTree(statement).insertBefore(statement);
        }

        Node parent = call.getParent();
        if (parent.isExprResult()) {
            parent.detach();
        } else {
            call.replaceWith(ModuleSyntax.undefinedValue().srcrefTree(call));
        }
    }

    /**
     * Returns the local name an export getter returns, or null if the entry is not supported.
     */
    private static String exportedLocal(Node entry, DiagnosticsEngine.Scope diagnostics) {
        if (!entry.isStringKey()) {
            diagnostics.warn("Invalid export: {}", entry.getToken());
            return null;
        }
        if (!IDENTIFIER.matcher(entry.getString()).matches()) {
            diagnostics.warn("Invalid export property key: {}", entry.getString());
            return null;
        }

        Node getter = entry.getFirstChild();
        if (!getter.isFunction()) {
            diagnostics.warn("Invalid export property value: {}", getter.getToken());
            return null;
        }
        int paramCount = NodeUtil.getFunctionParameters(getter).getChildCount();
        if (paramCount > 0) {
            diagnostics.warn("Invalid export property value params: {}", paramCount);
            return null;
        }

        Node body = NodeUtil.getFunctionBody(getter);
        if (!body.isBlock()) {
            if (body.isName()) {
                return body.getString();
            }
            diagnostics.warn("Invalid export property value body: {}", body.getToken());
            return null;
        }

        if (!body.hasChildren()) {
            diagnostics.warn("Void exports not implemented");
            return null;
        }
        if (!body.hasOneChild()) {
            diagnostics.warn("Invalid export property value body: {} statements", body.getChildCount());
            return null;
        }
        Node returned = body.getFirstChild();
        if (!returned.isReturn()) {
            diagnostics.warn("Invalid export property value body: {}", returned.getToken());
            return null;
        }
        if (!returned.hasChildren()) {
            diagnostics.warn("Void exports not implemented");
            return null;
        }
        if (!returned.getFirstChild().isName()) {
            diagnostics.warn("Invalid export property value body: {}", returned.getFirstChild().getToken());
            return null;
        }
        return returned.getFirstChild().getString();
    }
}
