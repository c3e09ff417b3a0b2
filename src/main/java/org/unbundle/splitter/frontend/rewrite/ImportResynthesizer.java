package org.unbundle.splitter.frontend.rewrite;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.api.ModuleId;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.frontend.pass.IModulePass;
import org.unbundle.splitter.frontend.pass.ModuleContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites webpack module loads into {@code require}, dynamic {@code import()} or static
 * {@code import} declarations.
 *
 * <p>Recognized loads are {@code require(id)} and the chunk-load forms ending in
 * {@code .then(() => require(id))}. A load that initializes a top-level {@code const x = ...}
 * (optionally followed by one property access) in an ES module becomes a static import; any
 * other load becomes {@code require("./id")} when {@code await} is not available, or
 * {@code await import("./id")} otherwise. Every load is recorded as an edge of the module.</p>
 */
public final class ImportResynthesizer implements IModulePass {

    private enum SiteKind {
        /** The load is used as a plain expression. */
        EXPRESSION,
        /** {@code const x = load} */
        NAMESPACE_DECLARATOR,
        /** {@code const x = load.name} */
        MEMBER_DECLARATOR
    }

    /**
     * A recognized load, collected during traversal and rewritten afterwards.
     *
     * @param kind       How the load is used.
     * @param load       The matched load expression.
     * @param declarator The {@code NAME} or {@code DESTRUCTURING_LHS} being initialized, or null.
     * @param access     The property access wrapping the load, or null.
     * @param rawId      The module id as written in the bundle.
     */
    private record LoadSite(SiteKind kind, Node load, Node declarator, Node access, String rawId) {}

    @Override
    public void run(ModuleContext context) {
        List<LoadSite> sites = new ArrayList<>();
        context.toolchain().traverse(context.script(), new NodeTraversal.AbstractPreOrderCallback() {
            @Override
            public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
                Optional<LoadSite> site = matchSite(n, parent, t, context);
                if (site.isPresent()) {
                    sites.add(site.get());
                    return false;
                }
                return true;
            }
        });

        for (LoadSite site : sites) {
            ModuleId target = context.recordImport(site.rawId());
            switch (site.kind()) {
                case EXPRESSION -> rewriteExpression(site.load(), target, context);
                case NAMESPACE_DECLARATOR, MEMBER_DECLARATOR -> rewriteDeclarator(site, target, context);
            }
        }
    }

    private static Optional<LoadSite> matchSite(Node n, Node parent, NodeTraversal t, ModuleContext context) {
        if (parent != null && NodeUtil.isNameDeclaration(parent) && (n.isName() || n.isDestructuringLhs())) {
            Node init = n.isName() ? n.getFirstChild() : n.getSecondChild();
            if (init == null) {
                return Optional.empty();
            }
            if (init.isCall()) {
                return context.matcher().matchModuleRequire(init, t.getScope())
                        .map(id -> new LoadSite(SiteKind.NAMESPACE_DECLARATOR, init, n, null, id));
            }
            if ((init.isGetProp() || init.isGetElem()) && init.getFirstChild().isCall()) {
                Node load = init.getFirstChild();
                return context.matcher().matchModuleRequire(load, t.getScope())
                        .map(id -> new LoadSite(SiteKind.MEMBER_DECLARATOR, load, n, init, id));
            }
            return Optional.empty();
        }
        if (n.isCall()) {
            return context.matcher().matchModuleRequire(n, t.getScope())
                    .map(id -> new LoadSite(SiteKind.EXPRESSION, n, null, null, id));
        }
        return Optional.empty();
    }

    private static void rewriteExpression(Node load, ModuleId target, ModuleContext context) {
        Node function = NodeUtil.getEnclosingFunction(load);
        boolean useRequire = context.isCommonJs() || (function != null && !function.isAsyncFunction());
        if (useRequire) {
            context.diagnostics().info("Rewriting import call to {} as require", target);
            load.replaceWith(ModuleSyntax.requireCall(target).srcrefTree(load));
        } else if (load.getParent().isAwait()) {
            context.diagnostics().info("Rewriting awaited import call to {} as dynamic import", target);
            load.replaceWith(ModuleSyntax.dynamicImport(target).srcrefTree(load));
        } else {
            context.diagnostics().info("Rewriting import call to {} as dynamic import", target);
            load.replaceWith(ModuleSyntax.awaitImport(target).srcrefTree(load));
        }
    }

    private static void rewriteDeclarator(LoadSite site, ModuleId target, ModuleContext context) {
        DiagnosticsEngine.Scope diagnostics = context.diagnostics();
        Node declarator = site.declarator();
        Node declaration = declarator.getParent();

        if (context.isCommonJs()) {
            diagnostics.info("Rewriting import of {} as require", target);
            site.load().replaceWith(ModuleSyntax.requireCall(target).srcrefTree(site.load()));
            return;
        }
        if (declaration.getParent() != context.moduleBody()) {
            rewriteExpression(site.load(), target, context);
            return;
        }
        if (!declarator.isName()) {
            diagnostics.warn("Non-identifier imports are not implemented, got: {}", declarator.getToken());
            rewriteExpression(site.load(), target, context);
            return;
        }

        String local = declarator.getString();
        Node importDeclaration;
        if (site.kind() == SiteKind.NAMESPACE_DECLARATOR) {
            diagnostics.info("Rewriting import of {} as namespace {}", target, local);
            importDeclaration = ModuleSyntax.importNamespace(local, target);
        } else {
            Node access = site.access();
            if (!access.isGetProp()) {
                diagnostics.warn("Non-identifier import accessors are not implemented, got: {}", access.getToken());
                rewriteExpression(site.load(), target, context);
                return;
            }
            diagnostics.info("Rewriting import of {}.{} as {}", target, access.getString(), local);
            importDeclaration = ModuleSyntax.importNamed(access.getString(), local, target);
        }

        importDeclaration.srcrefTree(declaration).insertBefore(declaration);
        declarator.detach();
        if (!declaration.hasChildren()) {
            declaration.detach();
        }
    }
}
