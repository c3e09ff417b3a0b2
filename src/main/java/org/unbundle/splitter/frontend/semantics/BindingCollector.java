package org.unbundle.splitter.frontend.semantics;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.Var;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.js.JsToolchain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link ModuleBindings} for a module tree with the Closure scope creator.
 */
public final class BindingCollector extends NodeTraversal.AbstractPreOrderCallback {

    private final List<Node> declarations = new ArrayList<>();
    private final Map<Node, List<Node>> referencesByDeclaration = new IdentityHashMap<>();
    private final Set<String> freeNames = new HashSet<>();

    private BindingCollector() {}

    /**
     * Collects the bindings of a module tree.
     *
     * @param toolchain    The chunk's toolchain.
     * @param moduleScript The module's {@code SCRIPT} node.
     * @return The binding arena, indexed in declaration order.
     */
    public static ModuleBindings collect(JsToolchain toolchain, Node moduleScript) {
        BindingCollector collector = new BindingCollector();
        toolchain.traverse(moduleScript, collector);

        List<Binding> bindings = new ArrayList<>(collector.declarations.size());
        for (Node declaration : collector.declarations) {
            List<Node> references = collector.referencesByDeclaration.getOrDefault(declaration, List.of());
            bindings.add(new Binding(bindings.size(), declaration, List.copyOf(references)));
        }
        return new ModuleBindings(bindings, collector.freeNames);
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
        if (n.isImportStar()) {
            visitName(t, n);
        } else if (n.isName() && !isExternalSpecifierName(n, parent)) {
            visitName(t, n);
        }
        return true;
    }

    private void visitName(NodeTraversal t, Node n) {
        String name = n.getString();
        if (name.isEmpty()) {
            return;
        }
        Var var = t.getScope().getVar(name);
        if (var == null) {
            freeNames.add(name);
            return;
        }
        Node declaration = var.getNameNode();
        if (declaration == null) {
            return;
        }
        if (declaration == n) {
            declarations.add(n);
        } else {
            referencesByDeclaration.computeIfAbsent(declaration, k -> new ArrayList<>()).add(n);
        }
    }

    // import { external as local }, export { local as external }
    private static boolean isExternalSpecifierName(Node n, Node parent) {
        if (parent == null) {
            return false;
        }
        if (parent.isImportSpec()) {
            return n == parent.getFirstChild();
        }
        if (parent.isExportSpec()) {
            return n == parent.getLastChild();
        }
        return false;
    }
}
