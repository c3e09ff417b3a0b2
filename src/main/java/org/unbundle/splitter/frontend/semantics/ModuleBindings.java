package org.unbundle.splitter.frontend.semantics;

import com.google.javascript.rhino.Node;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arena of the bindings declared in one module tree, indexed in declaration order.
 *
 * <p>Every declaration and reference node is mapped to the index of its binding, so renames and
 * annotations are applied without further scope queries. Names referenced but never declared
 * in the module (globals) are kept as free names; they take part in collision checks.</p>
 */
public final class ModuleBindings {

    private final List<Binding> bindings;
    private final Map<Node, Integer> indexByNode = new IdentityHashMap<>();
    private final Set<String> freeNames;

    ModuleBindings(List<Binding> bindings, Set<String> freeNames) {
        this.bindings = List.copyOf(bindings);
        this.freeNames = Set.copyOf(freeNames);
        for (Binding binding : this.bindings) {
            indexByNode.put(binding.declaration(), binding.index());
            for (Node reference : binding.references()) {
                indexByNode.put(reference, binding.index());
            }
        }
    }

    public List<Binding> bindings() {
        return Collections.unmodifiableList(bindings);
    }

    public int size() {
        return bindings.size();
    }

    public Binding get(int index) {
        return bindings.get(index);
    }

    /**
     * Finds the binding a declaration or reference node belongs to.
     */
    public Optional<Binding> bindingOf(Node nameNode) {
        Integer index = indexByNode.get(nameNode);
        return index == null ? Optional.empty() : Optional.of(bindings.get(index));
    }

    public Set<String> freeNames() {
        return freeNames;
    }

    /**
     * Checks whether a name is declared anywhere in the module or referenced as a global.
     */
    public boolean isNameTaken(String name) {
        if (freeNames.contains(name)) {
            return true;
        }
        for (Binding binding : bindings) {
            if (binding.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renames a binding at its declaration and all references.
     * Import and export specifiers and shorthand properties are kept consistent with the new name.
     */
    public void rename(Binding binding, String newName) {
        renameNode(binding.declaration(), newName);
        for (Node reference : binding.references()) {
            renameNode(reference, newName);
        }
    }

    private static void renameNode(Node node, String newName) {
        node.setString(newName);
        Node parent = node.getParent();
        if (parent == null) {
            return;
        }
        if (parent.isImportSpec() || parent.isExportSpec()) {
            boolean shorthand = parent.getFirstChild().getString().equals(parent.getLastChild().getString());
            parent.putBooleanProp(Node.IS_SHORTHAND_PROPERTY, shorthand);
            return;
        }
        Node key = parent.isDefaultValue() ? parent.getParent() : parent;
        if (key != null && key.isStringKey()) {
            key.putBooleanProp(Node.IS_SHORTHAND_PROPERTY, false);
        }
    }
}
