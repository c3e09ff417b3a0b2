package org.unbundle.splitter.frontend.semantics;

import com.google.javascript.rhino.Node;

import java.util.List;

/**
 * One binding of a module, addressed by its index in {@link ModuleBindings}.
 *
 * @param index       Zero-based index in declaration order.
 * @param declaration The declaring {@code NAME} (or {@code IMPORT_STAR}) node.
 * @param references  Every other node that refers to this binding.
 */
public record Binding(int index, Node declaration, List<Node> references) {

    /**
     * The current name of the binding.
     */
    public String name() {
        return declaration.getString();
    }
}
