package org.unbundle.splitter.api;

import java.util.Map;

/**
 * Caller-supplied adjustments for a single module.
 *
 * @param renameModule    Replacement module id, or {@code null} to keep the bundle key.
 * @param renameVariables Replacement names keyed by variable index (see the variable annotator).
 */
public record ModuleTransformation(String renameModule, Map<Integer, String> renameVariables) {

    public ModuleTransformation {
        renameVariables = renameVariables == null ? Map.of() : Map.copyOf(renameVariables);
    }

    public static ModuleTransformation renameModule(String name) {
        return new ModuleTransformation(name, Map.of());
    }

    public static ModuleTransformation renameVariables(Map<Integer, String> names) {
        return new ModuleTransformation(null, names);
    }
}
