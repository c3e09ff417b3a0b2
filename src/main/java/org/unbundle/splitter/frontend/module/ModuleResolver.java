package org.unbundle.splitter.frontend.module;

import org.unbundle.splitter.api.ModuleId;
import org.unbundle.splitter.api.ModuleTransformation;

import java.util.Map;

/**
 * Resolves raw bundle keys to module ids through the caller's rename table.
 */
public final class ModuleResolver {

    private final Map<String, ModuleTransformation> transformations;

    public ModuleResolver(Map<String, ModuleTransformation> transformations) {
        this.transformations = transformations == null ? Map.of() : transformations;
    }

    /**
     * Resolves a raw key (as written in the bundle) to its module id.
     */
    public ModuleId resolve(String rawId) {
        ModuleTransformation transformation = transformations.get(rawId);
        if (transformation != null && transformation.renameModule() != null
                && !transformation.renameModule().isBlank()) {
            return new ModuleId(transformation.renameModule());
        }
        return new ModuleId(rawId);
    }

    /**
     * Returns the variable rename table for a resolved module, keyed by variable index.
     * A module renamed through {@code renameModule} is found under either name.
     */
    public Map<Integer, String> variableRenames(ModuleId moduleId) {
        ModuleTransformation transformation = transformations.get(moduleId.value());
        if (transformation == null) {
            transformation = transformations.values().stream()
                    .filter(t -> moduleId.value().equals(t.renameModule()))
                    .findFirst()
                    .orElse(null);
        }
        return transformation == null ? Map.of() : transformation.renameVariables();
    }
}
