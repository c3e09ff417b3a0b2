package org.unbundle.splitter.api;

/**
 * Identifies a bundled module by its key in the chunk's module map, after any
 * caller-supplied rename has been applied.
 * Used as a map key in {@link Chunk} and as the node key of the dependency graph.
 *
 * @param value The module key as written in the bundle, or its replacement name.
 */
public record ModuleId(String value) {

    public ModuleId {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Module id must not be empty");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
