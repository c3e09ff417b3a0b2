package org.unbundle.splitter.api;

import com.google.javascript.rhino.Node;

import java.util.List;

/**
 * One module split out of a chunk.
 *
 * @param id              The resolved module identity.
 * @param tree            The rewritten syntax tree (a Closure {@code SCRIPT} node).
 * @param sourceText      The printed source of {@code tree}.
 * @param commonJs        {@code true} if the module was classified as CommonJS.
 * @param importedModules Distinct imported module ids, in the order they were first seen.
 */
public record ChunkModule(
        ModuleId id,
        Node tree,
        String sourceText,
        boolean commonJs,
        List<ModuleId> importedModules
) {

    public ChunkModule {
        importedModules = List.copyOf(importedModules);
    }

    /**
     * Short kind label used in output headers.
     */
    public String kindLabel() {
        return commonJs ? "CJS" : "ESM";
    }
}
