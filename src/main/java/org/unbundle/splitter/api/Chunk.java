package org.unbundle.splitter.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The result of splitting one webpack chunk.
 *
 * @param chunkId The numeric chunk id captured from the push wrapper.
 * @param modules The successfully processed modules, in module-map declaration order.
 */
public record Chunk(int chunkId, Map<ModuleId, ChunkModule> modules) {

    public Chunk {
        modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
    }

    /**
     * Looks up a module by its resolved id.
     */
    public Optional<ChunkModule> module(String moduleId) {
        return Optional.ofNullable(modules.get(new ModuleId(moduleId)));
    }
}
