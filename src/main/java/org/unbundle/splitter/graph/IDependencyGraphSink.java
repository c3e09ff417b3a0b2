package org.unbundle.splitter.graph;

import org.unbundle.splitter.api.ModuleId;

import java.util.Map;

/**
 * Mutation contract of the dependency graph the splitter writes module and edge facts into.
 *
 * <p>Both operations must be idempotent. Implementations shared between chunks that are split
 * concurrently must serialize their own mutations.</p>
 */
public interface IDependencyGraphSink {

    /**
     * Inserts a node, or merges the given attributes into an existing node.
     *
     * @param id         The module id.
     * @param attributes Attributes to set; existing attributes not named here are kept.
     */
    void mergeNode(ModuleId id, Map<String, Object> attributes);

    /**
     * Inserts a node without attributes, or leaves an existing node unchanged.
     */
    default void mergeNode(ModuleId id) {
        mergeNode(id, Map.of());
    }

    /**
     * Inserts a directed edge from the importing module to the imported module.
     * Inserting an existing edge is a no-op.
     */
    void addEdge(ModuleId from, ModuleId to);
}
