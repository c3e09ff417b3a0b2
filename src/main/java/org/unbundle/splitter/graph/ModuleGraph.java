package org.unbundle.splitter.graph;

import org.unbundle.splitter.api.ModuleId;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory dependency graph of bundled modules.
 *
 * <p>Nodes keep their insertion order and a mutable attribute map; edges are a set, so repeated
 * imports collapse into one edge. All mutations are serialized on this instance, which makes the
 * graph safe to share between chunks split on different threads.</p>
 */
public class ModuleGraph implements IDependencyGraphSink {

    /** Node attribute holding the id of the chunk that declares the module. */
    public static final String CHUNK_ID = "chunkId";
    /** Node attribute used by renderers to pick a node shape. */
    public static final String TYPE = "type";
    /** Value of {@link #TYPE} for CommonJS modules. */
    public static final String COMMON_JS_TYPE = "square";

    /**
     * A directed edge.
     *
     * @param source The importing module.
     * @param target The imported module.
     */
    public record Edge(ModuleId source, ModuleId target) {}

    private final Map<ModuleId, Map<String, Object>> nodes = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();

    @Override
    public synchronized void mergeNode(ModuleId id, Map<String, Object> attributes) {
        nodes.computeIfAbsent(id, k -> new LinkedHashMap<>()).putAll(attributes);
    }

    @Override
    public synchronized void addEdge(ModuleId from, ModuleId to) {
        nodes.computeIfAbsent(from, k -> new LinkedHashMap<>());
        nodes.computeIfAbsent(to, k -> new LinkedHashMap<>());
        edges.add(new Edge(from, to));
    }

    public synchronized boolean hasNode(ModuleId id) {
        return nodes.containsKey(id);
    }

    public synchronized boolean hasEdge(ModuleId from, ModuleId to) {
        return edges.contains(new Edge(from, to));
    }

    /**
     * Returns a copy of a node's attributes, or an empty map if the node does not exist.
     */
    public synchronized Map<String, Object> attributes(ModuleId id) {
        Map<String, Object> attributes = nodes.get(id);
        return attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Returns the node ids in insertion order.
     */
    public synchronized List<ModuleId> nodes() {
        return List.copyOf(nodes.keySet());
    }

    /**
     * Returns the edges in insertion order.
     */
    public synchronized List<Edge> edges() {
        return List.copyOf(edges);
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    public synchronized int edgeCount() {
        return edges.size();
    }
}
