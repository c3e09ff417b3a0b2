package org.unbundle.splitter.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.unbundle.splitter.api.ModuleId;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes a {@link ModuleGraph} in the graphology JSON format read by graph renderers.
 *
 * <pre>
 * {"options": {"type": "directed", "multi": true},
 *  "nodes": [{"key": "123", "attributes": {"chunkId": 7}}],
 *  "edges": [{"source": "123", "target": "456"}]}
 * </pre>
 */
public final class GraphJsonExporter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Converts a graph to its JSON tree.
     */
    public JsonObject toJson(ModuleGraph graph) {
        JsonObject options = new JsonObject();
        options.addProperty("type", "directed");
        options.addProperty("multi", true);
        options.addProperty("allowSelfLoops", true);

        JsonArray nodes = new JsonArray();
        for (ModuleId id : graph.nodes()) {
            JsonObject node = new JsonObject();
            node.addProperty("key", id.value());
            JsonObject attributes = new JsonObject();
            for (Map.Entry<String, Object> attribute : graph.attributes(id).entrySet()) {
                attributes.add(attribute.getKey(), gson.toJsonTree(attribute.getValue()));
            }
            node.add("attributes", attributes);
            nodes.add(node);
        }

        JsonArray edges = new JsonArray();
        for (ModuleGraph.Edge edge : graph.edges()) {
            JsonObject json = new JsonObject();
            json.addProperty("source", edge.source().value());
            json.addProperty("target", edge.target().value());
            edges.add(json);
        }

        JsonObject root = new JsonObject();
        root.add("options", options);
        root.add("nodes", nodes);
        root.add("edges", edges);
        return root;
    }

    public String toJsonString(ModuleGraph graph) {
        return gson.toJson(toJson(graph));
    }

    /**
     * Writes the graph to a file, creating parent directories as needed.
     *
     * @throws IOException if the file cannot be written.
     */
    public void write(ModuleGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(toJson(graph), writer);
        }
    }
}
