package org.unbundle.splitter.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unbundle.splitter.api.ModuleId;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModuleGraphTest {

    private static final ModuleId A = new ModuleId("1");
    private static final ModuleId B = new ModuleId("2");

    @Test
    void mergeNodeIsIdempotentAndMergesAttributes() {
        ModuleGraph graph = new ModuleGraph();

        graph.mergeNode(A, Map.of(ModuleGraph.CHUNK_ID, 7));
        graph.mergeNode(A);
        graph.mergeNode(A, Map.of(ModuleGraph.TYPE, ModuleGraph.COMMON_JS_TYPE));

        assertThat(graph.nodeCount()).isEqualTo(1);
        assertThat(graph.attributes(A))
                .containsEntry(ModuleGraph.CHUNK_ID, 7)
                .containsEntry(ModuleGraph.TYPE, ModuleGraph.COMMON_JS_TYPE);
    }

    @Test
    void addEdgeIsIdempotentAndCreatesEndpoints() {
        ModuleGraph graph = new ModuleGraph();

        graph.addEdge(A, B);
        graph.addEdge(A, B);

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.hasEdge(A, B)).isTrue();
        assertThat(graph.hasEdge(B, A)).isFalse();
        assertThat(graph.nodes()).containsExactly(A, B);
        assertThat(graph.attributes(B)).isEmpty();
    }

    @Test
    void selfLoopsAreAllowed() {
        ModuleGraph graph = new ModuleGraph();

        graph.addEdge(A, A);

        assertThat(graph.hasEdge(A, A)).isTrue();
        assertThat(graph.nodeCount()).isEqualTo(1);
    }

    @Test
    void unknownNodeHasNoAttributes() {
        assertThat(new ModuleGraph().attributes(A)).isEmpty();
        assertThat(new ModuleGraph().hasNode(A)).isFalse();
    }

    @Test
    void concurrentMutationsAreNotLost() throws InterruptedException {
        ModuleGraph graph = new ModuleGraph();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    ModuleId from = new ModuleId("m" + i);
                    graph.mergeNode(from, Map.of(ModuleGraph.CHUNK_ID, i % 3));
                    graph.addEdge(from, new ModuleId("m" + (i + 1)));
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(graph.nodeCount()).isEqualTo(501);
        assertThat(graph.edgeCount()).isEqualTo(500);
    }
}
