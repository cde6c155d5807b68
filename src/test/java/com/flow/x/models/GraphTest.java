package com.flow.x.models;

import com.flow.x.dto.BellmanFordResult;
import com.flow.x.dto.ShortestPaths;
import com.flow.x.exceptions.EdgeNotFoundException;
import com.flow.x.exceptions.GraphNotAcyclicException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphTest {
    private final Vertex<String> a = Vertex.of("a");
    private final Vertex<String> b = Vertex.of("b");
    private final Vertex<String> c = Vertex.of("c");
    private final Vertex<String> d = Vertex.of("d");
    private final Vertex<String> e = Vertex.of("e");

    private Graph<String> dag;

    @BeforeEach
    void setUp() {
        dag = new Graph<>();
        dag.addEdge(a, b, 3);
        dag.addEdge(a, c, 1);
        dag.addEdge(c, b, 1);
        dag.addEdge(b, d, 4);
        dag.addEdge(c, e, 5);
        dag.addEdge(d, e, 4);
    }

    @Test
    void addEdgeAddsBothEndpointsAndOverwritesWeight() {
        Graph<String> graph = new Graph<>();
        graph.addEdge(a, b);
        assertThat(graph.getVertices()).containsExactly(a, b);
        assertThat(graph.getWeight(a, b)).isZero();

        graph.addEdge(a, b, 7);
        assertThat(graph.getWeight(a, b)).isEqualTo(7);
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    void zeroWeightEdgeIsPresent() {
        Graph<String> graph = new Graph<>();
        graph.addEdge(a, b, 0);
        assertThat(graph.hasEdge(a, b)).isTrue();
        assertThat(graph.hasEdge(b, a)).isFalse();
    }

    @Test
    void getWeightOfAbsentEdgeFails() {
        assertThatThrownBy(() -> dag.getWeight(e, a)).isInstanceOf(EdgeNotFoundException.class);
    }

    @Test
    void removeEdgeKeepsVertices() {
        assertThat(dag.removeEdge(a, b)).isTrue();
        assertThat(dag.removeEdge(a, b)).isFalse();
        assertThat(dag.hasEdge(a, b)).isFalse();
        assertThat(dag.getVertices()).contains(a, b);
    }

    @Test
    void isolatedVertexHasNoChildren() {
        Vertex<String> lonely = Vertex.of("lonely");
        dag.addVertex(lonely);
        assertThat(dag.containsVertex(lonely)).isTrue();
        assertThat(dag.getChildren(lonely)).isEmpty();
    }

    @Test
    void copyIsIndependent() {
        Graph<String> copy = new Graph<>(dag);
        copy.addEdge(a, b, 100);
        copy.removeEdge(d, e);

        assertThat(dag.getWeight(a, b)).isEqualTo(3);
        assertThat(dag.hasEdge(d, e)).isTrue();
        assertThat(copy).isNotEqualTo(dag);
        assertThat(new Graph<>(dag)).isEqualTo(dag);
    }

    @Test
    void bfsFindsFewestEdges() {
        assertThat(dag.bfs(a, e)).containsExactly(a, c, e);
        assertThat(dag.bfs(a, a)).containsExactly(a);
    }

    @Test
    void searchesReturnEmptyWhenUnreachable() {
        assertThat(dag.bfs(e, a)).isEmpty();
        assertThat(dag.dfs(e, a)).isEmpty();
    }

    @Test
    void dfsFindsAValidPath() {
        List<Vertex<String>> path = dag.dfs(a, e);
        assertThat(path).startsWith(a).endsWith(e);
        for (int i = 0; i < path.size() - 1; i++) {
            assertThat(dag.hasEdge(path.get(i), path.get(i + 1))).isTrue();
        }
        assertThat(new HashSet<>(path)).hasSameSizeAs(path);
    }

    @Test
    void verifyAcyclicFromAcceptsDiamond() {
        dag.verifyAcyclicFrom(a);
    }

    @Test
    void verifyAcyclicFromRejectsReachableCycle() {
        dag.addEdge(e, c, 1);
        assertThatThrownBy(() -> dag.verifyAcyclicFrom(a)).isInstanceOf(GraphNotAcyclicException.class);
    }

    @Test
    void verifyAcyclicFromIgnoresUnreachableCycle() {
        Vertex<String> x = Vertex.of("x");
        Vertex<String> y = Vertex.of("y");
        dag.addEdge(x, y, 1);
        dag.addEdge(y, x, 1);
        dag.verifyAcyclicFrom(a);
    }

    @Test
    void dijkstraComputesShortestDistances() {
        ShortestPaths<String> paths = dag.dijkstraSssp(a);

        assertThat(paths.distanceTo(a)).isZero();
        assertThat(paths.distanceTo(b)).isEqualTo(2);
        assertThat(paths.distanceTo(c)).isEqualTo(1);
        assertThat(paths.distanceTo(d)).isEqualTo(6);
        assertThat(paths.distanceTo(e)).isEqualTo(6);
        assertThat(paths.pathTo(b)).containsExactly(a, c, b);
        assertThat(paths.getPredecessors()).doesNotContainKey(a);
    }

    @Test
    void dijkstraLeavesUnreachableAtInfinity() {
        Vertex<String> lonely = Vertex.of("lonely");
        dag.addVertex(lonely);
        ShortestPaths<String> paths = dag.dijkstraSssp(a);
        assertThat(paths.distanceTo(lonely)).isEqualTo(Graph.INFINITY);
        assertThat(paths.isReachable(lonely)).isFalse();
        assertThat(paths.pathTo(lonely)).isEmpty();
    }

    @Test
    void dijkstraRequiresAcyclicReachablePart() {
        dag.addEdge(d, a, 1);
        assertThatThrownBy(() -> dag.dijkstraSssp(a)).isInstanceOf(GraphNotAcyclicException.class);
    }

    @Test
    void bellmanFordMatchesDijkstraWithoutNegativeCycles() {
        BellmanFordResult<String> result = dag.bellmanFordSssp(a);

        assertThat(result.hasNegativeCycle()).isFalse();
        assertThat(result.getDistances()).isEqualTo(dag.dijkstraSssp(a).getDistances());
        assertThat(result.getPredecessors()).containsEntry(b, c).containsEntry(e, c);
    }

    @Test
    void bellmanFordHandlesNegativeEdges() {
        Graph<String> graph = new Graph<>();
        graph.addEdge(a, b, 4);
        graph.addEdge(a, c, 2);
        graph.addEdge(c, b, -3);

        BellmanFordResult<String> result = graph.bellmanFordSssp(a);
        assertThat(result.getDistances()).containsEntry(b, -1L);
    }

    @Test
    void bellmanFordReportsNegativeCycle() {
        Graph<String> graph = new Graph<>();
        graph.addEdge(a, b, 2);
        graph.addEdge(d, a, 2);
        graph.addEdge(a, c, -1);
        graph.addEdge(c, e, -2);
        graph.addEdge(e, a, 1);

        BellmanFordResult<String> result = graph.bellmanFordSssp(d);

        assertThat(result.hasNegativeCycle()).isTrue();
        assertThat(result.getDistances()).isNull();
        assertThat(result.getPredecessors()).isNull();
        List<Vertex<String>> cycle = result.getCycle();
        assertThat(cycle).containsExactly(a, c, e, a);
        assertThat(cycleWeight(graph, cycle)).isNegative();
    }

    @Test
    void findNegativeCycleSearchesWholeGraph() {
        Graph<String> graph = new Graph<>();
        graph.addEdge(a, b, 1);
        graph.addEdge(c, d, -2);
        graph.addEdge(d, c, 1);

        assertThat(graph.bellmanFordSssp(a).hasNegativeCycle()).isFalse();

        List<Vertex<String>> cycle = graph.findNegativeCycle();
        assertThat(cycle).hasSize(3);
        assertThat(cycle.get(0)).isEqualTo(cycle.get(2));
        assertThat(cycle).contains(c, d);
        assertThat(cycleWeight(graph, cycle)).isNegative();
    }

    @Test
    void findNegativeCycleIsEmptyOnNonNegativeGraph() {
        assertThat(dag.findNegativeCycle()).isEmpty();
    }

    @Test
    void relaxUpdatesDistancePredecessorAndQueue() {
        Map<Vertex<String>, Long> distances = new HashMap<>();
        distances.put(a, 0L);
        Map<Vertex<String>, Vertex<String>> predecessors = new HashMap<>();
        PriorityQueue<Graph.DistanceEntry<String>> queue = new PriorityQueue<>();

        assertThat(dag.relax(a, b, distances, predecessors, queue)).isTrue();
        assertThat(distances).containsEntry(b, 3L);
        assertThat(predecessors).containsEntry(b, a);
        assertThat(queue.peek()).isEqualTo(new Graph.DistanceEntry<>(3L, b));

        assertThat(dag.relax(a, b, distances)).isFalse();
        assertThat(dag.relax(d, e, distances)).isFalse();
    }

    @Test
    void serializeRoundTripKeepsWeights() {
        Map<String, Map<String, Integer>> serialized = dag.serialize();
        assertThat(serialized.get("a")).containsEntry("b", 3).containsEntry("c", 1);

        Graph<String> restored = Graph.deserialize(serialized);
        assertThat(restored.getEdges()).isEqualTo(dag.getEdges());
        assertThat(restored.getVertices()).containsExactlyInAnyOrderElementsOf(dag.getVertices());
    }

    private static long cycleWeight(Graph<String> graph, List<Vertex<String>> cycle) {
        long total = 0;
        for (int i = 0; i < cycle.size() - 1; i++) {
            total += graph.getWeight(cycle.get(i), cycle.get(i + 1));
        }
        return total;
    }
}
