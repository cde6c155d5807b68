package com.flow.x.models;

import com.flow.x.dto.BellmanFordResult;
import com.flow.x.dto.ShortestPaths;
import com.flow.x.exceptions.EdgeNotFoundException;
import com.flow.x.exceptions.GraphNotAcyclicException;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Directed graph with integer edge weights, stored as a vertex set plus an adjacency map
 * {@code u -> (v -> weight)}.
 * <p>
 * Iteration follows insertion order for vertices, source vertices and each adjacency map, so every
 * traversal and shortest path run is deterministic for a given construction order. A weight of zero
 * is a present edge; an absent edge has no weight at all.
 * </p>
 *
 * @param <T> type of the vertex values
 */
@Slf4j
@EqualsAndHashCode
public class Graph<T extends Comparable<? super T>> {

    /** Distance of a vertex that has not been reached. */
    public static final long INFINITY = Long.MAX_VALUE;

    private final Set<Vertex<T>> vertices = new LinkedHashSet<>();
    private final Map<Vertex<T>, Map<Vertex<T>, Integer>> edges = new LinkedHashMap<>();

    public Graph() {
    }

    /**
     * Deep copy: the new graph shares no mapping with {@code other}.
     */
    public Graph(Graph<T> other) {
        vertices.addAll(other.vertices);
        other.edges.forEach((u, adjacent) -> edges.put(u, new LinkedHashMap<>(adjacent)));
    }

    public Set<Vertex<T>> getVertices() {
        return Collections.unmodifiableSet(vertices);
    }

    /**
     * Read-only view of the adjacency map.
     */
    public Map<Vertex<T>, Map<Vertex<T>, Integer>> getEdges() {
        Map<Vertex<T>, Map<Vertex<T>, Integer>> view = new LinkedHashMap<>();
        edges.forEach((u, adjacent) -> view.put(u, Collections.unmodifiableMap(adjacent)));
        return Collections.unmodifiableMap(view);
    }

    public Set<Vertex<T>> getChildren(Vertex<T> u) {
        Map<Vertex<T>, Integer> adjacent = edges.get(u);
        return adjacent == null ? Collections.emptySet() : Collections.unmodifiableSet(adjacent.keySet());
    }

    public boolean containsVertex(Vertex<T> v) {
        return vertices.contains(v);
    }

    public boolean hasEdge(Vertex<T> u, Vertex<T> v) {
        Map<Vertex<T>, Integer> adjacent = edges.get(u);
        return adjacent != null && adjacent.containsKey(v);
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Map::size).sum();
    }

    public boolean hasNoEdges() {
        return edges.isEmpty();
    }

    public void addVertex(Vertex<T> v) {
        vertices.add(Objects.requireNonNull(v, "Vertex cannot be null"));
    }

    public void addEdge(Vertex<T> u, Vertex<T> v) {
        addEdge(u, v, 0);
    }

    /**
     * Inserts edge (u, v) or overwrites its weight. Both endpoints join the vertex set.
     */
    public void addEdge(Vertex<T> u, Vertex<T> v, int weight) {
        addVertex(u);
        addVertex(v);
        edges.computeIfAbsent(u, k -> new LinkedHashMap<>()).put(v, weight);
    }

    /**
     * Removes edge (u, v). Endpoints stay in the vertex set.
     *
     * @return true if the edge was present
     */
    public boolean removeEdge(Vertex<T> u, Vertex<T> v) {
        Map<Vertex<T>, Integer> adjacent = edges.get(u);
        if (adjacent == null || !adjacent.containsKey(v)) {
            return false;
        }
        adjacent.remove(v);
        if (adjacent.isEmpty()) {
            edges.remove(u);
        }
        return true;
    }

    /**
     * Drops every edge and keeps the vertex set.
     */
    public void clearEdges() {
        edges.clear();
    }

    public int getWeight(Vertex<T> u, Vertex<T> v) {
        Map<Vertex<T>, Integer> adjacent = edges.get(u);
        if (adjacent == null || !adjacent.containsKey(v)) {
            throw new EdgeNotFoundException(u, v);
        }
        return adjacent.get(v);
    }

    public int getWeightOrDefault(Vertex<T> u, Vertex<T> v, int defaultWeight) {
        Map<Vertex<T>, Integer> adjacent = edges.get(u);
        return adjacent == null ? defaultWeight : adjacent.getOrDefault(v, defaultWeight);
    }

    /**
     * Breadth-first search for a path with the fewest edges.
     *
     * @return vertices from start to target, or an empty list when target is unreachable
     */
    public List<Vertex<T>> bfs(Vertex<T> start, Vertex<T> target) {
        Map<Vertex<T>, Vertex<T>> parents = new HashMap<>();
        parents.put(start, start);
        Deque<Vertex<T>> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            Vertex<T> node = queue.poll();
            if (node.equals(target)) {
                break;
            }
            for (Vertex<T> neighbor : getChildren(node)) {
                if (!parents.containsKey(neighbor)) {
                    parents.put(neighbor, node);
                    queue.add(neighbor);
                }
            }
        }
        return buildPath(start, target, parents);
    }

    /**
     * Depth-first search for any path.
     *
     * @return vertices from start to target, or an empty list when target is unreachable
     */
    public List<Vertex<T>> dfs(Vertex<T> start, Vertex<T> target) {
        Map<Vertex<T>, Vertex<T>> parents = new HashMap<>();
        parents.put(start, start);
        Set<Vertex<T>> visited = new HashSet<>();
        Deque<Vertex<T>> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            Vertex<T> node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            if (node.equals(target)) {
                break;
            }
            for (Vertex<T> next : getChildren(node)) {
                if (!visited.contains(next)) {
                    parents.put(next, node);
                    stack.push(next);
                }
            }
        }
        return buildPath(start, target, parents);
    }

    private List<Vertex<T>> buildPath(Vertex<T> start, Vertex<T> target, Map<Vertex<T>, Vertex<T>> parents) {
        if (!parents.containsKey(target)) {
            return List.of();
        }
        List<Vertex<T>> path = new ArrayList<>();
        Vertex<T> current = target;
        path.add(current);
        while (!current.equals(start)) {
            current = parents.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Checks that the subgraph reachable from {@code source} has no cycle. Uses an explicit stack of
     * frames; a vertex is on the current path from the moment it is pushed until all its children are done.
     *
     * @throws GraphNotAcyclicException when a back edge is found
     */
    public void verifyAcyclicFrom(Vertex<T> source) {
        Set<Vertex<T>> onPath = new HashSet<>();
        Set<Vertex<T>> finished = new HashSet<>();
        Deque<Frame<T>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(source, getChildren(source).iterator()));
        onPath.add(source);

        while (!stack.isEmpty()) {
            Frame<T> frame = stack.peek();
            if (!frame.children().hasNext()) {
                stack.pop();
                onPath.remove(frame.vertex());
                finished.add(frame.vertex());
                continue;
            }
            Vertex<T> child = frame.children().next();
            if (onPath.contains(child)) {
                throw new GraphNotAcyclicException(source, child);
            }
            if (!finished.contains(child)) {
                onPath.add(child);
                stack.push(new Frame<>(child, getChildren(child).iterator()));
            }
        }
    }

    /**
     * Dijkstra's algorithm with a lazy priority queue: stale entries are skipped when polled.
     * Only defined on graphs whose part reachable from {@code source} is acyclic.
     *
     * @throws GraphNotAcyclicException if a cycle is reachable from {@code source}
     */
    public ShortestPaths<T> dijkstraSssp(Vertex<T> source) {
        verifyAcyclicFrom(source);
        Map<Vertex<T>, Long> distances = initialDistances(source);
        Map<Vertex<T>, Vertex<T>> predecessors = new LinkedHashMap<>();
        PriorityQueue<DistanceEntry<T>> queue = new PriorityQueue<>();
        queue.add(new DistanceEntry<>(0L, source));

        while (!queue.isEmpty()) {
            DistanceEntry<T> entry = queue.poll();
            Vertex<T> u = entry.vertex();
            if (entry.distance() > distances.get(u)) {
                continue;
            }
            for (Vertex<T> v : getChildren(u)) {
                relax(u, v, distances, predecessors, queue);
            }
        }
        return new ShortestPaths<>(source, distances, predecessors);
    }

    /**
     * Bellman-Ford from {@code source}. After |V| rounds of relaxing every edge, an edge that still
     * relaxes proves a negative cycle reachable from the source.
     */
    public BellmanFordResult<T> bellmanFordSssp(Vertex<T> source) {
        Map<Vertex<T>, Long> distances = initialDistances(source);
        Map<Vertex<T>, Vertex<T>> predecessors = new LinkedHashMap<>();
        List<Vertex<T>> cycle = runBellmanFord(distances, predecessors);
        if (!cycle.isEmpty()) {
            log.debug("Negative cycle reachable from {}: {}", source, cycle);
            return BellmanFordResult.negativeCycle(cycle);
        }
        return BellmanFordResult.shortestPaths(distances, predecessors);
    }

    /**
     * Looks for a negative cycle anywhere in the graph, as if a virtual source had a zero-weight
     * edge to every vertex.
     *
     * @return a closed cycle in traversal order, or an empty list
     */
    public List<Vertex<T>> findNegativeCycle() {
        Map<Vertex<T>, Long> distances = new LinkedHashMap<>();
        for (Vertex<T> v : vertices) {
            distances.put(v, 0L);
        }
        return runBellmanFord(distances, new LinkedHashMap<>());
    }

    private List<Vertex<T>> runBellmanFord(Map<Vertex<T>, Long> distances, Map<Vertex<T>, Vertex<T>> predecessors) {
        for (int round = 0; round < vertices.size(); round++) {
            boolean changed = false;
            for (Map.Entry<Vertex<T>, Map<Vertex<T>, Integer>> entry : edges.entrySet()) {
                for (Vertex<T> v : entry.getValue().keySet()) {
                    changed |= relax(entry.getKey(), v, distances, predecessors, null);
                }
            }
            if (!changed) {
                return List.of();
            }
        }
        for (Map.Entry<Vertex<T>, Map<Vertex<T>, Integer>> entry : edges.entrySet()) {
            for (Vertex<T> v : entry.getValue().keySet()) {
                if (relax(entry.getKey(), v, distances, predecessors, null)) {
                    return extractCycle(v, predecessors);
                }
            }
        }
        return List.of();
    }

    /**
     * Walks predecessors from {@code start} until a vertex repeats, drops the vertices that only lead
     * into the cycle, and returns the cycle closed and in traversal order.
     */
    private List<Vertex<T>> extractCycle(Vertex<T> start, Map<Vertex<T>, Vertex<T>> predecessors) {
        List<Vertex<T>> walk = new ArrayList<>();
        Set<Vertex<T>> seen = new HashSet<>();
        Vertex<T> current = start;
        while (seen.add(current)) {
            walk.add(current);
            current = predecessors.get(current);
            if (current == null) {
                throw new IllegalStateException("Predecessor chain from " + start + " ends without closing a cycle");
            }
        }
        List<Vertex<T>> cycle = new ArrayList<>(walk.subList(walk.indexOf(current), walk.size()));
        cycle.add(current);
        Collections.reverse(cycle);
        return cycle;
    }

    public boolean relax(Vertex<T> u, Vertex<T> v, Map<Vertex<T>, Long> distances) {
        return relax(u, v, distances, null, null);
    }

    /**
     * Lowers {@code d(v)} to {@code d(u) + w(u, v)} when that is shorter. An unreached {@code u}
     * never relaxes anything.
     *
     * @param predecessors updated with {@code v -> u} on success, may be null
     * @param queue        receives the new {@code (distance, v)} entry on success, may be null
     * @return true if the distance of {@code v} changed
     */
    public boolean relax(Vertex<T> u, Vertex<T> v, Map<Vertex<T>, Long> distances,
                         Map<Vertex<T>, Vertex<T>> predecessors, Queue<DistanceEntry<T>> queue) {
        long du = distances.getOrDefault(u, INFINITY);
        if (du == INFINITY) {
            return false;
        }
        long candidate = du + getWeight(u, v);
        if (candidate >= distances.getOrDefault(v, INFINITY)) {
            return false;
        }
        distances.put(v, candidate);
        if (predecessors != null) {
            predecessors.put(v, u);
        }
        if (queue != null) {
            queue.add(new DistanceEntry<>(candidate, v));
        }
        return true;
    }

    private Map<Vertex<T>, Long> initialDistances(Vertex<T> source) {
        Map<Vertex<T>, Long> distances = new LinkedHashMap<>();
        for (Vertex<T> v : vertices) {
            distances.put(v, INFINITY);
        }
        distances.put(source, 0L);
        return distances;
    }

    /**
     * Edge map keyed by serialized vertices: {@code {u: {v: w}}}. Vertices without outgoing edges
     * only appear as targets.
     */
    public Map<String, Map<String, Integer>> serialize() {
        Map<String, Map<String, Integer>> result = new LinkedHashMap<>();
        edges.forEach((u, adjacent) -> {
            Map<String, Integer> row = new LinkedHashMap<>();
            adjacent.forEach((v, w) -> row.put(v.serialize(), w));
            result.put(u.serialize(), row);
        });
        return result;
    }

    public static Graph<String> deserialize(Map<String, Map<String, Integer>> data) {
        Graph<String> graph = new Graph<>();
        if (data == null) {
            return graph;
        }
        data.forEach((u, adjacent) -> {
            Vertex<String> from = Vertex.deserialize(u);
            graph.addVertex(from);
            adjacent.forEach((v, w) -> graph.addEdge(from, Vertex.deserialize(v), w));
        });
        return graph;
    }

    @Override
    public String toString() {
        return "Graph(vertices=" + vertices.size() + ", edges=" + edgeCount() + ")";
    }

    /**
     * Priority queue entry of Dijkstra's algorithm. Ties on distance are broken by vertex order.
     */
    public record DistanceEntry<T extends Comparable<? super T>>(long distance, Vertex<T> vertex)
            implements Comparable<DistanceEntry<T>> {

        @Override
        public int compareTo(DistanceEntry<T> other) {
            int byDistance = Long.compare(distance, other.distance);
            return byDistance != 0 ? byDistance : vertex.compareTo(other.vertex);
        }
    }

    private record Frame<T extends Comparable<? super T>>(Vertex<T> vertex, Iterator<Vertex<T>> children) {
    }
}
