package com.flow.x.dto;

import com.flow.x.models.Vertex;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a Bellman-Ford run: either a negative cycle, or the distance and predecessor maps.
 * <p>
 * When {@link #hasNegativeCycle()} is true, {@code distances} and {@code predecessors} are null and
 * {@code cycle} is closed (its first and last vertex are equal) and listed in traversal order.
 * Otherwise {@code cycle} is empty.
 * </p>
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BellmanFordResult<T extends Comparable<? super T>> {
    private final List<Vertex<T>> cycle;
    private final Map<Vertex<T>, Long> distances;
    private final Map<Vertex<T>, Vertex<T>> predecessors;

    public static <T extends Comparable<? super T>> BellmanFordResult<T> negativeCycle(List<Vertex<T>> cycle) {
        return new BellmanFordResult<>(List.copyOf(cycle), null, null);
    }

    public static <T extends Comparable<? super T>> BellmanFordResult<T> shortestPaths(
            Map<Vertex<T>, Long> distances, Map<Vertex<T>, Vertex<T>> predecessors) {
        return new BellmanFordResult<>(List.of(),
                Collections.unmodifiableMap(distances), Collections.unmodifiableMap(predecessors));
    }

    public boolean hasNegativeCycle() {
        return !cycle.isEmpty();
    }
}
