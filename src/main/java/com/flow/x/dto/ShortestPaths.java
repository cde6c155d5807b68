package com.flow.x.dto;

import com.flow.x.models.Graph;
import com.flow.x.models.Vertex;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Single-source shortest path distances together with the predecessor of every reached vertex.
 * Unreached vertices have distance {@link Graph#INFINITY} and no predecessor.
 */
@Getter
public class ShortestPaths<T extends Comparable<? super T>> {
    private final Vertex<T> source;
    private final Map<Vertex<T>, Long> distances;
    private final Map<Vertex<T>, Vertex<T>> predecessors;

    public ShortestPaths(Vertex<T> source, Map<Vertex<T>, Long> distances, Map<Vertex<T>, Vertex<T>> predecessors) {
        this.source = source;
        this.distances = Collections.unmodifiableMap(distances);
        this.predecessors = Collections.unmodifiableMap(predecessors);
    }

    public long distanceTo(Vertex<T> target) {
        return distances.getOrDefault(target, Graph.INFINITY);
    }

    public boolean isReachable(Vertex<T> target) {
        return target.equals(source) || predecessors.containsKey(target);
    }

    /**
     * Follows predecessors back to the source.
     *
     * @return vertices from source to target, or an empty list when the target was not reached
     */
    public List<Vertex<T>> pathTo(Vertex<T> target) {
        if (!isReachable(target)) {
            return List.of();
        }
        List<Vertex<T>> path = new ArrayList<>();
        Vertex<T> current = target;
        path.add(current);
        while (!current.equals(source)) {
            current = predecessors.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }
}
