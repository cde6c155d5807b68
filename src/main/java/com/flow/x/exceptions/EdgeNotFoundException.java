package com.flow.x.exceptions;

/**
 * Thrown when the weight of an edge that is not part of a graph is requested.
 * <p>
 * A weight of zero is a real value, so an absent edge is never reported as zero.
 * </p>
 */
public class EdgeNotFoundException extends RuntimeException {

    public EdgeNotFoundException(Object u, Object v) {
        super("Edge not present in graph: " + u + " -> " + v);
    }
}
