package com.flow.x.exceptions;

/**
 * Thrown when an algorithm that requires a directed acyclic graph meets a cycle.
 */
public class GraphNotAcyclicException extends RuntimeException {

    /**
     * @param source the vertex the traversal started from.
     * @param back   the vertex reached again through a back edge.
     */
    public GraphNotAcyclicException(Object source, Object back) {
        super("Graph reachable from " + source + " is not acyclic: back edge into " + back);
    }
}
