package com.flow.x.exceptions;

/**
 * Thrown by {@code FlowNetwork.addEdge} when the requested capacity is below zero.
 */
public class NegativeCapacityException extends RuntimeException {

    /**
     * @param capacity the rejected capacity.
     * @param edge     printable form of the edge that was being added.
     */
    public NegativeCapacityException(int capacity, String edge) {
        super("Capacity must be non-negative, got " + capacity + " for edge " + edge);
    }
}
