package com.flow.x.exceptions;

/**
 * Signals that the internal graphs of a flow network no longer agree with each other.
 * <p>
 * This is never an input problem: it means a mutation left the capacity, flow, residual and cost
 * graphs in a corrupted state. It is raised by the debug validator and by the sanity checks of the
 * augmentation code.
 * </p>
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
