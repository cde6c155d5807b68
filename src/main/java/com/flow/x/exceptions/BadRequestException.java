package com.flow.x.exceptions;

/**
 * Thrown when caller-supplied input cannot be used.
 * <p>
 * Covers malformed assignment input, CSV content that does not follow the expected layout and
 * unknown or incomplete command-line arguments.
 * </p>
 */
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains what was wrong with the input.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
