package com.flow.x.exceptions;

/**
 * Thrown when reading or writing a file fails for reasons unrelated to its content.
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }

    /**
     * Constructs a new {@link InternalServerErrorException} wrapping the underlying failure.
     *
     * @param m     the detail message explaining the error.
     * @param cause the I/O failure.
     */
    public InternalServerErrorException(String m, Throwable cause) {
        super(m, cause);
    }
}
