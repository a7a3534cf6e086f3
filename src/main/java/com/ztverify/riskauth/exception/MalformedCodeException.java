package com.ztverify.riskauth.exception;

/**
 * Thrown when a submitted one-time code is not a string of the expected number of digits.
 */
public class MalformedCodeException extends RuntimeException {

    /**
     * Constructs a new malformed code exception with null as its detail message.
     */
    public MalformedCodeException() {
        super();
    }

    /**
     * Constructs a new malformed code exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MalformedCodeException(String message) {
        super(message);
    }

    /**
     * Constructs a new malformed code exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public MalformedCodeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new malformed code exception with the specified cause.
     *
     * @param cause the cause (which is saved for later retrieval)
     */
    public MalformedCodeException(Throwable cause) {
        super(cause);
    }
}
