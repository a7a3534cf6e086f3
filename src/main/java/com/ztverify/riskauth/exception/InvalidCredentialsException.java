package com.ztverify.riskauth.exception;

/**
 * Thrown when a username/secret pair cannot be verified, or the account is unknown.
 */
public class InvalidCredentialsException extends RuntimeException {

    /**
     * Constructs a new invalid credentials exception with null as its detail message.
     */
    public InvalidCredentialsException() {
        super();
    }

    /**
     * Constructs a new invalid credentials exception with the specified detail message.
     *
     * @param message the detail message
     */
    public InvalidCredentialsException(String message) {
        super(message);
    }

    /**
     * Constructs a new invalid credentials exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public InvalidCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new invalid credentials exception with the specified cause.
     *
     * @param cause the cause (which is saved for later retrieval)
     */
    public InvalidCredentialsException(Throwable cause) {
        super(cause);
    }
}
