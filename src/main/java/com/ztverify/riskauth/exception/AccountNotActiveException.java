package com.ztverify.riskauth.exception;

/**
 * Thrown when a verified account is inactive, locked or suspended.
 */
public class AccountNotActiveException extends RuntimeException {

    /**
     * Constructs a new account not active exception with null as its detail message.
     */
    public AccountNotActiveException() {
        super();
    }

    /**
     * Constructs a new account not active exception with the specified detail message.
     *
     * @param message the detail message
     */
    public AccountNotActiveException(String message) {
        super(message);
    }

    /**
     * Constructs a new account not active exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public AccountNotActiveException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new account not active exception with the specified cause.
     *
     * @param cause the cause (which is saved for later retrieval)
     */
    public AccountNotActiveException(Throwable cause) {
        super(cause);
    }
}
