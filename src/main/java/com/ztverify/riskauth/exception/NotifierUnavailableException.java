package com.ztverify.riskauth.exception;

/**
 * Thrown when a one-time code could not be delivered to the user.
 */
public class NotifierUnavailableException extends RuntimeException {

    /**
     * Constructs a new notifier unavailable exception with null as its detail message.
     */
    public NotifierUnavailableException() {
        super();
    }

    /**
     * Constructs a new notifier unavailable exception with the specified detail message.
     *
     * @param message the detail message
     */
    public NotifierUnavailableException(String message) {
        super(message);
    }

    /**
     * Constructs a new notifier unavailable exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public NotifierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new notifier unavailable exception with the specified cause.
     *
     * @param cause the cause (which is saved for later retrieval)
     */
    public NotifierUnavailableException(Throwable cause) {
        super(cause);
    }
}
