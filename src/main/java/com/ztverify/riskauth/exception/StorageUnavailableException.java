package com.ztverify.riskauth.exception;

/**
 * Thrown when the audit, device or challenge store cannot be read or written.
 */
public class StorageUnavailableException extends RuntimeException {

    /**
     * Constructs a new storage unavailable exception with null as its detail message.
     */
    public StorageUnavailableException() {
        super();
    }

    /**
     * Constructs a new storage unavailable exception with the specified detail message.
     *
     * @param message the detail message
     */
    public StorageUnavailableException(String message) {
        super(message);
    }

    /**
     * Constructs a new storage unavailable exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new storage unavailable exception with the specified cause.
     *
     * @param cause the cause (which is saved for later retrieval)
     */
    public StorageUnavailableException(Throwable cause) {
        super(cause);
    }
}
