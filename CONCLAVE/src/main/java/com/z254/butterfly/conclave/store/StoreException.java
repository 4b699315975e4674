package com.z254.butterfly.conclave.store;

/**
 * Failure reading or writing the shared store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
