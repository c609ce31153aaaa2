package com.procurement.store;

/**
 * Thrown when the persistent store cannot serve a read or accept a write.
 * Always fatal to the pipeline run that hit it.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
