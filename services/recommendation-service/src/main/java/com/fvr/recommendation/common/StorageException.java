package com.fvr.recommendation.common;

/**
 * Unexpected persistence failure. Surfaced to callers as a generic server error;
 * the cause is only logged.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
