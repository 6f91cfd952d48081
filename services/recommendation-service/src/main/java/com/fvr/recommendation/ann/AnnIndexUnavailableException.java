package com.fvr.recommendation.ann;

public class AnnIndexUnavailableException extends RuntimeException {
    public AnnIndexUnavailableException(String message) {
        super(message);
    }

    public AnnIndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
