package com.ecvi.riskengine.verify.http;

/**
 * A failed external call that may succeed when attempted again. Only
 * {@link BackoffRetrier} catches it.
 */
public class AdapterTransientException extends RuntimeException {
    public AdapterTransientException(String message) {
        super(message);
    }

    public AdapterTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
