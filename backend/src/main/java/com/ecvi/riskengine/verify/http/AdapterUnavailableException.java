package com.ecvi.riskengine.verify.http;

/**
 * An external dependency gave up for this invocation. Adapters convert it into a
 * zero-confidence result; it never reaches the orchestrator.
 */
public class AdapterUnavailableException extends RuntimeException {
    public AdapterUnavailableException(String message) {
        super(message);
    }

    public AdapterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
