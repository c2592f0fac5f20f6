package com.ragdocs.gateway.retrieval;

/**
 * Failure talking to the retrieval backend. Never retried by the gateway and never cached.
 */
public class RetrievalException extends RuntimeException {
    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
