package com.ragdocs.gateway.retrieval;

public class RetrievalUnavailableException extends RetrievalException {
    public RetrievalUnavailableException(String message) {
        super(message);
    }

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
