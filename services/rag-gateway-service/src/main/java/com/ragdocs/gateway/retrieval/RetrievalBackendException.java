package com.ragdocs.gateway.retrieval;

/**
 * The backend answered with an error status.
 */
public class RetrievalBackendException extends RetrievalException {
    private final int status;
    private final String detail;

    public RetrievalBackendException(int status, String detail, Throwable cause) {
        super("Retrieval service error: " + status + " - " + detail, cause);
        this.status = status;
        this.detail = detail;
    }

    public int getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }
}
