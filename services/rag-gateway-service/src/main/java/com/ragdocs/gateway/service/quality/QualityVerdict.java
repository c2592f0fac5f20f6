package com.ragdocs.gateway.service.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

public class QualityVerdict {
    @JsonProperty("is_valid")
    private final boolean valid;

    private final String reason;
    private final String details;

    public QualityVerdict(boolean valid, String reason, String details) {
        this.valid = valid;
        this.reason = reason;
        this.details = details;
    }

    public static QualityVerdict pass(String details) {
        return new QualityVerdict(true, "All quality checks passed", details);
    }

    public static QualityVerdict fail(String reason, String details) {
        return new QualityVerdict(false, reason, details);
    }

    public boolean isValid() {
        return valid;
    }

    public String getReason() {
        return reason;
    }

    public String getDetails() {
        return details;
    }
}
