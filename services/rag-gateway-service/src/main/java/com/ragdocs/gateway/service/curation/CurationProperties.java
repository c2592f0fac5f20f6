package com.ragdocs.gateway.service.curation;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rag.curation")
public class CurationProperties {
    private double duplicateThreshold = 0.9;
    private int maxChunksPerDocument = 2;
    private int maxExtracts = 3;

    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public void setDuplicateThreshold(double duplicateThreshold) {
        this.duplicateThreshold = duplicateThreshold;
    }

    public int getMaxChunksPerDocument() {
        return maxChunksPerDocument;
    }

    public void setMaxChunksPerDocument(int maxChunksPerDocument) {
        this.maxChunksPerDocument = maxChunksPerDocument;
    }

    public int getMaxExtracts() {
        return maxExtracts;
    }

    public void setMaxExtracts(int maxExtracts) {
        this.maxExtracts = maxExtracts;
    }
}
