package com.ragdocs.gateway.service.quality;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rag.quality")
public class QualityGateProperties {
    private double minSimilarityThreshold = 0.1;
    private int minUniqueDocuments = 1;

    public double getMinSimilarityThreshold() {
        return minSimilarityThreshold;
    }

    public void setMinSimilarityThreshold(double minSimilarityThreshold) {
        this.minSimilarityThreshold = minSimilarityThreshold;
    }

    public int getMinUniqueDocuments() {
        return minUniqueDocuments;
    }

    public void setMinUniqueDocuments(int minUniqueDocuments) {
        this.minUniqueDocuments = minUniqueDocuments;
    }
}
