package com.ragdocs.gateway.service.quality;

import com.ragdocs.gateway.api.dto.CuratedResult;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Decides whether a curated result set is good enough to show. Pure: no I/O, same input, same verdict.
 */
@Component
@EnableConfigurationProperties(QualityGateProperties.class)
public class QualityGate {
    private static final String UNKNOWN_SOURCE = "unknown";

    private final QualityGateProperties properties;

    public QualityGate(QualityGateProperties properties) {
        this.properties = properties;
    }

    public QualityVerdict evaluate(List<CuratedResult> curated) {
        if (curated == null || curated.isEmpty()) {
            return QualityVerdict.fail("No results found", "Retrieved 0 results from retrieval backend");
        }

        double threshold = properties.getMinSimilarityThreshold();
        double maxScore = Double.NEGATIVE_INFINITY;
        for (CuratedResult result : curated) {
            maxScore = Math.max(maxScore, result.getScore());
        }
        if (maxScore < threshold) {
            return QualityVerdict.fail(
                "Maximum similarity score (" + format(maxScore) + ") below minimum threshold (" + threshold + ")",
                "Best match score: " + format(maxScore) + ", threshold: " + threshold
            );
        }

        Set<String> documents = new HashSet<>();
        for (CuratedResult result : curated) {
            documents.add(documentKey(result));
        }
        int minDocuments = properties.getMinUniqueDocuments();
        if (documents.size() < minDocuments) {
            return QualityVerdict.fail(
                "Number of unique documents (" + documents.size() + ") below minimum requirement (" + minDocuments + ")",
                "Found " + documents.size() + " unique documents, required at least " + minDocuments
            );
        }

        return QualityVerdict.pass("Max similarity: " + format(maxScore) + ", Unique docs: " + documents.size());
    }

    private String documentKey(CuratedResult result) {
        CuratedResult.Source source = result.getSource();
        if (source == null) {
            return null;
        }
        String file = source.getSourceFile();
        if (file != null && !file.isBlank() && !UNKNOWN_SOURCE.equals(file)) {
            return file;
        }
        return source.getDocumentId();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
