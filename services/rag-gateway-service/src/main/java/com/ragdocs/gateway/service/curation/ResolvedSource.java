package com.ragdocs.gateway.service.curation;

import com.ragdocs.gateway.retrieval.dto.RawResult;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of a raw result with every optional field resolved to its default.
 */
record ResolvedSource(
    String documentId,
    String sourceFile,
    String citationName,
    Integer page,
    String section,
    int chunkOrder,
    String groupKey,
    Map<String, Object> metadata
) {
    static final String UNKNOWN = "unknown";
    static final String UNKNOWN_DOCUMENT = "Unknown Document";
    static final String DEFAULT_SECTION = "general";

    static ResolvedSource of(RawResult result) {
        RawResult.Metadata meta = result.getMetadata();
        String named = meta == null ? null : firstPresent(meta.getSourceFile(), meta.getSource(), meta.getDocumentName());
        String metaSource = meta == null ? null : meta.getSource();
        String groupKey = firstPresent(result.getDocumentId(), metaSource);
        return new ResolvedSource(
            result.getDocumentId(),
            named == null ? UNKNOWN : named,
            named == null ? UNKNOWN_DOCUMENT : named,
            meta == null ? null : meta.getPage(),
            meta == null || isBlank(meta.getSection()) ? DEFAULT_SECTION : meta.getSection(),
            meta == null || meta.getChunkOrder() == null ? 0 : meta.getChunkOrder(),
            groupKey == null ? UNKNOWN : groupKey,
            toMap(meta)
        );
    }

    private static Map<String, Object> toMap(RawResult.Metadata meta) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (meta == null) {
            return map;
        }
        putIfPresent(map, "source_file", meta.getSourceFile());
        putIfPresent(map, "source", meta.getSource());
        putIfPresent(map, "document_name", meta.getDocumentName());
        putIfPresent(map, "page", meta.getPage());
        putIfPresent(map, "section", meta.getSection());
        putIfPresent(map, "chunk_order", meta.getChunkOrder());
        map.putAll(meta.getAdditional());
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String firstPresent(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
