package com.ragdocs.gateway.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One candidate chunk as returned by the retrieval backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawResult {
    @JsonProperty("chunk_id")
    private final String chunkId;

    private final String content;

    @JsonProperty("similarity_score")
    private final double similarityScore;

    @JsonProperty("document_id")
    private final String documentId;

    private final Metadata metadata;

    @JsonCreator
    public RawResult(
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("content") String content,
        @JsonProperty("similarity_score") double similarityScore,
        @JsonProperty("document_id") String documentId,
        @JsonProperty("metadata") Metadata metadata
    ) {
        this.chunkId = chunkId;
        this.content = content;
        this.similarityScore = similarityScore;
        this.documentId = documentId;
        this.metadata = metadata;
    }

    public String getChunkId() {
        return chunkId;
    }

    public String getContent() {
        return content;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public String getDocumentId() {
        return documentId;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @JsonProperty("source_file")
        private final String sourceFile;

        private final String source;

        @JsonProperty("document_name")
        private final String documentName;

        private final Integer page;
        private final String section;

        @JsonProperty("chunk_order")
        private final Integer chunkOrder;

        private final Map<String, Object> additional = new LinkedHashMap<>();

        @JsonCreator
        public Metadata(
            @JsonProperty("source_file") String sourceFile,
            @JsonProperty("source") String source,
            @JsonProperty("document_name") String documentName,
            @JsonProperty("page") Integer page,
            @JsonProperty("section") String section,
            @JsonProperty("chunk_order") Integer chunkOrder
        ) {
            this.sourceFile = sourceFile;
            this.source = source;
            this.documentName = documentName;
            this.page = page;
            this.section = section;
            this.chunkOrder = chunkOrder;
        }

        public String getSourceFile() {
            return sourceFile;
        }

        public String getSource() {
            return source;
        }

        public String getDocumentName() {
            return documentName;
        }

        public Integer getPage() {
            return page;
        }

        public String getSection() {
            return section;
        }

        public Integer getChunkOrder() {
            return chunkOrder;
        }

        @JsonAnyGetter
        public Map<String, Object> getAdditional() {
            return Collections.unmodifiableMap(additional);
        }

        @JsonAnySetter
        public void putAdditional(String name, Object value) {
            additional.put(name, value);
        }
    }
}
