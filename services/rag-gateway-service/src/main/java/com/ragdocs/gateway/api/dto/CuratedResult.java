package com.ragdocs.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CuratedResult {
    private String id;
    private int rank;
    private double score;
    private String content;

    @JsonProperty("relevant_extracts")
    private List<String> relevantExtracts;

    private Source source;
    private String citation;
    private Map<String, Object> metadata;

    public CuratedResult copy() {
        CuratedResult copy = new CuratedResult();
        copy.id = id;
        copy.rank = rank;
        copy.score = score;
        copy.content = content;
        copy.relevantExtracts = relevantExtracts == null ? null : List.copyOf(relevantExtracts);
        copy.source = source == null ? null : source.copy();
        copy.citation = citation;
        // metadata may carry null values from the backend, which Map.copyOf rejects
        copy.metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public List<String> getRelevantExtracts() {
        return relevantExtracts;
    }

    public void setRelevantExtracts(List<String> relevantExtracts) {
        this.relevantExtracts = relevantExtracts;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public String getCitation() {
        return citation;
    }

    public void setCitation(String citation) {
        this.citation = citation;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public static class Source {
        @JsonProperty("document_id")
        private String documentId;

        @JsonProperty("source_file")
        private String sourceFile;

        private Integer page;
        private String section;

        @JsonProperty("chunk_order")
        private int chunkOrder;

        Source copy() {
            Source copy = new Source();
            copy.documentId = documentId;
            copy.sourceFile = sourceFile;
            copy.page = page;
            copy.section = section;
            copy.chunkOrder = chunkOrder;
            return copy;
        }

        public String getDocumentId() {
            return documentId;
        }

        public void setDocumentId(String documentId) {
            this.documentId = documentId;
        }

        public String getSourceFile() {
            return sourceFile;
        }

        public void setSourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
        }

        public Integer getPage() {
            return page;
        }

        public void setPage(Integer page) {
            this.page = page;
        }

        public String getSection() {
            return section;
        }

        public void setSection(String section) {
            this.section = section;
        }

        public int getChunkOrder() {
            return chunkOrder;
        }

        public void setChunkOrder(int chunkOrder) {
            this.chunkOrder = chunkOrder;
        }
    }
}
