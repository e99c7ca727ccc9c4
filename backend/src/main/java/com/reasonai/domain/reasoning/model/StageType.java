package com.reasonai.domain.reasoning.model;

/**
 * The five pipeline stages, in pipeline-definition order.
 * The key doubles as the shared-data key and the cache-key namespace.
 */
public enum StageType {
    PREPROCESSING("preprocessing", "Preprocessing"),
    WORKING_AWARENESS("working_awareness", "Working Awareness"),
    COMPACTION("compaction", "Compaction"),
    RERANKING("reranking", "Reranking"),
    FINAL_RESPONSE("final_response", "Final Response");

    private final String key;
    private final String displayName;

    StageType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }
}
