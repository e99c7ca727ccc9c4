package com.reasonai.infrastructure.ai;

/**
 * A reasoning, compaction or reranking collaborator failed.
 */
public class AiReasoningException extends RuntimeException {

    public AiReasoningException(String message) {
        super(message);
    }

    public AiReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
