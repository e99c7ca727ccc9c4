package com.reasonai.domain.reasoning.model;

/**
 * Result of a reasoning call including token usage for cost tracking.
 */
public record AgentResponse(String text, long promptTokens, long completionTokens) {

    public static AgentResponse of(String text) {
        return new AgentResponse(text, 0, 0);
    }
}
