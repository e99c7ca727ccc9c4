package com.reasonai.domain.reasoning.model;

import java.util.List;
import java.util.Map;

/**
 * Input to the reasoning pipeline. Immutable once constructed.
 *
 * @param prompt      the reasoning task (required)
 * @param context     optional background or conversation history
 * @param constraints ordered requirements the answer must satisfy (may be empty)
 * @param metadata    caller-supplied tags, carried through untouched
 * @param maxTokens   optional generation limit for the final response
 * @param temperature optional sampling temperature for the final response
 */
public record PipelineRequest(
        String prompt,
        String context,
        List<String> constraints,
        Map<String, String> metadata,
        Integer maxTokens,
        Double temperature
) {
    public PipelineRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public PipelineRequest(String prompt, String context, List<String> constraints) {
        this(prompt, context, constraints, null, null, null);
    }

    public static PipelineRequest of(String prompt) {
        return new PipelineRequest(prompt, null, List.of());
    }

    public boolean hasContext() {
        return context != null && !context.isBlank();
    }
}
