package com.reasonai.domain.reasoning.model;

/**
 * Plain text output (preprocessing, final response).
 */
public record TextOutput(String text) implements StageOutput {

    public TextOutput {
        text = text != null ? text : "";
    }

    @Override
    public String asText() {
        return text;
    }
}
