package com.reasonai.domain.reasoning.model;

/**
 * @param text       compacted text, or the untouched input on pass-through
 * @param inputCount number of upstream outputs that went in
 * @param compacted  false when the input was passed through unchanged
 */
public record CompactionOutput(String text, int inputCount, boolean compacted) implements StageOutput {

    @Override
    public String asText() {
        return text;
    }
}
