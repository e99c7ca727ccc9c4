package com.reasonai.domain.reasoning.model;

/**
 * Structured payload of a completed stage.
 * Every variant renders itself as text so later stages can build prompts from it.
 */
public interface StageOutput {

    String asText();
}
