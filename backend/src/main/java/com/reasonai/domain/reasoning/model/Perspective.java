package com.reasonai.domain.reasoning.model;

/**
 * One independent reasoning pass of the working-awareness stage.
 *
 * @param index   0-based perspective index, the merge order
 * @param framing short name of the framing used for the prompt
 * @param text    the agent's answer for this framing
 */
public record Perspective(int index, String framing, String text) {}
