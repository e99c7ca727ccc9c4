package com.reasonai.infrastructure.pipeline.stage;

import java.util.Arrays;
import java.util.List;

/**
 * Distinct framings of the same problem, one per working-awareness perspective.
 * Perspective {@code i} always uses the framing with ordinal {@code i}.
 */
public enum PerspectiveFraming {
    LOGICAL("logical", "Analyze this problem from a logical, step-by-step perspective:"),
    CREATIVE("creative", "Consider this problem from a creative, intuitive perspective:"),
    CRITICAL("critical", "Examine this problem critically, identifying potential issues:"),
    PRACTICAL("practical", "Approach this problem practically, focusing on concrete steps and trade-offs:"),
    SIMPLIFYING("simplifying", "Explain the core of this problem as simply as possible, as if to a newcomer:");

    private final String label;
    private final String instruction;

    PerspectiveFraming(String label, String instruction) {
        this.label = label;
        this.instruction = instruction;
    }

    public String label() {
        return label;
    }

    public String instruction() {
        return instruction;
    }

    public static List<PerspectiveFraming> first(int count) {
        return Arrays.asList(values()).subList(0, count);
    }
}
