package com.reasonai.domain.reasoning.model;

/**
 * Lifecycle of one stage invocation: PENDING → RUNNING → {COMPLETED | FAILED},
 * or PENDING → SKIPPED when the stage is disabled.
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == FAILED;
    }

    public boolean canTransitionTo(StageStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == SKIPPED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, SKIPPED, FAILED -> false;
        };
    }
}
