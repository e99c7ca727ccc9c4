package com.reasonai.domain.reasoning.model;

/**
 * Outcome of one stage invocation. Immutable once the stage returns.
 *
 * @param stageType  which stage produced this result
 * @param status     terminal status (COMPLETED, SKIPPED or FAILED)
 * @param output     stage payload, present iff COMPLETED
 * @param durationMs wall-clock time of this stage only, 0 when skipped
 * @param error      failure details, present iff FAILED
 * @param cacheHit   whether the output was served from the cache
 */
public record StageResult(
        StageType stageType,
        StageStatus status,
        StageOutput output,
        double durationMs,
        StageError error,
        boolean cacheHit
) {
    public StageResult {
        if (stageType == null || status == null) {
            throw new IllegalArgumentException("stageType and status are required");
        }
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("StageResult requires a terminal status, got " + status);
        }
        if ((status == StageStatus.COMPLETED) != (output != null)) {
            throw new IllegalArgumentException("output must be present iff status is COMPLETED");
        }
        if ((status == StageStatus.FAILED) != (error != null)) {
            throw new IllegalArgumentException("error must be present iff status is FAILED");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative");
        }
    }

    public static StageResult skipped(StageType stageType) {
        return new StageResult(stageType, StageStatus.SKIPPED, null, 0, null, false);
    }

    public static StageResult completed(StageType stageType, StageOutput output, double durationMs, boolean cacheHit) {
        return new StageResult(stageType, StageStatus.COMPLETED, output, durationMs, null, cacheHit);
    }

    public static StageResult failed(StageType stageType, StageError.Kind kind, String message, double durationMs) {
        return new StageResult(stageType, StageStatus.FAILED, null, durationMs, new StageError(kind, message), false);
    }

    public boolean isCompleted() {
        return status == StageStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == StageStatus.FAILED;
    }
}
