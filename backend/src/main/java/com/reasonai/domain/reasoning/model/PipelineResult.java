package com.reasonai.domain.reasoning.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final output of one pipeline run.
 *
 * @param finalResponse   synthesized answer (or the pass-through when the final stage did not complete)
 * @param stages          one result per configured stage, in pipeline-definition order
 * @param totalDurationMs wall-clock span from the first stage start to the last stage end
 * @param request         the request that was processed
 * @param cacheHits       number of stages served from the cache
 * @param completedAt     when the run finished
 * @param metadata        optional "metrics" and "trace_id" entries
 */
public record PipelineResult(
        String finalResponse,
        List<StageResult> stages,
        double totalDurationMs,
        PipelineRequest request,
        int cacheHits,
        Instant completedAt,
        Map<String, Object> metadata
) {
    public PipelineResult {
        stages = List.copyOf(stages);
        metadata = Map.copyOf(metadata);
    }

    public StageResult stage(StageType type) {
        return stages.stream()
                .filter(s -> s.stageType() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No result for stage " + type));
    }

    public boolean hasFailures() {
        return stages.stream().anyMatch(StageResult::isFailed);
    }
}
