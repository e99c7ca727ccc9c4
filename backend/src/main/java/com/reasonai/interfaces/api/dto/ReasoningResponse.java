package com.reasonai.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.reasonai.domain.reasoning.model.PipelineResult;
import com.reasonai.domain.reasoning.model.StageResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReasoningResponse(
        String finalResponse,
        List<StageSummary> stages,
        double totalDurationMs,
        int cacheHits,
        Instant completedAt,
        Map<String, Object> metadata
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StageSummary(
            String stage,
            String status,
            double durationMs,
            boolean cacheHit,
            String output,
            String errorKind,
            String error
    ) {
        static StageSummary from(StageResult result) {
            return new StageSummary(
                    result.stageType().key(),
                    result.status().name(),
                    result.durationMs(),
                    result.cacheHit(),
                    result.output() != null ? result.output().asText() : null,
                    result.error() != null ? result.error().kind().name() : null,
                    result.error() != null ? result.error().message() : null);
        }
    }

    public static ReasoningResponse from(PipelineResult result) {
        return new ReasoningResponse(
                result.finalResponse(),
                result.stages().stream().map(StageSummary::from).toList(),
                result.totalDurationMs(),
                result.cacheHits(),
                result.completedAt(),
                result.metadata().isEmpty() ? null : result.metadata());
    }
}
