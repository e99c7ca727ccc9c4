package com.reasonai.infrastructure.observability;

import com.reasonai.domain.reasoning.model.PipelineResult;
import com.reasonai.domain.reasoning.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide pipeline counters, shared by every run.
 */
@Slf4j
@Component
public class PipelineMetricsTracker {

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong runsWithFailures = new AtomicLong();
    private final AtomicLong stageExecutions = new AtomicLong();
    private final AtomicLong stageFailures = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();

    public void recordRun(PipelineResult result) {
        totalRuns.incrementAndGet();
        if (result.hasFailures()) {
            runsWithFailures.incrementAndGet();
        }
        for (StageResult stage : result.stages()) {
            if (stage.isCompleted() || stage.isFailed()) {
                stageExecutions.incrementAndGet();
            }
            if (stage.isFailed()) {
                stageFailures.incrementAndGet();
            }
            if (stage.cacheHit()) {
                cacheHits.incrementAndGet();
            }
        }

        log.info("Pipeline metrics - run #{}: durationMs={}, cacheHits={}, failed={}, " +
                        "cumulative: stageFailureRate={}%, cacheHitRate={}%",
                totalRuns.get(), String.format("%.1f", result.totalDurationMs()), result.cacheHits(),
                result.hasFailures(), String.format("%.1f", getStageFailureRate()),
                String.format("%.1f", getCacheHitRate()));
    }

    public long getTotalRuns() {
        return totalRuns.get();
    }

    public long getRunsWithFailures() {
        return runsWithFailures.get();
    }

    public double getStageFailureRate() {
        long total = stageExecutions.get();
        return total > 0 ? (double) stageFailures.get() / total * 100 : 0;
    }

    public double getCacheHitRate() {
        long total = stageExecutions.get();
        return total > 0 ? (double) cacheHits.get() / total * 100 : 0;
    }
}
