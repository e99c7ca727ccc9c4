package com.reasonai.infrastructure.pipeline;

import com.reasonai.domain.reasoning.model.CacheStrategy;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.infrastructure.pipeline.stage.PerspectiveFraming;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.logging.LogLevel;

import java.time.Duration;
import java.util.Locale;

/**
 * Which stages run and how a run is shaped. Pure value object.
 * <p>
 * Stage flags only decide RUNNING vs SKIPPED for their stage. They never change
 * stage order, output schema or error semantics.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    /** One day; longer stage timeouts are rejected. */
    public static final long MAX_TIMEOUT_SECONDS = 86_400;

    @Builder.Default boolean enablePreprocessing = true;
    @Builder.Default boolean enableWorkingAwareness = true;
    @Builder.Default boolean enableCompaction = true;
    @Builder.Default boolean enableReranking = true;
    @Builder.Default boolean enableFinalResponse = true;

    /** Fan working-awareness perspectives out concurrently. */
    @Builder.Default boolean parallelExecution = true;
    @Builder.Default int numPerspectives = 3;
    /** Upper bound for a single stage, collaborator waits included. */
    @Builder.Default double timeoutSeconds = 60.0;

    @Builder.Default CacheStrategy cacheStrategy = CacheStrategy.MEMORY;
    @Builder.Default long cacheTtlSeconds = 3600;

    @Builder.Default boolean enableMetrics = true;
    @Builder.Default boolean enableTracing = false;
    @Builder.Default String logLevel = "INFO";

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }

    /**
     * Every stage disabled; switch single stages back on with {@link #toBuilder()}.
     */
    public static PipelineConfig allDisabled() {
        return PipelineConfig.builder()
                .enablePreprocessing(false)
                .enableWorkingAwareness(false)
                .enableCompaction(false)
                .enableReranking(false)
                .enableFinalResponse(false)
                .build();
    }

    public boolean isStageEnabled(StageType type) {
        return switch (type) {
            case PREPROCESSING -> enablePreprocessing;
            case WORKING_AWARENESS -> enableWorkingAwareness;
            case COMPACTION -> enableCompaction;
            case RERANKING -> enableReranking;
            case FINAL_RESPONSE -> enableFinalResponse;
        };
    }

    public boolean isCachingEnabled() {
        return cacheStrategy == CacheStrategy.MEMORY;
    }

    public Duration stageTimeout() {
        return Duration.ofMillis(Math.round(timeoutSeconds * 1000));
    }

    public Duration cacheTtl() {
        return cacheTtlSeconds > 0 ? Duration.ofSeconds(cacheTtlSeconds) : null;
    }

    /**
     * Spring Boot log level for {@link #logLevel}; accepts "WARNING" as an alias of WARN.
     */
    public LogLevel resolvedLogLevel() {
        String normalized = logLevel == null ? "" : logLevel.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            normalized = "WARN";
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Unknown log level: " + logLevel);
        }
    }

    /**
     * Reject invalid values and contradictory combinations before any stage is built.
     *
     * @param rerankerPresent whether a reranker collaborator was supplied
     */
    public void validate(boolean rerankerPresent) {
        if (enableReranking && !rerankerPresent) {
            throw new PipelineConfigurationException(
                    "Reranking is enabled but no reranker was provided; disable reranking or supply a Reranker");
        }
        if (numPerspectives < 1 || numPerspectives > PerspectiveFraming.values().length) {
            throw new PipelineConfigurationException(String.format(
                    "numPerspectives must be between 1 and %d, got %d",
                    PerspectiveFraming.values().length, numPerspectives));
        }
        if (!(timeoutSeconds > 0) || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw new PipelineConfigurationException(String.format(
                    "timeoutSeconds must be in (0, %d], got %s", MAX_TIMEOUT_SECONDS, timeoutSeconds));
        }
        if (cacheTtlSeconds < 0) {
            throw new PipelineConfigurationException("cacheTtlSeconds must not be negative, got " + cacheTtlSeconds);
        }
        if (cacheStrategy == null) {
            throw new PipelineConfigurationException("cacheStrategy is required");
        }
        resolvedLogLevel();
    }
}
