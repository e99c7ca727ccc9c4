package com.reasonai.infrastructure.pipeline;

import com.reasonai.domain.reasoning.model.PipelineRequest;
import com.reasonai.domain.reasoning.model.PipelineResult;
import com.reasonai.domain.reasoning.model.StageError;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageStatus;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.service.Compactor;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import com.reasonai.domain.reasoning.service.Reranker;
import com.reasonai.infrastructure.cache.Cache;
import com.reasonai.infrastructure.cache.CacheKeyBuilder;
import com.reasonai.infrastructure.cache.MemoryCache;
import com.reasonai.infrastructure.observability.MetricsCollector;
import com.reasonai.infrastructure.observability.PipelineMetricsTracker;
import com.reasonai.infrastructure.observability.Span;
import com.reasonai.infrastructure.observability.Tracer;
import com.reasonai.infrastructure.pipeline.stage.CompactionStage;
import com.reasonai.infrastructure.pipeline.stage.FinalResponseStage;
import com.reasonai.infrastructure.pipeline.stage.PreprocessingStage;
import com.reasonai.infrastructure.pipeline.stage.RerankingStage;
import com.reasonai.infrastructure.pipeline.stage.Stage;
import com.reasonai.infrastructure.pipeline.stage.StageRuntime;
import com.reasonai.infrastructure.pipeline.stage.WorkingAwarenessStage;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Reasoning pipeline orchestrator.
 *
 * Pipeline:
 *   A) preprocessing (LLM) → B) working awareness (N perspectives, fan-out/fan-in)
 *   → C) compaction (compactor or pass-through) → D) reranking (reranker)
 *   → E) final response (LLM)
 *
 * Stages always run in this order and each appears exactly once in the result; a disabled
 * stage is reported as SKIPPED. A failed stage does not stop the run: later stages work with
 * whatever earlier stages published. The instance keeps no per-run state and can serve
 * concurrent runs; everything a run mutates lives in its {@link StageContext}.
 */
@Slf4j
public class ReasoningPipeline {

    public static final String TRACE_ID_MDC_KEY = "traceId";
    static final String NO_RESPONSE = "No response generated";

    @Getter
    private final PipelineConfig config;
    private final Cache<StageOutput> cache;
    private final Executor executor;
    private final PipelineMetricsTracker metricsTracker;
    @Getter
    private final List<Stage> stages;

    /**
     * @param agent           reasoning collaborator (required)
     * @param config          pipeline configuration, defaults when {@code null}
     * @param compactor       optional; compaction passes input through without it
     * @param reranker        optional; required when reranking is enabled
     * @param cache           stage output cache, a fresh {@link MemoryCache} when {@code null}
     * @param executor        runs collaborator calls and async runs, the common pool when {@code null}
     * @param metricsTracker  process-wide counters, a fresh tracker when {@code null}
     * @param promptBuilder   prompt templates, defaults when {@code null}
     * @param cacheKeyBuilder cache key derivation, defaults when {@code null}
     * @throws PipelineConfigurationException when the configuration is invalid or contradictory
     */
    @Builder
    public ReasoningPipeline(ReasoningAgent agent,
                             PipelineConfig config,
                             Compactor compactor,
                             Reranker reranker,
                             Cache<StageOutput> cache,
                             Executor executor,
                             PipelineMetricsTracker metricsTracker,
                             StagePromptBuilder promptBuilder,
                             CacheKeyBuilder cacheKeyBuilder) {
        if (agent == null) {
            throw new PipelineConfigurationException("A reasoning agent is required");
        }
        this.config = config != null ? config : PipelineConfig.defaults();
        this.config.validate(reranker != null);

        this.cache = cache != null ? cache : new MemoryCache<>();
        this.executor = executor != null ? executor : ForkJoinPool.commonPool();
        this.metricsTracker = metricsTracker != null ? metricsTracker : new PipelineMetricsTracker();

        StagePromptBuilder prompts = promptBuilder != null ? promptBuilder : new StagePromptBuilder();
        StageRuntime runtime = new StageRuntime(this.executor, this.cache,
                cacheKeyBuilder != null ? cacheKeyBuilder : new CacheKeyBuilder(),
                this.config.cacheTtl());

        this.stages = List.of(
                new PreprocessingStage(agent, prompts, this.config.isEnablePreprocessing(), runtime),
                new WorkingAwarenessStage(agent, prompts, this.config.getNumPerspectives(),
                        this.config.isParallelExecution(), this.config.isEnableWorkingAwareness(), runtime),
                new CompactionStage(compactor, prompts, this.config.isEnableCompaction(), runtime),
                new RerankingStage(reranker, this.config.isEnableReranking(), runtime),
                new FinalResponseStage(agent, prompts, this.config.isEnableFinalResponse(), runtime)
        );

        log.info("[Pipeline] Initialized: enabled={}, parallel={}, perspectives={}, cache={}, compactor={}, reranker={}",
                stages.stream().filter(Stage::isEnabled).map(s -> s.type().key()).toList(),
                this.config.isParallelExecution(), this.config.getNumPerspectives(),
                this.config.getCacheStrategy(), compactor != null, reranker != null);
    }

    public PipelineResult process(String prompt) {
        return process(PipelineRequest.of(prompt));
    }

    public PipelineResult process(PipelineRequest request) {
        return process(request, CancellationToken.create());
    }

    /**
     * Run every configured stage for one request.
     * Always returns a result; per-stage failures are reported in {@link PipelineResult#stages()}.
     */
    public PipelineResult process(PipelineRequest request, CancellationToken cancellation) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.create();
        Tracer tracer = config.isEnableTracing() ? new Tracer() : null;
        MetricsCollector metrics = config.isEnableMetrics() ? new MetricsCollector() : null;

        if (tracer != null) {
            MDC.put(TRACE_ID_MDC_KEY, tracer.getTraceId());
        }
        try {
            log.info("[Pipeline] Processing request: {}", abbreviate(request.prompt(), 100));

            Span pipelineSpan = tracer != null
                    ? tracer.startSpan("reasoning_pipeline", Map.of("prompt_length", String.valueOf(request.prompt().length())))
                    : null;

            StageContext context = new StageContext(request, config.isCachingEnabled(), token);
            long start = System.nanoTime();

            for (Stage stage : stages) {
                Span stageSpan = tracer != null ? tracer.startSpan("stage_" + stage.type().key(), Map.of()) : null;

                StageResult result = runStage(stage, context);
                context.record(result);

                if (stageSpan != null) {
                    tracer.addAttribute(stageSpan, "status", result.status().name().toLowerCase(Locale.ROOT));
                    if (result.isFailed()) {
                        tracer.addEvent(stageSpan, result.error().message());
                    }
                    tracer.endSpan(stageSpan);
                }
                if (metrics != null && result.status() != StageStatus.SKIPPED) {
                    metrics.recordDuration(result.stageType(), result.durationMs());
                }
            }

            double totalDurationMs = (System.nanoTime() - start) / 1_000_000.0;
            if (pipelineSpan != null) {
                tracer.endSpan(pipelineSpan);
            }

            List<StageResult> results = context.getPreviousResults();
            int cacheHits = (int) results.stream().filter(StageResult::cacheHit).count();
            String finalResponse = resolveFinalResponse(context);

            Map<String, Object> metadata = new LinkedHashMap<>();
            if (metrics != null) {
                metrics.incrementCounter("completed_stages", countStatus(results, StageStatus.COMPLETED));
                metrics.incrementCounter("failed_stages", countStatus(results, StageStatus.FAILED));
                metrics.incrementCounter("skipped_stages", countStatus(results, StageStatus.SKIPPED));
                metrics.incrementCounter("cache_hits", cacheHits);
                metadata.put("metrics", metrics.getSummary());
            }
            if (tracer != null) {
                metadata.put("trace_id", tracer.getTraceId());
            }

            PipelineResult result = new PipelineResult(finalResponse, results, totalDurationMs, request,
                    cacheHits, Instant.now(), metadata);

            log.info("[Pipeline] Complete in {}ms, statuses={}, cacheHits={}, finalResponse={} chars",
                    String.format("%.2f", totalDurationMs),
                    results.stream().map(r -> r.stageType().key() + "=" + r.status()).toList(),
                    cacheHits, finalResponse.length());
            metricsTracker.recordRun(result);
            return result;
        } finally {
            if (tracer != null) {
                MDC.remove(TRACE_ID_MDC_KEY);
            }
        }
    }

    /**
     * Run {@link #process(PipelineRequest, CancellationToken)} on the pipeline executor.
     * Cancelling the returned future cancels the run: stages still pending report FAILED.
     */
    public CompletableFuture<PipelineResult> processAsync(PipelineRequest request) {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<PipelineResult> future = CompletableFuture.supplyAsync(() -> process(request, token), executor);
        future.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                token.cancel();
            }
        });
        return future;
    }

    private StageResult runStage(Stage stage, StageContext context) {
        try {
            Deadline deadline = config.isStageEnabled(stage.type())
                    ? Deadline.after(config.stageTimeout())
                    : Deadline.none();
            return stage.execute(context, deadline);
        } catch (RuntimeException e) {
            // Stages convert their own faults; this only guards against a broken stage implementation.
            log.error("[Pipeline] Stage {} threw past its boundary", stage.type().key(), e);
            return StageResult.failed(stage.type(), StageError.Kind.INTERNAL,
                    "Stage " + stage.type().key() + " failed: " + e.getMessage(), 0);
        }
    }

    /**
     * Final response text, or the pass-through when the final stage did not complete:
     * the latest completed stage's text, else the raw prompt.
     */
    static String resolveFinalResponse(StageContext context) {
        String text = context.output(StageType.FINAL_RESPONSE)
                .map(StageOutput::asText)
                .or(context::latestCompletedText)
                .orElse(context.getRequest().prompt());
        return text.isBlank() ? NO_RESPONSE : text;
    }

    private static int countStatus(List<StageResult> results, StageStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
