package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.StageError;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.infrastructure.ai.AiReasoningException;
import com.reasonai.infrastructure.cache.Cache;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.PipelineCancelledException;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StageTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Template for pipeline stages: skip → cancellation check → cache lookup → process → cache store.
 * <p>
 * Subclasses implement {@link #process} and route every collaborator call through
 * {@link #call} or {@link #await}, which makes each call a cancellable, deadline-bound wait.
 * Faults are converted here into FAILED results; whether a failure is fatal for the run is
 * the orchestrator's decision.
 * </p>
 */
@Slf4j
public abstract class AbstractStage implements Stage {

    private final StageType type;
    private final boolean enabled;
    protected final StageRuntime runtime;

    protected AbstractStage(StageType type, boolean enabled, StageRuntime runtime) {
        this.type = type;
        this.enabled = enabled;
        this.runtime = runtime;
    }

    @Override
    public final StageType type() {
        return type;
    }

    @Override
    public final boolean isEnabled() {
        return enabled;
    }

    @Override
    public final StageResult execute(StageContext context, Deadline deadline) {
        if (!enabled) {
            log.debug("[Stage] {} is disabled, skipping", type.key());
            return StageResult.skipped(type);
        }

        long start = System.nanoTime();
        if (context.getCancellation().isCancelled()) {
            return failed(StageError.Kind.CANCELLED, "cancelled before start", start);
        }

        log.info("[Stage] {} started", type.key());
        try {
            String cacheKey = cacheKey(context);
            if (cacheKey != null) {
                Optional<StageOutput> cached = readCache(cacheKey);
                if (cached.isPresent()) {
                    double durationMs = elapsedMs(start);
                    log.info("[Stage] {} served from cache in {}ms", type.key(), String.format("%.2f", durationMs));
                    return StageResult.completed(type, cached.get(), durationMs, true);
                }
            }

            StageOutput output = process(context, deadline);

            if (cacheKey != null && shouldCache(output)) {
                writeCache(cacheKey, output);
            }
            double durationMs = elapsedMs(start);
            log.info("[Stage] {} completed in {}ms", type.key(), String.format("%.2f", durationMs));
            return StageResult.completed(type, output, durationMs, false);
        } catch (PipelineCancelledException e) {
            return failed(StageError.Kind.CANCELLED, e.getMessage(), start);
        } catch (StageTimeoutException e) {
            return failed(StageError.Kind.TIMEOUT, e.getMessage(), start);
        } catch (AiReasoningException e) {
            return failed(StageError.Kind.COLLABORATOR, e.getMessage(), start);
        } catch (RuntimeException e) {
            log.error("[Stage] {} raised an unexpected fault", type.key(), e);
            return failed(StageError.Kind.INTERNAL, e.getMessage(), start);
        }
    }

    /**
     * Stage-specific work. Collaborator calls must go through {@link #call} or {@link #await}.
     */
    protected abstract StageOutput process(StageContext context, Deadline deadline);

    /**
     * Inputs that determine this stage's output, or {@code null} when the stage is not cacheable.
     */
    protected List<String> cacheInputs(StageContext context) {
        return null;
    }

    /**
     * Whether a freshly computed output may be stored. Degraded outputs should not be.
     */
    protected boolean shouldCache(StageOutput output) {
        return true;
    }

    /**
     * Stage settings that change the output for identical inputs.
     */
    protected String cacheVariant() {
        return "";
    }

    /**
     * Run one collaborator call on the stage executor and wait for it.
     */
    protected <T> T call(StageContext context, Deadline deadline, Supplier<T> invocation) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(invocation, runtime.executor());
        return await(context, deadline, future);
    }

    /**
     * Wait for collaborator work, honoring the run's cancellation token and the stage deadline.
     * Collaborator faults are rethrown as {@link AiReasoningException}.
     */
    protected <T> T await(StageContext context, Deadline deadline, CompletableFuture<T> future) {
        try {
            return context.getCancellation().await(future, deadline, "Stage " + type.key());
        } catch (PipelineCancelledException | StageTimeoutException | AiReasoningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AiReasoningException(type.displayName() + " collaborator call failed: " + e.getMessage(), e);
        }
    }

    private String cacheKey(StageContext context) {
        if (!context.isCacheEnabled() || runtime.cache() == null) {
            return null;
        }
        List<String> inputs = cacheInputs(context);
        if (inputs == null) {
            return null;
        }
        return runtime.cacheKeyBuilder().buildKey(type, context.getRequest(), inputs, cacheVariant());
    }

    private Optional<StageOutput> readCache(String key) {
        Cache<StageOutput> cache = runtime.cache();
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("[Stage] {} cache read failed, treating as miss: {}", type.key(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, StageOutput output) {
        try {
            runtime.cache().set(key, output, runtime.cacheTtl());
        } catch (RuntimeException e) {
            log.warn("[Stage] {} cache write failed, result not cached: {}", type.key(), e.getMessage());
        }
    }

    private StageResult failed(StageError.Kind kind, String reason, long start) {
        String message = "Stage " + type.key() + " failed: " + reason;
        log.error("[Stage] {} ({})", message, kind);
        return StageResult.failed(type, kind, message, elapsedMs(start));
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
