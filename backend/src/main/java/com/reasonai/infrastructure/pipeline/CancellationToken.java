package com.reasonai.infrastructure.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-controlled cancellation signal for one pipeline run.
 * Every wait on collaborator work goes through {@link #await}, so raising the signal
 * releases the waiting stage instead of letting it hang.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new PipelineCancelledException(operation + " cancelled by caller");
        }
    }

    /**
     * Wait for {@code work} until it finishes, the deadline passes or the token is cancelled.
     * Pending work is cancelled in the last two cases.
     *
     * @return the work's result
     * @throws PipelineCancelledException when the token is raised first
     * @throws StageTimeoutException      when the deadline passes first
     * @throws RuntimeException           the work's own failure, unwrapped
     */
    public <T> T await(CompletableFuture<T> work, Deadline deadline, String operation) {
        throwIfCancelled(operation);
        try {
            CompletableFuture.anyOf(work.handle((value, error) -> null), signal)
                    .get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            work.cancel(true);
            throw new StageTimeoutException(operation + " timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            work.cancel(true);
            throw new PipelineCancelledException(operation + " interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException(operation + " wait failed unexpectedly", e);
        }

        if (!work.isDone()) {
            work.cancel(true);
            throw new PipelineCancelledException(operation + " cancelled by caller");
        }

        try {
            return work.join();
        } catch (CancellationException e) {
            throw new PipelineCancelledException(operation + " cancelled");
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
