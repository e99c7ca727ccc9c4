package com.reasonai.infrastructure.pipeline;

import java.time.Duration;

/**
 * Point in time by which a stage has to finish, on the {@link System#nanoTime()} scale.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, false);

    private final long deadlineNanos;
    private final boolean bounded;

    private Deadline(long deadlineNanos, boolean bounded) {
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    /**
     * Timeouts too large for the nanosecond scale saturate to {@link #none()}.
     */
    public static Deadline after(Duration timeout) {
        try {
            return new Deadline(Math.addExact(System.nanoTime(), timeout.toNanos()), true);
        } catch (ArithmeticException e) {
            return NONE;
        }
    }

    public static Deadline none() {
        return NONE;
    }

    public long remainingNanos() {
        if (!bounded) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return bounded && remainingNanos() == 0;
    }

    @Override
    public String toString() {
        return bounded ? "Deadline[" + remainingNanos() / 1_000_000 + "ms left]" : "Deadline[none]";
    }
}
