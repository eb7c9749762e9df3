package com.marketsync.common;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Exponential backoff with ±jitter for upstream calls.
 * maxAttempts counts the initial call; delay before retry n (zero-based) is baseDelay * 2^n, jittered.
 */
public final class RetryPolicy {

    /** Pause between attempts; replaced in tests to avoid real sleeping. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final Sleeper sleeper;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, Thread::sleep);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, Sleeper sleeper) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
    }

    /**
     * Delay in milliseconds before the given zero-based retry.
     */
    public long delayMs(int retry) {
        if (retry <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(retry, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /**
     * Runs {@code call}, retrying while {@code retryable} accepts the failure and attempts remain.
     * The last failure is rethrown unchanged (checked exceptions wrapped in {@link RetryExhaustedException}).
     */
    public <T> T execute(Callable<T> call, Predicate<Throwable> retryable) {
        Exception last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                try {
                    sleeper.sleep(delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException("Interrupted during retry backoff", e);
                }
            }
            try {
                return call.call();
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e)) {
                    break;
                }
            }
        }
        if (last instanceof RuntimeException re) {
            throw re;
        }
        throw new RetryExhaustedException("Retries exhausted after " + maxAttempts + " attempt(s)", last);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 3);
    }

    public static class RetryExhaustedException extends RuntimeException {
        public RetryExhaustedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
