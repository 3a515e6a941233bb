package com.taskgraph.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff configuration applied when a failed node is re-queued.
 * The retry budget itself lives on each node ({@link NodeLifecycle#maxRetries()}).
 *
 * Invariants:
 * - baseDelay >= 0
 * - maxDelay >= baseDelay
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    Duration baseDelay,
    Duration maxDelay,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
        }
        nonRetryableErrors = nonRetryableErrors != null ? Set.copyOf(nonRetryableErrors) : Set.of();
    }

    /**
     * Default policy: 1s base, doubling, capped at 5 minutes, no jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 0.0, Set.of());
    }

    /**
     * Compute the delay before re-queueing a node.
     *
     * @param retryCount retries already consumed before this failure (0-indexed)
     * @return base * multiplier^retryCount, capped at maxDelay, with jitter applied
     */
    public Duration computeBackoff(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }

        double backoffMs = baseDelay.toMillis() * Math.pow(backoffMultiplier, retryCount);
        double cappedMs = Math.min(backoffMs, maxDelay.toMillis());

        if (jitterFactor == 0.0) {
            return Duration.ofMillis((long) cappedMs);
        }
        // backoff * (1 - jitter + random(0, 2*jitter)), never above the cap
        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        return Duration.ofMillis((long) Math.min(jitteredMs, maxDelay.toMillis()));
    }

    /**
     * Check if an error may be retried at all.
     */
    public boolean shouldRetry(ErrorInfo error) {
        if (error == null) {
            return true;
        }
        if (!error.retryable()) {
            return false;
        }
        return !nonRetryableErrors.contains(error.code());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.0;
        private Set<String> nonRetryableErrors = Set.of();

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(baseDelay, maxDelay, backoffMultiplier, jitterFactor, nonRetryableErrors);
        }
    }
}
