package com.taskgraph.core.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.spi.RunContext;
import com.taskgraph.core.spi.TaskRunner;
import com.taskgraph.core.spi.TaskRunnerException;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link TaskRunner} for failure-injection tests.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureInjector injector = FailureInjector.builder()
 *     .failFirst(1)
 *     .build();
 *
 * TaskRunner runner = injector.asRunner(output);
 * // first call throws, second call returns output
 * }</pre>
 */
public class FailureInjector {

    private final int failFirst;
    private final double failureRate;
    private final Random random;
    private final boolean hang;
    private final boolean retryable;
    private final CountDownLatch release = new CountDownLatch(1);

    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger cancellationsObserved = new AtomicInteger();

    private FailureInjector(Builder builder) {
        this.failFirst = builder.failFirst;
        this.failureRate = builder.failureRate;
        this.random = new Random(builder.seed);
        this.hang = builder.hang;
        this.retryable = builder.retryable;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runner that always fails.
     */
    public static FailureInjector alwaysFail() {
        return builder().failFirst(Integer.MAX_VALUE).build();
    }

    /**
     * Runner that never fails.
     */
    public static FailureInjector neverFail() {
        return builder().build();
    }

    /**
     * Runner that blocks until cancelled or {@link #releaseAll()} is called.
     */
    public static FailureInjector neverReturn() {
        return builder().hang().build();
    }

    /**
     * Adapt this injector into a runner returning the given output on success.
     */
    public TaskRunner asRunner(JsonNode output) {
        return (context, config, input) -> run(context, output);
    }

    private JsonNode run(RunContext context, JsonNode output) throws TaskRunnerException {
        int call = invocations.incrementAndGet();
        if (hang) {
            awaitReleaseOrCancel(context);
            throw new TaskRunnerException("CANCELLED", "Runner stopped after cancellation");
        }
        if (call <= failFirst || (failureRate > 0 && shouldFail())) {
            failures.incrementAndGet();
            throw new TaskRunnerException("INJECTED_FAILURE",
                "Injected failure on call " + call, retryable);
        }
        return output;
    }

    private void awaitReleaseOrCancel(RunContext context) {
        try {
            while (!context.isCancelled()) {
                if (release.await(10, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
            cancellationsObserved.incrementAndGet();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private synchronized boolean shouldFail() {
        return random.nextDouble() < failureRate;
    }

    /**
     * Unblock all hanging invocations.
     */
    public void releaseAll() {
        release.countDown();
    }

    public int getInvocationCount() {
        return invocations.get();
    }

    public int getFailureCount() {
        return failures.get();
    }

    public int getCancellationsObserved() {
        return cancellationsObserved.get();
    }

    /**
     * Wait until the runner has been invoked at least {@code count} times.
     */
    public boolean awaitInvocations(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (invocations.get() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    public static class Builder {
        private int failFirst;
        private double failureRate;
        private long seed = 42L;
        private boolean hang;
        private boolean retryable = true;

        /**
         * Fail the first {@code n} invocations, then succeed.
         */
        public Builder failFirst(int n) {
            this.failFirst = n;
            return this;
        }

        /**
         * Fail randomly with the given probability (0.0 to 1.0).
         */
        public Builder withFailureRate(double rate) {
            if (rate < 0 || rate > 1) {
                throw new IllegalArgumentException("Rate must be between 0 and 1");
            }
            this.failureRate = rate;
            return this;
        }

        /**
         * Seed for deterministic random failures.
         */
        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder hang() {
            this.hang = true;
            return this;
        }

        public Builder permanentFailures() {
            this.retryable = false;
            return this;
        }

        public FailureInjector build() {
            return new FailureInjector(this);
        }
    }
}
