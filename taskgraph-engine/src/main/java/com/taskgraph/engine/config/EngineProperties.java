package com.taskgraph.engine.config;

import com.taskgraph.core.model.NetworkClass;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.engine.resource.ResourceCapacity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Engine settings bound from {@code taskgraph.engine.*}.
 */
@ConfigurationProperties(prefix = "taskgraph.engine")
public class EngineProperties {

    private Duration tickInterval = Duration.ofMillis(500);
    private int workerThreads = 8;
    private Duration timerPollInterval = Duration.ofMillis(200);
    private Duration webhookTimeout = Duration.ofHours(24);
    private final Resources resources = new Resources();
    private final Retry retry = new Retry();
    private final Recovery recovery = new Recovery();

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getTimerPollInterval() {
        return timerPollInterval;
    }

    public void setTimerPollInterval(Duration timerPollInterval) {
        this.timerPollInterval = timerPollInterval;
    }

    public Duration getWebhookTimeout() {
        return webhookTimeout;
    }

    public void setWebhookTimeout(Duration webhookTimeout) {
        this.webhookTimeout = webhookTimeout;
    }

    public Resources getResources() {
        return resources;
    }

    public Retry getRetry() {
        return retry;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public ResourceCapacity toCapacity() {
        return new ResourceCapacity(
            resources.getCpuCores(),
            resources.getMemoryMb(),
            resources.getGpuSlots(),
            resources.getDiskMb(),
            resources.getNetworkSlots(),
            resources.getCustom()
        );
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
            .baseDelay(retry.getBaseDelay())
            .maxDelay(retry.getMaxDelay())
            .backoffMultiplier(2.0)
            .jitterFactor(retry.getJitterFactor())
            .nonRetryableErrors(retry.getNonRetryableErrors())
            .build();
    }

    /**
     * Total resource budget of this scheduler instance.
     */
    public static class Resources {
        private double cpuCores = 16;
        private long memoryMb = 32_768;
        private int gpuSlots = 0;
        private long diskMb = 102_400;
        private Map<NetworkClass, Integer> networkSlots = new EnumMap<>(Map.of(
            NetworkClass.LOW, 64,
            NetworkClass.STANDARD, 32,
            NetworkClass.HIGH, 8
        ));
        private Map<String, Double> custom = new HashMap<>();

        public double getCpuCores() {
            return cpuCores;
        }

        public void setCpuCores(double cpuCores) {
            this.cpuCores = cpuCores;
        }

        public long getMemoryMb() {
            return memoryMb;
        }

        public void setMemoryMb(long memoryMb) {
            this.memoryMb = memoryMb;
        }

        public int getGpuSlots() {
            return gpuSlots;
        }

        public void setGpuSlots(int gpuSlots) {
            this.gpuSlots = gpuSlots;
        }

        public long getDiskMb() {
            return diskMb;
        }

        public void setDiskMb(long diskMb) {
            this.diskMb = diskMb;
        }

        public Map<NetworkClass, Integer> getNetworkSlots() {
            return networkSlots;
        }

        public void setNetworkSlots(Map<NetworkClass, Integer> networkSlots) {
            this.networkSlots = networkSlots;
        }

        public Map<String, Double> getCustom() {
            return custom;
        }

        public void setCustom(Map<String, Double> custom) {
            this.custom = custom;
        }
    }

    /**
     * Backoff between retries. The retry budget itself is per node.
     */
    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double jitterFactor = 0.0;
        private Set<String> nonRetryableErrors = new HashSet<>();

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public Set<String> getNonRetryableErrors() {
            return nonRetryableErrors;
        }

        public void setNonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
        }
    }

    public static class Recovery {
        private Duration sweepInterval = Duration.ofSeconds(5);
        private Duration stuckThreshold = Duration.ofMinutes(30);

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getStuckThreshold() {
            return stuckThreshold;
        }

        public void setStuckThreshold(Duration stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
        }
    }
}
