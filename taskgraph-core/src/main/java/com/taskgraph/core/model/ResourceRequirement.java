package com.taskgraph.core.model;

import java.util.Map;

/**
 * Resources a node reserves while running. A null requirement means unconstrained.
 *
 * Invariants:
 * - all amounts >= 0
 * - custom amounts >= 0
 */
public record ResourceRequirement(
    double cpuCores,
    long memoryMb,
    boolean gpu,
    long diskMb,
    NetworkClass networkClass,
    Map<String, Double> custom
) {
    public ResourceRequirement {
        if (cpuCores < 0 || memoryMb < 0 || diskMb < 0) {
            throw new IllegalArgumentException("Resource amounts must be >= 0");
        }
        custom = custom != null ? Map.copyOf(custom) : Map.of();
        for (Map.Entry<String, Double> entry : custom.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("Custom resource " + entry.getKey() + " must be >= 0");
            }
        }
    }

    public static ResourceRequirement none() {
        return new ResourceRequirement(0, 0, false, 0, null, Map.of());
    }

    public static ResourceRequirement cpuAndMemory(double cpuCores, long memoryMb) {
        return new ResourceRequirement(cpuCores, memoryMb, false, 0, null, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double cpuCores;
        private long memoryMb;
        private boolean gpu;
        private long diskMb;
        private NetworkClass networkClass;
        private Map<String, Double> custom = Map.of();

        public Builder cpuCores(double cpuCores) {
            this.cpuCores = cpuCores;
            return this;
        }

        public Builder memoryMb(long memoryMb) {
            this.memoryMb = memoryMb;
            return this;
        }

        public Builder gpu(boolean gpu) {
            this.gpu = gpu;
            return this;
        }

        public Builder diskMb(long diskMb) {
            this.diskMb = diskMb;
            return this;
        }

        public Builder networkClass(NetworkClass networkClass) {
            this.networkClass = networkClass;
            return this;
        }

        public Builder custom(Map<String, Double> custom) {
            this.custom = custom;
            return this;
        }

        public ResourceRequirement build() {
            return new ResourceRequirement(cpuCores, memoryMb, gpu, diskMb, networkClass, custom);
        }
    }
}
