package com.taskgraph.engine.resource;

import com.taskgraph.core.model.NetworkClass;

import java.util.Map;

/**
 * Total budget the allocator admits against.
 *
 * A network class or custom dimension missing from the maps is unconstrained.
 */
public record ResourceCapacity(
    double cpuCores,
    long memoryMb,
    int gpuSlots,
    long diskMb,
    Map<NetworkClass, Integer> networkSlots,
    Map<String, Double> custom
) {
    public ResourceCapacity {
        if (cpuCores < 0 || memoryMb < 0 || gpuSlots < 0 || diskMb < 0) {
            throw new IllegalArgumentException("Capacity must be >= 0");
        }
        networkSlots = networkSlots != null ? Map.copyOf(networkSlots) : Map.of();
        custom = custom != null ? Map.copyOf(custom) : Map.of();
    }
}
