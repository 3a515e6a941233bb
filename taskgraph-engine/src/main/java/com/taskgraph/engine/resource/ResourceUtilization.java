package com.taskgraph.engine.resource;

import com.taskgraph.core.model.NetworkClass;

import java.util.Map;

/**
 * Point-in-time view of claimed versus total resources.
 */
public record ResourceUtilization(
    double cpuClaimed,
    double cpuTotal,
    long memoryClaimedMb,
    long memoryTotalMb,
    int gpuClaimed,
    int gpuTotal,
    long diskClaimedMb,
    long diskTotalMb,
    Map<NetworkClass, Integer> networkClaimed,
    Map<String, Double> customClaimed,
    int tokensHeld
) {
}
