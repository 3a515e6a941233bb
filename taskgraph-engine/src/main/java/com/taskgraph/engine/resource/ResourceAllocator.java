package com.taskgraph.engine.resource;

import com.taskgraph.core.model.NetworkClass;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.ResourceRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks claimed versus available resources and admits nodes greedily.
 *
 * Admission is all-or-nothing across every dimension. All state is guarded
 * by the instance monitor; the allocator is the only writer of its counters.
 */
public class ResourceAllocator {

    private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

    private final ResourceCapacity capacity;
    private final Clock clock;

    private final Map<NodeRef, ResourceToken> tokens = new HashMap<>();
    private final Map<NetworkClass, Integer> networkClaimed = new EnumMap<>(NetworkClass.class);
    private final Map<String, Double> customClaimed = new HashMap<>();
    private double cpuClaimed;
    private long memoryClaimed;
    private int gpuClaimed;
    private long diskClaimed;

    public ResourceAllocator(ResourceCapacity capacity, Clock clock) {
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Try to reserve a node's resources.
     *
     * @param node The node being dispatched
     * @param requirement Its requirement, or null for unconstrained
     * @return A token when admitted, empty when the budget cannot hold the claim now
     */
    public synchronized Optional<ResourceToken> tryAdmit(NodeRef node, ResourceRequirement requirement) {
        ResourceToken existing = tokens.get(node);
        if (existing != null) {
            return Optional.of(existing);
        }

        ResourceRequirement claim = requirement != null ? requirement : ResourceRequirement.none();
        List<String> shortfalls = shortfalls(claim, true);
        if (!shortfalls.isEmpty()) {
            log.debug("RESOURCE_EXHAUSTED for {}: {}", node, shortfalls);
            return Optional.empty();
        }

        cpuClaimed += claim.cpuCores();
        memoryClaimed += claim.memoryMb();
        gpuClaimed += claim.gpu() ? 1 : 0;
        diskClaimed += claim.diskMb();
        if (claim.networkClass() != null) {
            networkClaimed.merge(claim.networkClass(), 1, Integer::sum);
        }
        claim.custom().forEach((name, amount) -> customClaimed.merge(name, amount, Double::sum));

        ResourceToken token = new ResourceToken(UUID.randomUUID(), node, claim, clock.instant());
        tokens.put(node, token);
        return Optional.of(token);
    }

    /**
     * Return a token's claim to the budget. Releasing twice is a no-op.
     *
     * @return true if the token was held
     */
    public synchronized boolean release(ResourceToken token) {
        ResourceToken held = tokens.get(token.node());
        if (held == null || !held.tokenId().equals(token.tokenId())) {
            return false;
        }
        tokens.remove(token.node());

        ResourceRequirement claim = token.claim();
        cpuClaimed = Math.max(0, cpuClaimed - claim.cpuCores());
        memoryClaimed = Math.max(0, memoryClaimed - claim.memoryMb());
        gpuClaimed = Math.max(0, gpuClaimed - (claim.gpu() ? 1 : 0));
        diskClaimed = Math.max(0, diskClaimed - claim.diskMb());
        if (claim.networkClass() != null) {
            networkClaimed.computeIfPresent(claim.networkClass(), (k, v) -> v > 1 ? v - 1 : null);
        }
        claim.custom().forEach((name, amount) ->
            customClaimed.computeIfPresent(name, (k, v) -> v - amount > 1e-9 ? v - amount : null));
        return true;
    }

    /**
     * Release whatever token the node holds.
     */
    public synchronized boolean releaseFor(NodeRef node) {
        ResourceToken held = tokens.get(node);
        return held != null && release(held);
    }

    public synchronized boolean isHeld(NodeRef node) {
        return tokens.containsKey(node);
    }

    /**
     * Check whether a requirement could ever be admitted on an empty budget.
     *
     * @return the dimensions that exceed total capacity, empty when it fits
     */
    public synchronized List<String> exceedsCapacity(ResourceRequirement requirement) {
        if (requirement == null) {
            return List.of();
        }
        return shortfalls(requirement, false);
    }

    public synchronized ResourceUtilization utilization() {
        return new ResourceUtilization(
            cpuClaimed, capacity.cpuCores(),
            memoryClaimed, capacity.memoryMb(),
            gpuClaimed, capacity.gpuSlots(),
            diskClaimed, capacity.diskMb(),
            Map.copyOf(networkClaimed),
            Map.copyOf(customClaimed),
            tokens.size()
        );
    }

    private List<String> shortfalls(ResourceRequirement claim, boolean includeClaimed) {
        List<String> shortfalls = new ArrayList<>();
        double cpu = includeClaimed ? cpuClaimed : 0;
        long memory = includeClaimed ? memoryClaimed : 0;
        int gpu = includeClaimed ? gpuClaimed : 0;
        long disk = includeClaimed ? diskClaimed : 0;

        // Small epsilon so fractional cores add up exactly
        if (cpu + claim.cpuCores() > capacity.cpuCores() + 1e-9) {
            shortfalls.add("cpu");
        }
        if (memory + claim.memoryMb() > capacity.memoryMb()) {
            shortfalls.add("memory");
        }
        if (claim.gpu() && gpu + 1 > capacity.gpuSlots()) {
            shortfalls.add("gpu");
        }
        if (disk + claim.diskMb() > capacity.diskMb()) {
            shortfalls.add("disk");
        }
        if (claim.networkClass() != null) {
            Integer slots = capacity.networkSlots().get(claim.networkClass());
            int used = includeClaimed ? networkClaimed.getOrDefault(claim.networkClass(), 0) : 0;
            if (slots != null && used + 1 > slots) {
                shortfalls.add("network:" + claim.networkClass());
            }
        }
        for (Map.Entry<String, Double> entry : claim.custom().entrySet()) {
            Double total = capacity.custom().get(entry.getKey());
            double used = includeClaimed ? customClaimed.getOrDefault(entry.getKey(), 0.0) : 0.0;
            if (total != null && used + entry.getValue() > total + 1e-9) {
                shortfalls.add("custom:" + entry.getKey());
            }
        }
        return shortfalls;
    }
}
