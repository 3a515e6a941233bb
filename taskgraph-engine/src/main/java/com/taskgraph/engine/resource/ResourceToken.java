package com.taskgraph.engine.resource;

import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.ResourceRequirement;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof of admission. Held by a node from dispatch until it leaves RUNNING.
 */
public record ResourceToken(
    UUID tokenId,
    NodeRef node,
    ResourceRequirement claim,
    Instant admittedAt
) {
}
