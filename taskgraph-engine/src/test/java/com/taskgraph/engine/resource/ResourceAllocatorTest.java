package com.taskgraph.engine.resource;

import com.taskgraph.core.model.NetworkClass;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.ResourceRequirement;
import com.taskgraph.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResourceAllocatorTest {

    private ResourceAllocator allocator;

    @BeforeEach
    void setUp() {
        ResourceCapacity capacity = new ResourceCapacity(4.0, 8192, 1, 10_000,
            Map.of(NetworkClass.HIGH, 1), Map.of("licenses", 2.0));
        allocator = new ResourceAllocator(capacity, TimeController.frozen());
    }

    private static NodeRef node() {
        return NodeRef.task(UUID.randomUUID());
    }

    @Test
    @DisplayName("Claims are admitted until the budget is spent and released afterwards")
    void testAdmitAndRelease() {
        Optional<ResourceToken> first = allocator.tryAdmit(node(), ResourceRequirement.cpuAndMemory(3.0, 4096));
        Optional<ResourceToken> second = allocator.tryAdmit(node(), ResourceRequirement.cpuAndMemory(2.0, 1024));

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(allocator.utilization().cpuClaimed()).isEqualTo(3.0);

        assertThat(allocator.release(first.get())).isTrue();
        assertThat(allocator.release(first.get())).isFalse();
        assertThat(allocator.utilization().cpuClaimed()).isZero();
        assertThat(allocator.tryAdmit(node(), ResourceRequirement.cpuAndMemory(2.0, 1024))).isPresent();
    }

    @Test
    @DisplayName("Admitting the same node twice returns the held token")
    void testAdmitIsIdempotentPerNode() {
        NodeRef node = node();
        ResourceToken token = allocator.tryAdmit(node, ResourceRequirement.cpuAndMemory(1.0, 512)).orElseThrow();

        assertThat(allocator.tryAdmit(node, ResourceRequirement.cpuAndMemory(1.0, 512))).contains(token);
        assertThat(allocator.utilization().cpuClaimed()).isEqualTo(1.0);
        assertThat(allocator.isHeld(node)).isTrue();

        assertThat(allocator.releaseFor(node)).isTrue();
        assertThat(allocator.isHeld(node)).isFalse();
    }

    @Test
    @DisplayName("Gpu, network slots and custom resources are budgeted")
    void testDiscreteDimensions() {
        ResourceRequirement gpu = ResourceRequirement.builder().gpu(true).build();
        ResourceRequirement network = ResourceRequirement.builder().networkClass(NetworkClass.HIGH).build();
        ResourceRequirement license = ResourceRequirement.builder().custom(Map.of("licenses", 1.5)).build();

        assertThat(allocator.tryAdmit(node(), gpu)).isPresent();
        assertThat(allocator.tryAdmit(node(), gpu)).isEmpty();
        assertThat(allocator.tryAdmit(node(), network)).isPresent();
        assertThat(allocator.tryAdmit(node(), network)).isEmpty();
        assertThat(allocator.tryAdmit(node(), license)).isPresent();
        assertThat(allocator.tryAdmit(node(), license)).isEmpty();
    }

    @Test
    @DisplayName("Unconfigured network classes and custom names are unconstrained")
    void testMissingDimensionsAreUnconstrained() {
        ResourceRequirement low = ResourceRequirement.builder().networkClass(NetworkClass.LOW).build();
        ResourceRequirement other = ResourceRequirement.builder().custom(Map.of("tokens", 100.0)).build();

        assertThat(allocator.tryAdmit(node(), low)).isPresent();
        assertThat(allocator.tryAdmit(node(), low)).isPresent();
        assertThat(allocator.tryAdmit(node(), other)).isPresent();
        assertThat(allocator.tryAdmit(node(), null)).isPresent();
    }

    @Test
    @DisplayName("Requirements larger than total capacity are reported")
    void testExceedsCapacity() {
        ResourceRequirement huge = ResourceRequirement.builder().cpuCores(8.0).memoryMb(100).diskMb(20_000).build();

        assertThat(allocator.exceedsCapacity(huge)).containsExactly("cpu", "disk");
        assertThat(allocator.exceedsCapacity(ResourceRequirement.cpuAndMemory(4.0, 8192))).isEmpty();
        assertThat(allocator.exceedsCapacity(null)).isEmpty();
    }

    @Test
    @DisplayName("Concurrent admissions never oversubscribe the budget")
    void testConcurrentAdmission() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Runnable> attempts = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            attempts.add(() -> {
                try {
                    start.await();
                    if (allocator.tryAdmit(node(), ResourceRequirement.cpuAndMemory(0.5, 0)).isPresent()) {
                        admitted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        attempts.forEach(executor::submit);
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(admitted.get()).isEqualTo(8);
        assertThat(allocator.utilization().tokensHeld()).isEqualTo(8);
    }
}
