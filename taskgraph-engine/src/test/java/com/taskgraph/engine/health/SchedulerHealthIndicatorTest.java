package com.taskgraph.engine.health;

import com.taskgraph.engine.test.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class SchedulerHealthIndicatorTest {

    private EngineHarness engine;
    private SchedulerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        engine = new EngineHarness((context, config, input) -> null);
        indicator = new SchedulerHealthIndicator(engine.scheduler, engine.allocator, engine.dispatcher,
            engine.store, engine.clock, Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() {
        engine.scheduler.stop();
    }

    @Test
    void testDownWhenLoopNotStarted() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
            .containsEntry("schedulerRunning", false)
            .containsEntry("lastTickAt", "never")
            .containsEntry("activeWorkflows", 0)
            .containsKey("resources");
    }

    @Test
    void testUpOnceTicking() throws InterruptedException {
        engine.scheduler.start();
        long waitUntil = System.currentTimeMillis() + 5_000;
        while (engine.scheduler.getTickCount() == 0 && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(10);
        }

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("inFlightRunners", 0);
    }
}
