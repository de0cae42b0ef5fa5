package com.fleetmind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FleetmindMetricsTest {

    private SimpleMeterRegistry registry;
    private FleetmindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FleetmindMetrics(registry);
    }

    @Test
    @DisplayName("worker lifecycle counters are tagged")
    void workerCounters() {
        metrics.recordWorkerSpawned("pipeline");
        metrics.recordWorkerSpawned("pipeline");
        metrics.recordWorkerEnded("stopped");
        metrics.recordSpawnFailure();

        assertEquals(2.0, registry.find("fleetmind.workers.spawned").tag("source", "pipeline").counter().count());
        assertEquals(1.0, registry.find("fleetmind.workers.ended").tag("status", "stopped").counter().count());
        assertEquals(1.0, registry.find("fleetmind.workers.spawn_failures").counter().count());
    }

    @Test
    @DisplayName("recordStepDuration creates a timer per role")
    void stepDuration() {
        metrics.recordStepDuration("planning", 1500);
        metrics.recordStepDuration("verifying", 300);

        var timer = registry.find("fleetmind.step.duration").tag("role", "planning").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(registry.find("fleetmind.step.duration").tag("role", "verifying").timer());
    }

    @Test
    @DisplayName("decisions and pipeline results are counted by tag")
    void decisionsAndResults() {
        metrics.recordDecision("iterate");
        metrics.recordDecision("iterate");
        metrics.recordDecision("complete");
        metrics.recordPipelineResult("COMPLETED");

        assertEquals(2.0, registry.find("fleetmind.decisions.total").tag("decision", "iterate").counter().count());
        assertEquals(1.0, registry.find("fleetmind.decisions.total").tag("decision", "complete").counter().count());
        assertEquals(1.0, registry.find("fleetmind.pipelines.total").tag("state", "COMPLETED").counter().count());
    }

    @Test
    @DisplayName("recordIterationDepth records to distribution summary")
    void iterationDepth() {
        metrics.recordIterationDepth(1);
        metrics.recordIterationDepth(3);

        var summary = registry.find("fleetmind.iteration.depth").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount());
    }

    @Test
    @DisplayName("lost persistence writes are counted by reason")
    void persistenceLoss() {
        metrics.recordPersistenceLoss("dropped");
        metrics.recordOutputEvent("text");

        assertEquals(1.0, registry.find("fleetmind.persistence.lost_writes").tag("reason", "dropped").counter().count());
        assertEquals(1.0, registry.find("fleetmind.worker.output_events").tag("type", "text").counter().count());
    }
}
