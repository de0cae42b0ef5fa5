package com.fleetmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for worker supervision and pipeline execution.
 */
@Service
public class FleetmindMetrics {

    private final MeterRegistry registry;

    public FleetmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkerSpawned(String source) {
        Counter.builder("fleetmind.workers.spawned")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordWorkerEnded(String finalStatus) {
        Counter.builder("fleetmind.workers.ended")
                .tag("status", finalStatus)
                .register(registry)
                .increment();
    }

    public void recordSpawnFailure() {
        Counter.builder("fleetmind.workers.spawn_failures")
                .register(registry)
                .increment();
    }

    public void recordOutputEvent(String outputType) {
        Counter.builder("fleetmind.worker.output_events")
                .tag("type", outputType)
                .register(registry)
                .increment();
    }

    public void recordStepDuration(String role, long ms) {
        Timer.builder("fleetmind.step.duration")
                .tag("role", role)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDecision(String decision) {
        Counter.builder("fleetmind.decisions.total")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("fleetmind.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordPipelineResult(String state) {
        Counter.builder("fleetmind.pipelines.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    /**
     * Records a best-effort persistence write that was lost.
     *
     * @param reason "failed" when the store threw, "dropped" when the queue was full
     */
    public void recordPersistenceLoss(String reason) {
        Counter.builder("fleetmind.persistence.lost_writes")
                .description("Persistence writes that were not applied")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
