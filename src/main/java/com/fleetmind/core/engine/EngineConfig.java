package com.fleetmind.core.engine;

import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.pipeline.PipelineStateMachine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    @Bean
    public PipelineStateMachine pipelineStateMachine() {
        return new PipelineStateMachine();
    }

    /**
     * Runs pipelines started with {@link PipelineOrchestrator#start}. Each pipeline holds one thread
     * for its whole run.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(FleetmindProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getPipeline().getOrchestratorThreads()), r -> {
            Thread t = new Thread(r, "fleetmind-pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
