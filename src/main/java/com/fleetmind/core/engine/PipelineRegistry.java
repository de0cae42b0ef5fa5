package com.fleetmind.core.engine;

import com.fleetmind.core.model.Pipeline;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Table of pipelines known to this process. Readers always receive copies.
 */
@Component
public class PipelineRegistry {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Pipeline> pipelines = new HashMap<>();

    public void register(Pipeline pipeline) {
        lock.writeLock().lock();
        try {
            if (pipelines.putIfAbsent(pipeline.getId(), pipeline) != null) {
                throw new IllegalStateException("Pipeline " + pipeline.getId() + " already registered");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies a mutation under the table lock.
     *
     * @return a copy of the pipeline after the mutation
     * @throws IllegalArgumentException when the pipeline is unknown
     */
    public Pipeline update(String pipelineId, Consumer<Pipeline> mutation) {
        lock.writeLock().lock();
        try {
            Pipeline pipeline = pipelines.get(pipelineId);
            if (pipeline == null) {
                throw new IllegalArgumentException("Unknown pipeline: " + pipelineId);
            }
            mutation.accept(pipeline);
            return pipeline.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Pipeline> snapshot(String pipelineId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(pipelines.get(pipelineId)).map(Pipeline::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** All pipelines, newest first. */
    public List<Pipeline> list() {
        lock.readLock().lock();
        try {
            return pipelines.values().stream()
                    .map(Pipeline::copy)
                    .sorted(Comparator.comparing(Pipeline::getCreatedAt).reversed())
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }
}
