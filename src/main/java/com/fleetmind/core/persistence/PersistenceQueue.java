package com.fleetmind.core.persistence;

import com.fleetmind.FleetmindProperties;
import com.fleetmind.core.metrics.FleetmindMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort background writer for the run store.
 * <p>
 * Writes run on a single thread in submission order. Delivery is at most once:
 * a write that throws is logged and counted, never retried; a write submitted while
 * the queue is full is dropped; writes still queued when the JVM dies are lost.
 * Submitting never blocks and never throws.
 */
@Component
public class PersistenceQueue {

    private static final Logger log = LoggerFactory.getLogger(PersistenceQueue.class);

    private final ThreadPoolExecutor executor;
    private final FleetmindMetrics metrics;

    public PersistenceQueue(FleetmindProperties properties, FleetmindMetrics metrics) {
        this.metrics = metrics;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(properties.getPersistence().getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "fleetmind-persistence");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Queues a write.
     *
     * @param description what the write does, for the log
     * @param write       the store call to make
     */
    public void submit(String description, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.warn("Persistence write '{}' failed: {}", description, e.getMessage(), e);
                    metrics.recordPersistenceLoss("failed");
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Persistence queue full or closed; dropping write '{}'", description);
            metrics.recordPersistenceLoss("dropped");
        }
    }

    /**
     * Waits until every write queued before this call has been attempted.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(Duration timeout) {
        var latch = new CountDownLatch(1);
        try {
            executor.execute(latch::countDown);
        } catch (RejectedExecutionException e) {
            return executor.getQueue().isEmpty();
        }
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int pending() {
        return executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Persistence queue did not drain in time; {} writes lost", executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
