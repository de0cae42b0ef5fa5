package com.fleetmind.worker;

import com.fleetmind.core.model.OutputEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ring of the most recent output events per worker.
 */
public class OutputHistory {

    private static final Logger log = LoggerFactory.getLogger(OutputHistory.class);

    private final int limit;
    private final ConcurrentHashMap<String, Deque<OutputEvent>> outputs = new ConcurrentHashMap<>();

    public OutputHistory(int limit) {
        this.limit = Math.max(1, limit);
    }

    public void append(OutputEvent event) {
        Deque<OutputEvent> events = outputs.computeIfAbsent(event.workerId(), id -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > limit) {
                events.removeFirst();
            }
        }
    }

    /** Up to {@code max} most recent events of a worker, oldest first. */
    public List<OutputEvent> recent(String workerId, int max) {
        Deque<OutputEvent> events = outputs.get(workerId);
        if (events == null || max <= 0) {
            return List.of();
        }
        synchronized (events) {
            var all = new ArrayList<>(events);
            return List.copyOf(all.subList(Math.max(0, all.size() - max), all.size()));
        }
    }

    public void forget(String workerId) {
        Deque<OutputEvent> removed = outputs.remove(workerId);
        if (removed != null) {
            log.debug("Dropped output history of worker {}", workerId);
        }
    }

    public int trackedWorkers() {
        return outputs.size();
    }
}
