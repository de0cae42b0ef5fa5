package com.fleetmind.core.persistence;

import com.fleetmind.core.model.OutputEvent;
import com.fleetmind.core.model.PromptRecord;
import com.fleetmind.core.model.RunQuery;
import com.fleetmind.core.model.RunRecord;
import com.fleetmind.core.model.RunStats;
import com.fleetmind.core.model.RunStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link RunStore} kept in memory. Used when no database is configured;
 * history is lost on restart.
 */
public class InMemoryRunStore implements RunStore {

    private static final int MAX_OUTPUTS_PER_WORKER = 1000;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong ids = new AtomicLong();
    private final Map<String, RunRecord> runs = new LinkedHashMap<>();
    private final Map<String, List<PromptRecord>> prompts = new HashMap<>();
    private final Map<String, Deque<OutputEvent>> outputs = new HashMap<>();

    @Override
    public long createRun(RunRecord run) {
        long id = ids.incrementAndGet();
        var stored = run.copy();
        stored.setId(id);
        lock.writeLock().lock();
        try {
            runs.put(stored.getWorkerId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        return id;
    }

    @Override
    public void updateRun(RunRecord run) {
        lock.writeLock().lock();
        try {
            RunRecord existing = runs.get(run.getWorkerId());
            var stored = run.copy();
            if (existing != null && stored.getId() == null) {
                stored.setId(existing.getId());
            }
            runs.put(stored.getWorkerId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<RunRecord> getRun(String workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(runs.get(workerId)).map(RunRecord::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RunRecord> queryRuns(RunQuery query) {
        lock.readLock().lock();
        try {
            var stream = runs.values().stream()
                    .filter(query::matches)
                    .sorted(Comparator.comparing(RunRecord::getStartedAt,
                            Comparator.nullsLast(Comparator.reverseOrder())))
                    .map(RunRecord::copy);
            if (query.offset() != null) {
                stream = stream.skip(query.offset());
            }
            if (query.limit() != null) {
                stream = stream.limit(query.limit());
            }
            return stream.toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void recordPrompt(String workerId, String prompt, Instant at) {
        lock.writeLock().lock();
        try {
            prompts.computeIfAbsent(workerId, k -> new ArrayList<>()).add(new PromptRecord(workerId, prompt, at));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<PromptRecord> getPrompts(String workerId) {
        lock.readLock().lock();
        try {
            return List.copyOf(prompts.getOrDefault(workerId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void recordOutput(OutputEvent event) {
        lock.writeLock().lock();
        try {
            Deque<OutputEvent> deque = outputs.computeIfAbsent(event.workerId(), k -> new ArrayDeque<>());
            deque.addLast(event);
            while (deque.size() > MAX_OUTPUTS_PER_WORKER) {
                deque.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<OutputEvent> getOutputs(String workerId, int limit) {
        lock.readLock().lock();
        try {
            var all = new ArrayList<>(outputs.getOrDefault(workerId, new ArrayDeque<>()));
            int from = Math.max(0, all.size() - limit);
            return List.copyOf(all.subList(from, all.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int cleanupRunsBefore(Instant cutoff) {
        lock.writeLock().lock();
        try {
            var doomed = runs.values().stream()
                    .filter(r -> !r.getStatus().isLive())
                    .filter(r -> r.getStartedAt() != null && r.getStartedAt().isBefore(cutoff))
                    .map(RunRecord::getWorkerId)
                    .toList();
            doomed.forEach(id -> {
                runs.remove(id);
                prompts.remove(id);
                outputs.remove(id);
            });
            return doomed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public RunStats getStats() {
        lock.readLock().lock();
        try {
            Map<String, Long> byStatus = new TreeMap<>();
            Map<String, Long> bySource = new TreeMap<>();
            double cost = 0.0;
            long resumable = 0;
            for (RunRecord run : runs.values()) {
                byStatus.merge(run.getStatus().wireName(), 1L, Long::sum);
                bySource.merge(run.getSource().wireName(), 1L, Long::sum);
                if (run.getTotalCostUsd() != null) {
                    cost += run.getTotalCostUsd();
                }
                if (run.getStatus() == RunStatus.CRASHED && run.isCanResume()) {
                    resumable++;
                }
            }
            return new RunStats(runs.size(), byStatus, bySource, cost, resumable);
        } finally {
            lock.readLock().unlock();
        }
    }
}
