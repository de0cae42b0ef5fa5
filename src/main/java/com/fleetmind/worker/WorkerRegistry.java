package com.fleetmind.worker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Table of live workers, recently ended workers and the session index.
 * <p>
 * Ended workers stay reachable for lookups until {@code retainedEnded} newer ones
 * have ended after them.
 */
class WorkerRegistry {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, WorkerAgent> live = new LinkedHashMap<>();
    private final LinkedHashMap<String, WorkerAgent> retired = new LinkedHashMap<>();
    private final Map<String, String> sessions = new HashMap<>();
    private final int retainedEnded;

    WorkerRegistry(int retainedEnded) {
        this.retainedEnded = Math.max(0, retainedEnded);
    }

    void add(WorkerAgent agent) {
        lock.writeLock().lock();
        try {
            live.put(agent.id(), agent);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Optional<WorkerAgent> live(String workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(live.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** A live worker, or a recently ended one. */
    Optional<WorkerAgent> find(String workerId) {
        lock.readLock().lock();
        try {
            WorkerAgent agent = live.get(workerId);
            return Optional.ofNullable(agent != null ? agent : retired.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    List<WorkerAgent> liveAgents() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(live.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    List<String> liveIds() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(live.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Moves a worker from the live table to the retired set.
     *
     * @return ids of retired workers evicted to make room
     */
    List<String> retire(String workerId) {
        lock.writeLock().lock();
        try {
            WorkerAgent agent = live.remove(workerId);
            if (agent == null) {
                return List.of();
            }
            sessions.values().removeIf(workerId::equals);
            retired.put(workerId, agent);
            var evicted = new ArrayList<String>();
            var it = retired.keySet().iterator();
            while (retired.size() - evicted.size() > retainedEnded && it.hasNext()) {
                evicted.add(it.next());
            }
            evicted.forEach(retired::remove);
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Records the session a live worker reported. Repeated registration is a no-op. */
    void registerSession(String sessionId, String workerId) {
        lock.writeLock().lock();
        try {
            if (live.containsKey(workerId)) {
                sessions.put(sessionId, workerId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    Optional<String> findBySession(String sessionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }
}
