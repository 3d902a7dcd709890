package com.linlay.analysisagent.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes tool execution per session. Different sessions never block each other.
 */
@Component
public class SessionLaneQueue {

    private static final Logger log = LoggerFactory.getLogger(SessionLaneQueue.class);

    private final ConcurrentMap<String, Lane> lanes = new ConcurrentHashMap<>();

    public <T> T execute(String sessionId, Callable<T> task) throws Exception {
        String key = normalize(sessionId);
        Lane lane = acquire(key);
        try {
            if (lane.lock.isLocked() && !lane.lock.isHeldByCurrentThread()) {
                log.debug("Session lane busy, waiting: session={}", key);
            }
            lane.lock.lockInterruptibly();
            try {
                return task.call();
            } finally {
                lane.lock.unlock();
            }
        } finally {
            release(key);
        }
    }

    /**
     * Drops the lane only when no caller holds or waits on it.
     */
    public void removeLane(String sessionId) {
        lanes.computeIfPresent(normalize(sessionId), (key, lane) -> lane.users == 0 ? null : lane);
    }

    public Set<String> activeLanes() {
        return Set.copyOf(lanes.keySet());
    }

    int users(String sessionId) {
        Lane lane = lanes.get(normalize(sessionId));
        return lane == null ? 0 : lane.users;
    }

    // users is only written inside compute, which runs atomically per key
    private Lane acquire(String key) {
        return lanes.compute(key, (ignored, lane) -> {
            Lane target = lane == null ? new Lane() : lane;
            target.users++;
            return target;
        });
    }

    private void release(String key) {
        lanes.computeIfPresent(key, (ignored, lane) -> --lane.users == 0 ? null : lane);
    }

    private String normalize(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? "default" : sessionId.trim();
    }

    private static final class Lane {
        private final ReentrantLock lock = new ReentrantLock(true);
        private volatile int users;
    }
}
