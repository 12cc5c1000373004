package com.visionsentinel.core.session;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts over all registered sessions.
 *
 * @since 1.0.0
 */
public final class StreamSummary {

    private final int registered;
    private final int running;
    private final int maxSessions;
    private final Map<SessionStatus, Integer> byStatus;
    private final long totalFrames;
    private final long totalDetections;

    StreamSummary(int registered, int running, int maxSessions, Map<SessionStatus, Integer> byStatus,
            long totalFrames, long totalDetections) {
        this.registered = registered;
        this.running = running;
        this.maxSessions = maxSessions;
        this.byStatus = Collections.unmodifiableMap(new EnumMap<>(byStatus));
        this.totalFrames = totalFrames;
        this.totalDetections = totalDetections;
    }

    public int getRegistered() {
        return registered;
    }

    public int getRunning() {
        return running;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public Map<SessionStatus, Integer> getByStatus() {
        return byStatus;
    }

    public int count(SessionStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public long getTotalFrames() {
        return totalFrames;
    }

    public long getTotalDetections() {
        return totalDetections;
    }

    @Override
    public String toString() {
        return "StreamSummary{registered=" + registered + ", running=" + running + "/" + maxSessions
                + ", byStatus=" + byStatus + ", frames=" + totalFrames + ", detections=" + totalDetections + '}';
    }
}
