package com.visionsentinel.core.heartbeat;

import java.time.Instant;

/**
 * Point-in-time counters of one device heartbeat.
 *
 * @since 1.0.0
 */
public final class HeartbeatStats {

    private final String deviceId;
    private final long successCount;
    private final long failureCount;
    private final int consecutiveFailures;
    private final Instant lastSuccessAt;

    HeartbeatStats(String deviceId, long successCount, long failureCount, int consecutiveFailures,
            Instant lastSuccessAt) {
        this.deviceId = deviceId;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.consecutiveFailures = consecutiveFailures;
        this.lastSuccessAt = lastSuccessAt;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /** @return time of the last acknowledged heartbeat, or {@code null} if none yet */
    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    @Override
    public String toString() {
        return "HeartbeatStats{device='" + deviceId + "', ok=" + successCount + ", failed=" + failureCount
                + ", consecutiveFailures=" + consecutiveFailures + '}';
    }
}
