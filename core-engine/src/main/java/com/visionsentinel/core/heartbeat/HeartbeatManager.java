package com.visionsentinel.core.heartbeat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one periodic heartbeat per device.
 *
 * <p>
 * Each device gets its own daemon thread named {@code heartbeat-<deviceId>}
 * that calls the {@link HeartbeatSender} every interval. Consecutive
 * failures are counted; reaching the threshold logs an error once per run
 * of failures. Heartbeat failure is advisory: nothing is stopped because of
 * it.
 * </p>
 *
 * @since 1.0.0
 */
public class HeartbeatManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatManager.class);

    private final HeartbeatSender sender;
    private final Duration interval;
    private final int failureThreshold;
    private final Duration stopTimeout;
    private final Clock clock;

    private final Map<String, Beat> beats = new ConcurrentHashMap<>();

    public HeartbeatManager(HeartbeatSender sender, Duration interval, int failureThreshold, Duration stopTimeout,
            Clock clock) {
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Start the heartbeat of a device.
     *
     * @return {@code false} if one is already running for that device
     */
    public boolean start(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Beat beat = new Beat(deviceId);
        Thread thread = new Thread(beat, "heartbeat-" + deviceId);
        thread.setDaemon(true);
        beat.thread = thread;
        if (beats.putIfAbsent(deviceId, beat) != null) {
            LOG.debug("Heartbeat for device {} already running", deviceId);
            return false;
        }
        thread.start();
        LOG.info("Heartbeat started for device {} (every {} ms)", deviceId, interval.toMillis());
        return true;
    }

    /**
     * Cancel the heartbeat of a device and wait briefly for its thread.
     *
     * @return {@code false} if none was running
     */
    public boolean stop(String deviceId) {
        Beat beat = beats.remove(deviceId);
        if (beat == null) {
            return false;
        }
        beat.stop.countDown();
        try {
            beat.thread.join(stopTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (beat.thread.isAlive()) {
            LOG.warn("Heartbeat thread for device {} did not exit within {} ms", deviceId, stopTimeout.toMillis());
        }
        LOG.info("Heartbeat stopped for device {}", deviceId);
        return true;
    }

    public void stopAll() {
        for (String deviceId : new ArrayList<>(beats.keySet())) {
            stop(deviceId);
        }
    }

    public boolean isRunning(String deviceId) {
        return beats.containsKey(deviceId);
    }

    public Set<String> activeDevices() {
        return new TreeSet<>(beats.keySet());
    }

    public Optional<HeartbeatStats> stats(String deviceId) {
        Beat beat = beats.get(deviceId);
        return beat != null ? Optional.of(beat.snapshot()) : Optional.empty();
    }

    public List<HeartbeatStats> stats() {
        return beats.values().stream().map(Beat::snapshot).toList();
    }

    @Override
    public void close() {
        stopAll();
    }

    // ---------------------------------------------------------------
    // Per-device loop
    // ---------------------------------------------------------------

    private final class Beat implements Runnable {

        private final String deviceId;
        private final CountDownLatch stop = new CountDownLatch(1);
        private Thread thread;

        private long successCount;
        private long failureCount;
        private int consecutiveFailures;
        private Instant lastSuccessAt;

        private Beat(String deviceId) {
            this.deviceId = deviceId;
        }

        @Override
        public void run() {
            try {
                do {
                    beat();
                } while (!stop.await(interval.toMillis(), TimeUnit.MILLISECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void beat() {
            boolean ok;
            try {
                ok = sender.send(deviceId);
            } catch (RuntimeException e) {
                LOG.debug("Heartbeat for device {} threw: {}", deviceId, e.getMessage(), e);
                ok = false;
            }
            synchronized (this) {
                if (ok) {
                    if (consecutiveFailures >= failureThreshold) {
                        LOG.info("Heartbeat for device {} recovered after {} failure(s)",
                                deviceId, consecutiveFailures);
                    }
                    successCount++;
                    consecutiveFailures = 0;
                    lastSuccessAt = clock.instant();
                    return;
                }
                failureCount++;
                consecutiveFailures++;
                if (consecutiveFailures == failureThreshold) {
                    LOG.error("Heartbeat for device {} failed {} times in a row", deviceId, consecutiveFailures);
                } else {
                    LOG.debug("Heartbeat for device {} failed ({} in a row)", deviceId, consecutiveFailures);
                }
            }
        }

        private synchronized HeartbeatStats snapshot() {
            return new HeartbeatStats(deviceId, successCount, failureCount, consecutiveFailures, lastSuccessAt);
        }
    }
}
