package com.visionsentinel.core.session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding window over the most recent processed frames, giving average
 * processing time and effective frame rate.
 *
 * <p>
 * Not thread-safe; guarded by the owning {@link SessionState}.
 * </p>
 */
final class RollingStats {

    static final int DEFAULT_WINDOW = 50;

    private final int windowSize;
    private final Deque<Long> processingMillis = new ArrayDeque<>();
    private final Deque<Instant> frameTimes = new ArrayDeque<>();
    private long processingSum;

    RollingStats(int windowSize) {
        this.windowSize = windowSize;
    }

    void record(Duration processingTime, Instant at) {
        long ms = processingTime.toMillis();
        processingMillis.addLast(ms);
        processingSum += ms;
        frameTimes.addLast(at);
        if (processingMillis.size() > windowSize) {
            processingSum -= processingMillis.pollFirst();
            frameTimes.pollFirst();
        }
    }

    double averageProcessingMillis() {
        return processingMillis.isEmpty() ? 0.0 : (double) processingSum / processingMillis.size();
    }

    double framesPerSecond() {
        if (frameTimes.size() < 2) {
            return 0.0;
        }
        long spanMillis = Duration.between(frameTimes.peekFirst(), frameTimes.peekLast()).toMillis();
        return spanMillis <= 0 ? 0.0 : (frameTimes.size() - 1) * 1000.0 / spanMillis;
    }

    void clear() {
        processingMillis.clear();
        frameTimes.clear();
        processingSum = 0;
    }
}
