package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lets results through only once objects have been continuously present on
 * a session for at least the configured duration.
 *
 * <p>
 * Presence starts at the first frame with detections and ends at the first
 * frame without any, which resets the clock.
 * </p>
 *
 * @since 1.0.0
 */
public class PresenceDurationProcessor implements PostProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(PresenceDurationProcessor.class);

    private final Duration minimumPresence;
    private final Map<String, Instant> presentSince = new ConcurrentHashMap<>();

    public PresenceDurationProcessor(Duration minimumPresence) {
        this.minimumPresence = Objects.requireNonNull(minimumPresence, "minimumPresence must not be null");
    }

    @Override
    public PostProcessingPolicy policy() {
        return PostProcessingPolicy.PRESENCE_DURATION;
    }

    @Override
    public PostProcessOutcome apply(DetectionResult result) {
        String sessionId = result.getSessionId();
        if (!result.hasDetections()) {
            if (presentSince.remove(sessionId) != null) {
                LOG.debug("Session {}: presence ended", sessionId);
            }
            return PostProcessOutcome.suppress(result);
        }

        Instant since = presentSince.computeIfAbsent(sessionId, k -> result.getTimestamp());
        Duration present = Duration.between(since, result.getTimestamp());
        if (present.compareTo(minimumPresence) >= 0) {
            return PostProcessOutcome.proceed(result);
        }
        LOG.trace("Session {}: present for {} ms, need {} ms",
                sessionId, present.toMillis(), minimumPresence.toMillis());
        return PostProcessOutcome.suppress(result);
    }

    /**
     * @return how long objects have been present on {@code sessionId} as of
     *         {@code now}, or zero
     */
    public Duration presence(String sessionId, Instant now) {
        Instant since = presentSince.get(sessionId);
        return since != null ? Duration.between(since, now) : Duration.ZERO;
    }

    @Override
    public void clearSession(String sessionId) {
        presentSince.remove(sessionId);
    }
}
