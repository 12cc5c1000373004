package com.visionsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing one frame of a session.
 *
 * <p>
 * Created by the session worker, consumed by post-processing and the alarm
 * engine, then discarded. Use the {@link Builder}; {@code sessionId} and
 * {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final Instant timestamp;
    private final long frameId;
    private final List<Detection> detections;
    private final Duration processingTime;
    private final String mediaUrl;
    private final NotificationTarget target;

    private DetectionResult(Builder b) {
        this.sessionId = Objects.requireNonNull(b.sessionId, "sessionId must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.frameId = b.frameId;
        this.detections = Collections.unmodifiableList(new ArrayList<>(b.detections));
        this.processingTime = b.processingTime != null ? b.processingTime : Duration.ZERO;
        this.mediaUrl = b.mediaUrl;
        this.target = b.target != null ? b.target : NotificationTarget.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a copy of this result carrying {@code newDetections}
     */
    public DetectionResult withDetections(List<Detection> newDetections) {
        return toBuilder().detections(newDetections).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .sessionId(sessionId)
                .timestamp(timestamp)
                .frameId(frameId)
                .detections(detections)
                .processingTime(processingTime)
                .mediaUrl(mediaUrl)
                .target(target);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getFrameId() {
        return frameId;
    }

    public List<Detection> getDetections() {
        return detections;
    }

    public boolean hasDetections() {
        return !detections.isEmpty();
    }

    public Duration getProcessingTime() {
        return processingTime;
    }

    public String getMediaUrl() {
        return mediaUrl;
    }

    public NotificationTarget getTarget() {
        return target;
    }

    /**
     * Fluent builder for {@link DetectionResult}.
     */
    public static class Builder {
        private String sessionId;
        private Instant timestamp;
        private long frameId;
        private List<Detection> detections = List.of();
        private Duration processingTime;
        private String mediaUrl;
        private NotificationTarget target;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder frameId(long frameId) {
            this.frameId = frameId;
            return this;
        }

        public Builder detections(List<Detection> detections) {
            this.detections = Objects.requireNonNull(detections, "detections must not be null");
            return this;
        }

        public Builder processingTime(Duration processingTime) {
            this.processingTime = processingTime;
            return this;
        }

        public Builder mediaUrl(String mediaUrl) {
            this.mediaUrl = mediaUrl;
            return this;
        }

        public Builder target(NotificationTarget target) {
            this.target = target;
            return this;
        }

        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "sessionId='" + sessionId + '\'' +
                ", frameId=" + frameId +
                ", timestamp=" + timestamp +
                ", detections=" + detections.size() +
                ", processingTime=" + processingTime.toMillis() + "ms" +
                '}';
    }
}
