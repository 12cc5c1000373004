package com.visionsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alarm raised by the alarm engine when a rule's debounce and cooldown
 * conditions are met.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code sessionId}, {@code ruleId},
 * {@code timestamp}, {@code severity}, {@code className} and {@code box} are
 * required; omitting any of them throws {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlarmEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final String ruleId;
    private final String ruleName;
    private final Instant timestamp;
    private final Severity severity;
    private final double confidence;
    private final String className;
    private final BoundingBox box;
    private final int consecutiveCount;
    private final String mediaUrl;
    private final NotificationTarget target;

    private AlarmEvent(Builder b) {
        this.sessionId = Objects.requireNonNull(b.sessionId, "sessionId must not be null");
        this.ruleId = Objects.requireNonNull(b.ruleId, "ruleId must not be null");
        this.ruleName = b.ruleName != null ? b.ruleName : b.ruleId;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.confidence = b.confidence;
        this.className = Objects.requireNonNull(b.className, "className must not be null");
        this.box = Objects.requireNonNull(b.box, "box must not be null");
        this.consecutiveCount = b.consecutiveCount;
        this.mediaUrl = b.mediaUrl;
        this.target = b.target != null ? b.target : NotificationTarget.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlarmEvent}.
     */
    public static class Builder {
        private String sessionId;
        private String ruleId;
        private String ruleName;
        private Instant timestamp;
        private Severity severity;
        private double confidence;
        private String className;
        private BoundingBox box;
        private int consecutiveCount;
        private String mediaUrl;
        private NotificationTarget target;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder box(BoundingBox box) {
            this.box = box;
            return this;
        }

        public Builder consecutiveCount(int consecutiveCount) {
            this.consecutiveCount = consecutiveCount;
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

        public AlarmEvent build() {
            return new AlarmEvent(this);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getClassName() {
        return className;
    }

    public BoundingBox getBox() {
        return box;
    }

    public int getConsecutiveCount() {
        return consecutiveCount;
    }

    public String getMediaUrl() {
        return mediaUrl;
    }

    public NotificationTarget getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return "AlarmEvent{" +
                "sessionId='" + sessionId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", timestamp=" + timestamp +
                ", severity=" + severity +
                ", className='" + className + '\'' +
                ", confidence=" + String.format("%.3f", confidence) +
                ", consecutiveCount=" + consecutiveCount +
                '}';
    }
}
