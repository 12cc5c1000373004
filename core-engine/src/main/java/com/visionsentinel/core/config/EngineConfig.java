package com.visionsentinel.core.config;

import com.visionsentinel.core.detector.PoolMode;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable tuning parameters for every engine component.
 *
 * <p>
 * Constructed once at startup and handed to each component's constructor.
 * The {@link Builder} starts from production defaults and validates all
 * values in {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    // ---------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------
    private final int maxSessions;
    private final Duration stopTimeout;
    private final Duration healthCheckInterval;
    private final Duration stallTimeout;
    private final Duration reconnectTimeout;

    // ---------------------------------------------------------------
    // Worker loop
    // ---------------------------------------------------------------
    private final int reconnectAttempts;
    private final Duration reconnectInterval;
    private final int maxTransientReadFailures;
    private final Duration gatePollInterval;
    private final int minFrameSize;
    private final int progressLogInterval;
    private final int maxInferenceResolution;
    private final int inferenceImageSize;

    // ---------------------------------------------------------------
    // Stream defaults
    // ---------------------------------------------------------------
    private final double defaultConfidence;
    private final double defaultIou;
    private final double defaultFpsLimit;

    // ---------------------------------------------------------------
    // Models
    // ---------------------------------------------------------------
    private final PoolMode modelPoolMode;

    // ---------------------------------------------------------------
    // Alarms / notification
    // ---------------------------------------------------------------
    private final double highSeverityThreshold;
    private final double mediumSeverityThreshold;
    private final int notificationQueueCapacity;
    private final int notificationWorkers;
    private final Duration callbackTimeout;
    private final int callbackFailureThreshold;
    private final int callbackWarnEvery;
    private final Duration messageBusTimeout;

    // ---------------------------------------------------------------
    // Scheduling / heartbeat
    // ---------------------------------------------------------------
    private final Duration expirationCheckInterval;
    private final Duration heartbeatInterval;
    private final int heartbeatFailureThreshold;
    private final Duration heartbeatStopTimeout;
    private final Duration presenceDuration;

    // ---------------------------------------------------------------
    // Misc
    // ---------------------------------------------------------------
    private final ZoneId zone;
    private final String artifactBaseUrl;

    private EngineConfig(Builder b) {
        this.maxSessions = b.maxSessions;
        this.stopTimeout = b.stopTimeout;
        this.healthCheckInterval = b.healthCheckInterval;
        this.stallTimeout = b.stallTimeout;
        this.reconnectTimeout = b.reconnectTimeout;
        this.reconnectAttempts = b.reconnectAttempts;
        this.reconnectInterval = b.reconnectInterval;
        this.maxTransientReadFailures = b.maxTransientReadFailures;
        this.gatePollInterval = b.gatePollInterval;
        this.minFrameSize = b.minFrameSize;
        this.progressLogInterval = b.progressLogInterval;
        this.maxInferenceResolution = b.maxInferenceResolution;
        this.inferenceImageSize = b.inferenceImageSize;
        this.defaultConfidence = b.defaultConfidence;
        this.defaultIou = b.defaultIou;
        this.defaultFpsLimit = b.defaultFpsLimit;
        this.modelPoolMode = b.modelPoolMode;
        this.highSeverityThreshold = b.highSeverityThreshold;
        this.mediumSeverityThreshold = b.mediumSeverityThreshold;
        this.notificationQueueCapacity = b.notificationQueueCapacity;
        this.notificationWorkers = b.notificationWorkers;
        this.callbackTimeout = b.callbackTimeout;
        this.callbackFailureThreshold = b.callbackFailureThreshold;
        this.callbackWarnEvery = b.callbackWarnEvery;
        this.messageBusTimeout = b.messageBusTimeout;
        this.expirationCheckInterval = b.expirationCheckInterval;
        this.heartbeatInterval = b.heartbeatInterval;
        this.heartbeatFailureThreshold = b.heartbeatFailureThreshold;
        this.heartbeatStopTimeout = b.heartbeatStopTimeout;
        this.presenceDuration = b.presenceDuration;
        this.zone = b.zone;
        this.artifactBaseUrl = b.artifactBaseUrl;
    }

    /**
     * @return configuration with every value at its default
     */
    public static EngineConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getMaxSessions() {
        return maxSessions;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration getStallTimeout() {
        return stallTimeout;
    }

    public Duration getReconnectTimeout() {
        return reconnectTimeout;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public Duration getReconnectInterval() {
        return reconnectInterval;
    }

    public int getMaxTransientReadFailures() {
        return maxTransientReadFailures;
    }

    public Duration getGatePollInterval() {
        return gatePollInterval;
    }

    public int getMinFrameSize() {
        return minFrameSize;
    }

    public int getProgressLogInterval() {
        return progressLogInterval;
    }

    public int getMaxInferenceResolution() {
        return maxInferenceResolution;
    }

    public int getInferenceImageSize() {
        return inferenceImageSize;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public double getDefaultIou() {
        return defaultIou;
    }

    public double getDefaultFpsLimit() {
        return defaultFpsLimit;
    }

    public PoolMode getModelPoolMode() {
        return modelPoolMode;
    }

    public double getHighSeverityThreshold() {
        return highSeverityThreshold;
    }

    public double getMediumSeverityThreshold() {
        return mediumSeverityThreshold;
    }

    public int getNotificationQueueCapacity() {
        return notificationQueueCapacity;
    }

    public int getNotificationWorkers() {
        return notificationWorkers;
    }

    public Duration getCallbackTimeout() {
        return callbackTimeout;
    }

    public int getCallbackFailureThreshold() {
        return callbackFailureThreshold;
    }

    public int getCallbackWarnEvery() {
        return callbackWarnEvery;
    }

    public Duration getMessageBusTimeout() {
        return messageBusTimeout;
    }

    public Duration getExpirationCheckInterval() {
        return expirationCheckInterval;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public int getHeartbeatFailureThreshold() {
        return heartbeatFailureThreshold;
    }

    public Duration getHeartbeatStopTimeout() {
        return heartbeatStopTimeout;
    }

    public Duration getPresenceDuration() {
        return presenceDuration;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String getArtifactBaseUrl() {
        return artifactBaseUrl;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * {@link #build()} collects every invalid value and throws a single
     * {@link IllegalArgumentException} listing them.
     * </p>
     */
    public static class Builder {
        private int maxSessions = 10;
        private Duration stopTimeout = Duration.ofSeconds(5);
        private Duration healthCheckInterval = Duration.ofSeconds(10);
        private Duration stallTimeout = Duration.ofSeconds(60);
        private Duration reconnectTimeout = Duration.ofSeconds(120);
        private int reconnectAttempts = 10;
        private Duration reconnectInterval = Duration.ofSeconds(5);
        private int maxTransientReadFailures = 3;
        private Duration gatePollInterval = Duration.ofSeconds(1);
        private int minFrameSize = 50;
        private int progressLogInterval = 10;
        private int maxInferenceResolution = 640;
        private int inferenceImageSize = 640;
        private double defaultConfidence = 0.5;
        private double defaultIou = 0.45;
        private double defaultFpsLimit = 1.0;
        private PoolMode modelPoolMode = PoolMode.SHARED;
        private double highSeverityThreshold = 0.7;
        private double mediumSeverityThreshold = 0.5;
        private int notificationQueueCapacity = 1000;
        private int notificationWorkers = 4;
        private Duration callbackTimeout = Duration.ofSeconds(5);
        private int callbackFailureThreshold = 10;
        private int callbackWarnEvery = 3;
        private Duration messageBusTimeout = Duration.ofSeconds(10);
        private Duration expirationCheckInterval = Duration.ofSeconds(30);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private int heartbeatFailureThreshold = 3;
        private Duration heartbeatStopTimeout = Duration.ofSeconds(2);
        private Duration presenceDuration = Duration.ofSeconds(10);
        private ZoneId zone = ZoneId.systemDefault();
        private String artifactBaseUrl = "";

        public Builder maxSessions(int v) {
            this.maxSessions = v;
            return this;
        }

        public Builder stopTimeout(Duration v) {
            this.stopTimeout = v;
            return this;
        }

        public Builder healthCheckInterval(Duration v) {
            this.healthCheckInterval = v;
            return this;
        }

        public Builder stallTimeout(Duration v) {
            this.stallTimeout = v;
            return this;
        }

        public Builder reconnectTimeout(Duration v) {
            this.reconnectTimeout = v;
            return this;
        }

        public Builder reconnectAttempts(int v) {
            this.reconnectAttempts = v;
            return this;
        }

        public Builder reconnectInterval(Duration v) {
            this.reconnectInterval = v;
            return this;
        }

        public Builder maxTransientReadFailures(int v) {
            this.maxTransientReadFailures = v;
            return this;
        }

        public Builder gatePollInterval(Duration v) {
            this.gatePollInterval = v;
            return this;
        }

        public Builder minFrameSize(int v) {
            this.minFrameSize = v;
            return this;
        }

        public Builder progressLogInterval(int v) {
            this.progressLogInterval = v;
            return this;
        }

        public Builder maxInferenceResolution(int v) {
            this.maxInferenceResolution = v;
            return this;
        }

        public Builder inferenceImageSize(int v) {
            this.inferenceImageSize = v;
            return this;
        }

        public Builder defaultConfidence(double v) {
            this.defaultConfidence = v;
            return this;
        }

        public Builder defaultIou(double v) {
            this.defaultIou = v;
            return this;
        }

        public Builder defaultFpsLimit(double v) {
            this.defaultFpsLimit = v;
            return this;
        }

        public Builder modelPoolMode(PoolMode v) {
            this.modelPoolMode = v;
            return this;
        }

        public Builder highSeverityThreshold(double v) {
            this.highSeverityThreshold = v;
            return this;
        }

        public Builder mediumSeverityThreshold(double v) {
            this.mediumSeverityThreshold = v;
            return this;
        }

        public Builder notificationQueueCapacity(int v) {
            this.notificationQueueCapacity = v;
            return this;
        }

        public Builder notificationWorkers(int v) {
            this.notificationWorkers = v;
            return this;
        }

        public Builder callbackTimeout(Duration v) {
            this.callbackTimeout = v;
            return this;
        }

        public Builder callbackFailureThreshold(int v) {
            this.callbackFailureThreshold = v;
            return this;
        }

        public Builder callbackWarnEvery(int v) {
            this.callbackWarnEvery = v;
            return this;
        }

        public Builder messageBusTimeout(Duration v) {
            this.messageBusTimeout = v;
            return this;
        }

        public Builder expirationCheckInterval(Duration v) {
            this.expirationCheckInterval = v;
            return this;
        }

        public Builder heartbeatInterval(Duration v) {
            this.heartbeatInterval = v;
            return this;
        }

        public Builder heartbeatFailureThreshold(int v) {
            this.heartbeatFailureThreshold = v;
            return this;
        }

        public Builder heartbeatStopTimeout(Duration v) {
            this.heartbeatStopTimeout = v;
            return this;
        }

        public Builder presenceDuration(Duration v) {
            this.presenceDuration = v;
            return this;
        }

        public Builder zone(ZoneId v) {
            this.zone = v;
            return this;
        }

        public Builder artifactBaseUrl(String v) {
            this.artifactBaseUrl = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            Objects.requireNonNull(modelPoolMode, "modelPoolMode required");
            Objects.requireNonNull(zone, "zone required");
            Objects.requireNonNull(artifactBaseUrl, "artifactBaseUrl required");

            List<String> errors = new ArrayList<>();
            positive(errors, "maxSessions", maxSessions);
            positive(errors, "stopTimeout", stopTimeout);
            positive(errors, "healthCheckInterval", healthCheckInterval);
            positive(errors, "stallTimeout", stallTimeout);
            positive(errors, "reconnectTimeout", reconnectTimeout);
            atLeast(errors, "reconnectAttempts", reconnectAttempts, 0);
            nonNegative(errors, "reconnectInterval", reconnectInterval);
            positive(errors, "maxTransientReadFailures", maxTransientReadFailures);
            positive(errors, "gatePollInterval", gatePollInterval);
            atLeast(errors, "minFrameSize", minFrameSize, 0);
            positive(errors, "progressLogInterval", progressLogInterval);
            positive(errors, "maxInferenceResolution", maxInferenceResolution);
            positive(errors, "inferenceImageSize", inferenceImageSize);
            unit(errors, "defaultConfidence", defaultConfidence);
            unit(errors, "defaultIou", defaultIou);
            if (!(defaultFpsLimit > 0)) {
                errors.add("defaultFpsLimit must be > 0, got: " + defaultFpsLimit);
            }
            unit(errors, "highSeverityThreshold", highSeverityThreshold);
            unit(errors, "mediumSeverityThreshold", mediumSeverityThreshold);
            if (mediumSeverityThreshold > highSeverityThreshold) {
                errors.add("mediumSeverityThreshold must not exceed highSeverityThreshold");
            }
            positive(errors, "notificationQueueCapacity", notificationQueueCapacity);
            positive(errors, "notificationWorkers", notificationWorkers);
            positive(errors, "callbackTimeout", callbackTimeout);
            positive(errors, "callbackFailureThreshold", callbackFailureThreshold);
            positive(errors, "callbackWarnEvery", callbackWarnEvery);
            positive(errors, "messageBusTimeout", messageBusTimeout);
            positive(errors, "expirationCheckInterval", expirationCheckInterval);
            positive(errors, "heartbeatInterval", heartbeatInterval);
            positive(errors, "heartbeatFailureThreshold", heartbeatFailureThreshold);
            positive(errors, "heartbeatStopTimeout", heartbeatStopTimeout);
            nonNegative(errors, "presenceDuration", presenceDuration);

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid engine configuration: " + String.join("; ", errors));
            }
            return new EngineConfig(this);
        }

        private static void positive(List<String> errors, String name, int value) {
            atLeast(errors, name, value, 1);
        }

        private static void atLeast(List<String> errors, String name, int value, int min) {
            if (value < min) {
                errors.add(name + " must be >= " + min + ", got: " + value);
            }
        }

        private static void positive(List<String> errors, String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                errors.add(name + " must be a positive duration, got: " + value);
            }
        }

        private static void nonNegative(List<String> errors, String name, Duration value) {
            if (value == null || value.isNegative()) {
                errors.add(name + " must not be negative, got: " + value);
            }
        }

        private static void unit(List<String> errors, String name, double value) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                errors.add(name + " must be in [0, 1], got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxSessions=" + maxSessions +
                ", modelPoolMode=" + modelPoolMode +
                ", stopTimeout=" + stopTimeout +
                ", stallTimeout=" + stallTimeout +
                ", reconnectAttempts=" + reconnectAttempts +
                ", reconnectInterval=" + reconnectInterval +
                ", notificationQueueCapacity=" + notificationQueueCapacity +
                ", notificationWorkers=" + notificationWorkers +
                ", callbackFailureThreshold=" + callbackFailureThreshold +
                ", heartbeatInterval=" + heartbeatInterval +
                ", zone=" + zone +
                '}';
    }
}
