package com.visionsentinel.core.session;

import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.NotificationTarget;
import com.visionsentinel.core.postprocess.DetectionRegions;
import com.visionsentinel.core.postprocess.PostProcessingPolicy;
import com.visionsentinel.core.schedule.TimePolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable registration input of a session.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@link Builder#build()} rejects invalid input with
 * a {@link SentinelException} of kind {@code CONFIG}; {@code id},
 * {@code sourceLocator} and {@code modelId} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class StreamConfig {

    private final String id;
    private final String sourceLocator;
    private final String modelId;
    private final double confidenceThreshold;
    private final double iouThreshold;
    private final double fpsLimit;
    private final int imageSize;
    private final Set<String> targetClasses;
    private final PostProcessingPolicy postProcessing;
    private final TimePolicy timePolicy;
    private final NotificationTarget target;
    private final DetectionRegions regions;

    private StreamConfig(Builder b) {
        this.id = b.id;
        this.sourceLocator = b.sourceLocator;
        this.modelId = b.modelId;
        this.confidenceThreshold = b.confidenceThreshold;
        this.iouThreshold = b.iouThreshold;
        this.fpsLimit = b.fpsLimit;
        this.imageSize = b.imageSize;
        this.targetClasses = Collections.unmodifiableSet(new LinkedHashSet<>(b.targetClasses));
        this.postProcessing = b.postProcessing;
        this.timePolicy = b.timePolicy;
        this.target = b.target != null ? b.target : NotificationTarget.NONE;
        this.regions = b.regions != null ? b.regions : DetectionRegions.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return minimum time between two processed frames
     */
    public Duration minFrameInterval() {
        return Duration.ofNanos((long) (1_000_000_000L / fpsLimit));
    }

    public boolean allowsClass(String className) {
        return targetClasses.isEmpty() || targetClasses.contains(className);
    }

    public String getId() {
        return id;
    }

    public String getSourceLocator() {
        return sourceLocator;
    }

    public String getModelId() {
        return modelId;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public double getIouThreshold() {
        return iouThreshold;
    }

    public double getFpsLimit() {
        return fpsLimit;
    }

    /**
     * @return inference input size, or {@code 0} for the engine default
     */
    public int getImageSize() {
        return imageSize;
    }

    public Set<String> getTargetClasses() {
        return targetClasses;
    }

    public PostProcessingPolicy getPostProcessing() {
        return postProcessing;
    }

    /**
     * @return the time policy, or {@code null} if always permitted
     */
    public TimePolicy getTimePolicy() {
        return timePolicy;
    }

    public NotificationTarget getTarget() {
        return target;
    }

    public DetectionRegions getRegions() {
        return regions;
    }

    /**
     * Fluent builder for {@link StreamConfig}.
     */
    public static class Builder {
        private String id;
        private String sourceLocator;
        private String modelId;
        private double confidenceThreshold = 0.5;
        private double iouThreshold = 0.45;
        private double fpsLimit = 1.0;
        private int imageSize;
        private Set<String> targetClasses = Set.of();
        private PostProcessingPolicy postProcessing = PostProcessingPolicy.NONE;
        private TimePolicy timePolicy;
        private NotificationTarget target;
        private DetectionRegions regions;

        public Builder id(String v) {
            this.id = v;
            return this;
        }

        public Builder sourceLocator(String v) {
            this.sourceLocator = v;
            return this;
        }

        public Builder modelId(String v) {
            this.modelId = v;
            return this;
        }

        public Builder confidenceThreshold(double v) {
            this.confidenceThreshold = v;
            return this;
        }

        public Builder iouThreshold(double v) {
            this.iouThreshold = v;
            return this;
        }

        public Builder fpsLimit(double v) {
            this.fpsLimit = v;
            return this;
        }

        public Builder imageSize(int v) {
            this.imageSize = v;
            return this;
        }

        public Builder targetClasses(Set<String> v) {
            this.targetClasses = v != null ? v : Set.of();
            return this;
        }

        public Builder postProcessing(PostProcessingPolicy v) {
            this.postProcessing = v != null ? v : PostProcessingPolicy.NONE;
            return this;
        }

        public Builder timePolicy(TimePolicy v) {
            this.timePolicy = v;
            return this;
        }

        public Builder target(NotificationTarget v) {
            this.target = v;
            return this;
        }

        public Builder regions(DetectionRegions v) {
            this.regions = v;
            return this;
        }

        /**
         * @throws SentinelException of kind {@code CONFIG} if any value is
         *                           invalid
         */
        public StreamConfig build() {
            List<String> errors = new ArrayList<>();
            if (id == null || id.isBlank()) {
                errors.add("'id' is required");
            }
            if (sourceLocator == null || sourceLocator.isBlank()) {
                errors.add("'sourceLocator' is required");
            }
            if (modelId == null || modelId.isBlank()) {
                errors.add("'modelId' is required");
            }
            if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
                errors.add("'confidenceThreshold' must be in [0, 1], got: " + confidenceThreshold);
            }
            if (iouThreshold < 0.0 || iouThreshold > 1.0) {
                errors.add("'iouThreshold' must be in [0, 1], got: " + iouThreshold);
            }
            if (!(fpsLimit > 0)) {
                errors.add("'fpsLimit' must be > 0, got: " + fpsLimit);
            }
            if (imageSize < 0) {
                errors.add("'imageSize' must be >= 0, got: " + imageSize);
            }
            if (!errors.isEmpty()) {
                throw SentinelException.config("Invalid stream config '" + id + "': "
                        + String.join("; ", errors));
            }
            return new StreamConfig(this);
        }
    }

    @Override
    public String toString() {
        return "StreamConfig{" +
                "id='" + id + '\'' +
                ", sourceLocator='" + sourceLocator + '\'' +
                ", modelId='" + modelId + '\'' +
                ", confidence=" + confidenceThreshold +
                ", fpsLimit=" + fpsLimit +
                ", targetClasses=" + targetClasses +
                ", postProcessing=" + postProcessing +
                ", timePolicy=" + timePolicy +
                '}';
    }
}
