package com.visionsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes when detections on a session should raise an alarm and where the
 * alarm is delivered.
 *
 * <p>
 * Loaded from YAML or built programmatically. Call {@link #validate()} after
 * construction / deserialization. The alarm engine stores its own
 * {@link #copy()} so later mutation of a registered instance has no effect.
 * </p>
 *
 * <h3>Applicability</h3>
 * <ul>
 * <li>{@code sessionIds} empty: the rule applies to every session</li>
 * <li>{@code classNames} empty: every detected class is considered</li>
 * <li>{@code timeRange} absent: the rule is active around the clock</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AlarmRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique rule id. */
    private String id;

    /** Display name used in log lines and payloads. */
    private String name;

    private List<String> sessionIds = new ArrayList<>();

    private List<String> classNames = new ArrayList<>();

    /** Minimum confidence a detection needs to count towards the rule. */
    private double minConfidence = 0.5;

    /** Number of consecutive qualifying frames required before alarming. */
    private int consecutiveFrames = 3;

    /** Minimum time between two alarms of this rule on the same session. */
    private long cooldownSeconds = 30;

    private TimeRange timeRange;

    private boolean enabled = true;

    private List<ChannelType> channels = new ArrayList<>(List.of(ChannelType.LOG));

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all fields contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            errors.add("Rule '" + id + "' requires 'minConfidence' in [0, 1]");
        }
        if (consecutiveFrames < 1) {
            errors.add("Rule '" + id + "' requires 'consecutiveFrames' >= 1");
        }
        if (cooldownSeconds < 0) {
            errors.add("Rule '" + id + "' requires 'cooldownSeconds' >= 0");
        }
        if (channels == null || channels.isEmpty()) {
            errors.add("Rule '" + id + "' requires at least one channel");
        } else if (channels.contains(null)) {
            errors.add("Rule '" + id + "' has a null channel");
        }
        if (timeRange != null) {
            try {
                timeRange.getStartTime();
                timeRange.getEndTime();
            } catch (IllegalStateException e) {
                errors.add("Rule '" + id + "': " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AlarmRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Matching
    // ---------------------------------------------------------------

    public boolean appliesToSession(String sessionId) {
        return sessionIds.isEmpty() || sessionIds.contains(sessionId);
    }

    public boolean appliesToClass(String className) {
        return classNames.isEmpty() || classNames.contains(className);
    }

    public boolean isActiveAt(LocalTime time) {
        return timeRange == null || timeRange.contains(time);
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    /**
     * @return an independent copy of this rule
     */
    public AlarmRule copy() {
        AlarmRule c = new AlarmRule();
        c.id = id;
        c.name = name;
        c.sessionIds = new ArrayList<>(sessionIds);
        c.classNames = new ArrayList<>(classNames);
        c.minConfidence = minConfidence;
        c.consecutiveFrames = consecutiveFrames;
        c.cooldownSeconds = cooldownSeconds;
        c.timeRange = timeRange != null ? new TimeRange(timeRange.getStart(), timeRange.getEnd()) : null;
        c.enabled = enabled;
        c.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
        return c;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    /**
     * @return the display name, falling back to the id
     */
    public String getName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getSessionIds() {
        return Collections.unmodifiableList(sessionIds);
    }

    public void setSessionIds(List<String> sessionIds) {
        this.sessionIds = sessionIds != null ? new ArrayList<>(sessionIds) : new ArrayList<>();
    }

    public List<String> getClassNames() {
        return Collections.unmodifiableList(classNames);
    }

    public void setClassNames(List<String> classNames) {
        this.classNames = classNames != null ? new ArrayList<>(classNames) : new ArrayList<>();
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public int getConsecutiveFrames() {
        return consecutiveFrames;
    }

    public void setConsecutiveFrames(int consecutiveFrames) {
        this.consecutiveFrames = consecutiveFrames;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public void setTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<ChannelType> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<ChannelType> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlarmRule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "AlarmRule{" +
                "id='" + id + '\'' +
                ", classNames=" + classNames +
                ", minConfidence=" + minConfidence +
                ", consecutiveFrames=" + consecutiveFrames +
                ", cooldownSeconds=" + cooldownSeconds +
                ", timeRange=" + timeRange +
                ", enabled=" + enabled +
                ", channels=" + channels +
                '}';
    }
}
