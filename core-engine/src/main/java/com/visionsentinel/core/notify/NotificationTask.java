package com.visionsentinel.core.notify;

import com.visionsentinel.core.model.AlarmEvent;
import com.visionsentinel.core.model.AlarmRule;
import com.visionsentinel.core.model.ChannelType;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One queued alarm delivery, fanned out to every channel listed on its rule.
 *
 * @since 1.0.0
 */
public final class NotificationTask {

    private final AlarmEvent event;
    private final AlarmRule rule;
    private final List<ChannelType> channels;
    private final Instant enqueuedAt;

    public NotificationTask(AlarmEvent event, AlarmRule rule, Instant enqueuedAt) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.channels = List.copyOf(rule.getChannels());
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
    }

    public AlarmEvent getEvent() {
        return event;
    }

    public AlarmRule getRule() {
        return rule;
    }

    public List<ChannelType> getChannels() {
        return channels;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public String toString() {
        return "NotificationTask{rule=" + rule.getId() + ", session=" + event.getSessionId()
                + ", channels=" + channels + ", enqueuedAt=" + enqueuedAt + '}';
    }
}
