package com.visionsentinel.core.model;

/**
 * Notification channels an alarm rule can route to.
 *
 * @since 1.0.0
 */
public enum ChannelType {
    /** Structured log line; always available. */
    LOG,
    /** HTTP POST to the session's callback URL. */
    CALLBACK,
    /** Publish to the alarm topic of the message bus. */
    MESSAGE_BUS
}
