package com.visionsentinel.core.notify;

import com.visionsentinel.core.model.ChannelType;

/**
 * A delivery route for alarm notifications.
 *
 * <p>
 * Called concurrently by the dispatcher workers; implementations must be
 * thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface NotificationChannel {

    ChannelType type();

    /**
     * Deliver one task.
     *
     * @return {@code true} if delivered, {@code false} if intentionally
     *         skipped (no target configured, circuit open)
     * @throws com.visionsentinel.core.error.SentinelException of kind
     *                                                         {@code NOTIFICATION_CHANNEL}
     *                                                         on failure
     */
    boolean deliver(NotificationTask task);
}
