/**
 * Alarm notification delivery.
 *
 * <p>
 * {@link com.visionsentinel.core.notify.NotificationDispatcher} queues
 * alarms and fans each one out to the channels listed on its rule:
 * </p>
 * <ul>
 * <li>{@link com.visionsentinel.core.notify.LogChannel}: structured log
 * line</li>
 * <li>{@link com.visionsentinel.core.notify.CallbackChannel}: HTTP POST with
 * a per-target circuit breaker</li>
 * <li>{@link com.visionsentinel.core.notify.MessageBusChannel}: Kafka
 * publish</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.notify;
