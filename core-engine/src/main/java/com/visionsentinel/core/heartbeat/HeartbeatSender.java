package com.visionsentinel.core.heartbeat;

/**
 * Reports liveness of one device to the platform that owns it.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface HeartbeatSender {

    /**
     * @return {@code true} if the platform acknowledged the heartbeat
     */
    boolean send(String deviceId);
}
