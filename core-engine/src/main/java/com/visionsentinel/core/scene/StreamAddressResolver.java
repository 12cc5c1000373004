package com.visionsentinel.core.scene;

import java.util.Optional;

/**
 * Turns a device id into a playable stream locator at deploy time.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface StreamAddressResolver {

    /**
     * @return the locator, or empty if the device has no reachable stream
     */
    Optional<String> resolve(String deviceId);
}
