/**
 * Per-device heartbeat scheduling.
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.heartbeat;
