/**
 * Session registry, lifecycle state machine and per-session worker loop.
 *
 * <p>
 * {@link com.visionsentinel.core.session.StreamManager} is the only entry
 * point; workers and session state are internal to this package.
 * </p>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.session;
