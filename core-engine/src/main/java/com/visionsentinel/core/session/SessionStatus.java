package com.visionsentinel.core.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a session and the transitions allowed between them.
 *
 * <pre>
 * INACTIVE     -&gt; CONNECTING
 * CONNECTING   -&gt; ACTIVE | ERROR
 * ACTIVE       -&gt; ERROR
 * ERROR        -&gt; RECONNECTING
 * RECONNECTING -&gt; ACTIVE | ERROR
 * any          -&gt; INACTIVE (explicit stop)
 * </pre>
 *
 * <p>
 * A session in {@code ERROR} is restarted by stopping it first, so a restart
 * always enters through {@code INACTIVE -> CONNECTING}.
 * </p>
 *
 * @since 1.0.0
 */
public enum SessionStatus {
    INACTIVE,
    CONNECTING,
    ACTIVE,
    ERROR,
    RECONNECTING;

    /**
     * @return {@code true} if moving from this state to {@code target} is a
     *         defined edge
     */
    public boolean canTransitionTo(SessionStatus target) {
        if (target == INACTIVE) {
            return this != INACTIVE;
        }
        return successors().contains(target);
    }

    private Set<SessionStatus> successors() {
        return switch (this) {
            case INACTIVE -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(ACTIVE, ERROR);
            case ACTIVE -> EnumSet.of(ERROR);
            case ERROR -> EnumSet.of(RECONNECTING);
            case RECONNECTING -> EnumSet.of(ACTIVE, ERROR);
        };
    }
}
