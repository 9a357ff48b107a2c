package com.amqpclient.session;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a broker session.
 *
 * DISCONNECTED -> CONNECTING -> CHANNEL_OPENING -> TOPOLOGY_PENDING -> READY,
 * any live state -> STOPPING -> CLOSED. Losing the connection returns to
 * DISCONNECTED; a declare conflict sends TOPOLOGY_PENDING back to
 * CHANNEL_OPENING.
 */
public enum SessionState {
    /**
     * No connection; initial state and the state while a reconnect is pending.
     */
    DISCONNECTED,

    /**
     * Transport connection requested.
     */
    CONNECTING,

    /**
     * Connection open, channel requested.
     */
    CHANNEL_OPENING,

    /**
     * Channel open, exchange/queue/binding declarations in flight.
     */
    TOPOLOGY_PENDING,

    /**
     * Publishing or consuming.
     */
    READY,

    /**
     * Orderly close in progress; reconnects are suppressed.
     */
    STOPPING,

    /**
     * Terminal.
     */
    CLOSED;

    private static final Map<SessionState, Set<SessionState>> ALLOWED = new EnumMap<>(SessionState.class);

    static {
        ALLOWED.put(DISCONNECTED, EnumSet.of(CONNECTING, STOPPING, CLOSED));
        ALLOWED.put(CONNECTING, EnumSet.of(CHANNEL_OPENING, DISCONNECTED, STOPPING));
        ALLOWED.put(CHANNEL_OPENING, EnumSet.of(TOPOLOGY_PENDING, DISCONNECTED, STOPPING));
        ALLOWED.put(TOPOLOGY_PENDING, EnumSet.of(READY, CHANNEL_OPENING, DISCONNECTED, STOPPING));
        ALLOWED.put(READY, EnumSet.of(DISCONNECTED, STOPPING));
        ALLOWED.put(STOPPING, EnumSet.of(CLOSED));
        ALLOWED.put(CLOSED, EnumSet.noneOf(SessionState.class));
    }

    public boolean canTransitionTo(SessionState next) {
        return ALLOWED.get(this).contains(next);
    }

    public Set<SessionState> allowedTransitions() {
        return Collections.unmodifiableSet(ALLOWED.get(this));
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
