package com.amqpclient.session;

import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportEvent;

/**
 * The publishing or consuming half of a session, started once topology is
 * in place on a channel.
 */
public interface SessionRole {

    /**
     * Topology is declared on {@code channel}; begin work.
     */
    void start(TransportChannel channel);

    /**
     * Handles confirm, delivery and consumer events of the current channel.
     */
    void handle(TransportEvent event);

    /**
     * The channel was lost. Drops everything tied to it.
     */
    void reset();

    /**
     * Stops producing new work and runs {@code readyToCloseChannel} once the
     * channel may be closed.
     */
    void beginShutdown(Runnable readyToCloseChannel);
}
