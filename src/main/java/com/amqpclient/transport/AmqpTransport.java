package com.amqpclient.transport;

import com.amqpclient.config.ConnectionConfig;

/**
 * Lower-level AMQP 0-9-1 client. Every operation is fire-and-forget: it
 * returns immediately and its completion, failure or any later closure is
 * reported as a {@link TransportEvent} to the sink handed to
 * {@link #connect}.
 */
public interface AmqpTransport {

    /**
     * Starts opening a connection. The handle is returned at once and reports
     * {@link TransportEvent.Type#CONNECTION_OPENED} or
     * {@link TransportEvent.Type#CONNECTION_FAILED}, and later
     * {@link TransportEvent.Type#CONNECTION_CLOSED}.
     */
    TransportConnection connect(ConnectionConfig config, TransportEventSink sink);
}
