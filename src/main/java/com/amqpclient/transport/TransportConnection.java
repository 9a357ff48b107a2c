package com.amqpclient.transport;

public interface TransportConnection {

    /**
     * Starts opening a channel. Reports {@link TransportEvent.Type#CHANNEL_OPENED}
     * once the broker answers Channel.OpenOk.
     */
    TransportChannel openChannel();

    /**
     * Starts Connection.Close. Reports {@link TransportEvent.Type#CONNECTION_CLOSED}.
     */
    void close();

    boolean isOpen();
}
