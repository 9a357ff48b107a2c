package com.amqpclient.transport;

/**
 * Receives transport events. Implementations must accept events from any
 * thread.
 */
@FunctionalInterface
public interface TransportEventSink {

    void post(TransportEvent event);
}
