package com.amqpclient.transport;

import com.amqpclient.model.ExchangeKind;
import com.amqpclient.model.MessageProperties;

/**
 * An AMQP channel. RPCs report their -Ok reply as a {@link TransportEvent};
 * a failing RPC closes the channel and is reported as
 * {@link TransportEvent.Type#CHANNEL_CLOSED} carrying the broker's reason.
 */
public interface TransportChannel {

    TransportConnection getConnection();

    void declareExchange(String exchange, ExchangeKind kind, boolean durable);

    void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete);

    void bindQueue(String queue, String exchange, String routingKey);

    /**
     * Confirm.Select. Broker acks and nacks follow as
     * {@link TransportEvent.Type#CONFIRM} events.
     */
    void enableConfirms();

    void publish(String exchange, String routingKey, MessageProperties properties, byte[] body);

    /**
     * Basic.Consume with manual acknowledgement under a client-chosen tag.
     */
    void consume(String queue, String consumerTag);

    void ack(long deliveryTag);

    void cancel(String consumerTag);

    void close();

    boolean isOpen();
}
