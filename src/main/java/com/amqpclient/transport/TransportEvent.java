package com.amqpclient.transport;

import com.amqpclient.model.InboundMessage;

/**
 * A completion, failure or closure reported by the transport. The session
 * handles events one at a time on its own thread.
 */
public final class TransportEvent {

    public enum Type {
        CONNECTION_OPENED,
        CONNECTION_FAILED,
        CONNECTION_CLOSED,
        CHANNEL_OPENED,
        CHANNEL_CLOSED,
        EXCHANGE_DECLARED,
        QUEUE_DECLARED,
        QUEUE_BOUND,
        CONFIRMS_ENABLED,
        CONFIRM,
        CONSUME_OK,
        DELIVERY,
        CONSUMER_CANCELLED,
        CANCEL_OK
    }

    private final Type type;
    private final TransportConnection connection;
    private final TransportChannel channel;
    private final CloseReason reason;
    private final long deliveryTag;
    private final boolean multiple;
    private final boolean ack;
    private final String consumerTag;
    private final InboundMessage message;

    private TransportEvent(Type type, TransportConnection connection, TransportChannel channel, CloseReason reason,
                           long deliveryTag, boolean multiple, boolean ack, String consumerTag,
                           InboundMessage message) {
        this.type = type;
        this.connection = connection;
        this.channel = channel;
        this.reason = reason;
        this.deliveryTag = deliveryTag;
        this.multiple = multiple;
        this.ack = ack;
        this.consumerTag = consumerTag;
        this.message = message;
    }

    public static TransportEvent connectionOpened(TransportConnection connection) {
        return new TransportEvent(Type.CONNECTION_OPENED, connection, null, null, 0, false, false, null, null);
    }

    public static TransportEvent connectionFailed(TransportConnection connection, Throwable cause) {
        return new TransportEvent(Type.CONNECTION_FAILED, connection, null, CloseReason.failure(cause),
                0, false, false, null, null);
    }

    public static TransportEvent connectionClosed(TransportConnection connection, CloseReason reason) {
        return new TransportEvent(Type.CONNECTION_CLOSED, connection, null, reason, 0, false, false, null, null);
    }

    public static TransportEvent channelOpened(TransportChannel channel) {
        return of(Type.CHANNEL_OPENED, channel);
    }

    public static TransportEvent channelClosed(TransportChannel channel, CloseReason reason) {
        return new TransportEvent(Type.CHANNEL_CLOSED, channel.getConnection(), channel, reason,
                0, false, false, null, null);
    }

    public static TransportEvent exchangeDeclared(TransportChannel channel) {
        return of(Type.EXCHANGE_DECLARED, channel);
    }

    public static TransportEvent queueDeclared(TransportChannel channel) {
        return of(Type.QUEUE_DECLARED, channel);
    }

    public static TransportEvent queueBound(TransportChannel channel) {
        return of(Type.QUEUE_BOUND, channel);
    }

    public static TransportEvent confirmsEnabled(TransportChannel channel) {
        return of(Type.CONFIRMS_ENABLED, channel);
    }

    public static TransportEvent confirm(TransportChannel channel, long deliveryTag, boolean multiple, boolean ack) {
        return new TransportEvent(Type.CONFIRM, channel.getConnection(), channel, null,
                deliveryTag, multiple, ack, null, null);
    }

    public static TransportEvent consumeOk(TransportChannel channel, String consumerTag) {
        return new TransportEvent(Type.CONSUME_OK, channel.getConnection(), channel, null,
                0, false, false, consumerTag, null);
    }

    public static TransportEvent delivery(TransportChannel channel, String consumerTag, InboundMessage message) {
        return new TransportEvent(Type.DELIVERY, channel.getConnection(), channel, null,
                message.getDeliveryTag(), false, false, consumerTag, message);
    }

    public static TransportEvent consumerCancelled(TransportChannel channel, String consumerTag) {
        return new TransportEvent(Type.CONSUMER_CANCELLED, channel.getConnection(), channel, null,
                0, false, false, consumerTag, null);
    }

    public static TransportEvent cancelOk(TransportChannel channel, String consumerTag) {
        return new TransportEvent(Type.CANCEL_OK, channel.getConnection(), channel, null,
                0, false, false, consumerTag, null);
    }

    private static TransportEvent of(Type type, TransportChannel channel) {
        return new TransportEvent(type, channel.getConnection(), channel, null, 0, false, false, null, null);
    }

    public Type getType() {
        return type;
    }

    public TransportConnection getConnection() {
        return connection;
    }

    public TransportChannel getChannel() {
        return channel;
    }

    public CloseReason getReason() {
        return reason;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isMultiple() {
        return multiple;
    }

    public boolean isAck() {
        return ack;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public InboundMessage getMessage() {
        return message;
    }

    @Override
    public String toString() {
        switch (type) {
            case CONNECTION_FAILED:
            case CONNECTION_CLOSED:
            case CHANNEL_CLOSED:
                return type + " " + reason;
            case CONFIRM:
                return type + (ack ? " ack " : " nack ") + deliveryTag + (multiple ? " (multiple)" : "");
            case DELIVERY:
                return type + " " + message;
            case CONSUME_OK:
            case CONSUMER_CANCELLED:
            case CANCEL_OK:
                return type + " " + consumerTag;
            default:
                return type.toString();
        }
    }
}
