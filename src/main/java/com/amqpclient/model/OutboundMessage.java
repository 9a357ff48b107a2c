package com.amqpclient.model;

/**
 * A published message awaiting its broker confirmation.
 */
public final class OutboundMessage {

    private final long deliveryTag;
    private final long sequence;
    private final MessageProperties properties;
    private final byte[] body;

    public OutboundMessage(long deliveryTag, long sequence, MessageProperties properties, byte[] body) {
        this.deliveryTag = deliveryTag;
        this.sequence = sequence;
        this.properties = properties;
        this.body = body;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    /**
     * Application sequence number carried in the body. Unlike the delivery
     * tag it keeps counting across reconnects.
     */
    public long getSequence() {
        return sequence;
    }

    public MessageProperties getProperties() {
        return properties;
    }

    public byte[] getBody() {
        return body;
    }

    @Override
    public String toString() {
        return String.format("OutboundMessage{tag=%d, sequence=%d, id=%s}",
                deliveryTag, sequence, properties.getMessageId());
    }
}
