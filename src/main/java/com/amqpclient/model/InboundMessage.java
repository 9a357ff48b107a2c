package com.amqpclient.model;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * A delivery received from the broker.
 */
public final class InboundMessage {

    private final long deliveryTag;
    private final boolean redelivered;
    private final String exchange;
    private final String routingKey;
    private final MessageProperties properties;
    private final byte[] body;

    public InboundMessage(long deliveryTag, boolean redelivered, String exchange, String routingKey,
                          MessageProperties properties, byte[] body) {
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.properties = properties != null ? properties : MessageProperties.builder().build();
        this.body = body != null ? body : new byte[0];
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public Optional<String> getMessageId() {
        return Optional.ofNullable(properties.getMessageId());
    }

    public MessageProperties getProperties() {
        return properties;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return String.format("InboundMessage{tag=%d, redelivered=%s, id=%s, routingKey='%s'}",
                deliveryTag, redelivered, properties.getMessageId(), routingKey);
    }
}
