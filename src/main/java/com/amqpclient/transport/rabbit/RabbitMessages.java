package com.amqpclient.transport.rabbit;

import com.amqpclient.model.MessageProperties;
import com.rabbitmq.client.AMQP;

import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions between {@link MessageProperties} and the client's basic properties.
 */
final class RabbitMessages {

    static final int DELIVERY_MODE_TRANSIENT = 1;
    static final int DELIVERY_MODE_PERSISTENT = 2;

    private RabbitMessages() {
    }

    static AMQP.BasicProperties toBasicProperties(MessageProperties properties) {
        Map<String, Object> headers = null;
        if (!properties.getHeaders().isEmpty()) {
            headers = new LinkedHashMap<>(properties.getHeaders());
        }
        return new AMQP.BasicProperties.Builder()
                .messageId(properties.getMessageId())
                .deliveryMode(properties.isPersistent() ? DELIVERY_MODE_PERSISTENT : DELIVERY_MODE_TRANSIENT)
                .timestamp(properties.getTimestamp() > 0 ? new Date(properties.getTimestamp() * 1000L) : null)
                .contentType(properties.getContentType())
                .appId(properties.getAppId())
                .headers(headers)
                .build();
    }

    static MessageProperties fromBasicProperties(AMQP.BasicProperties properties) {
        MessageProperties.Builder builder = MessageProperties.builder();
        if (properties == null) {
            return builder.build();
        }
        builder.messageId(properties.getMessageId())
                .persistent(Integer.valueOf(DELIVERY_MODE_PERSISTENT).equals(properties.getDeliveryMode()))
                .contentType(properties.getContentType())
                .appId(properties.getAppId());
        if (properties.getTimestamp() != null) {
            builder.timestamp(properties.getTimestamp().getTime() / 1000L);
        }
        if (properties.getHeaders() != null) {
            for (Map.Entry<String, Object> header : properties.getHeaders().entrySet()) {
                builder.header(header.getKey(), String.valueOf(header.getValue()));
            }
        }
        return builder.build();
    }
}
