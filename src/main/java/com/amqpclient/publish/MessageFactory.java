package com.amqpclient.publish;

import com.amqpclient.model.MessageProperties;
import com.amqpclient.model.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Clock;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Builds the messages a publisher sends: a JSON body carrying the sequence
 * number and a fresh message id per message.
 */
public class MessageFactory {

    static final String SEQUENCE_FIELD = "sequence";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String appId;
    private final boolean persistent;

    public MessageFactory(ObjectMapper objectMapper, Clock clock, String appId, boolean persistent) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.appId = appId;
        this.persistent = persistent;
    }

    public OutboundMessage create(long deliveryTag, long sequence) {
        MessageProperties properties = MessageProperties.builder()
                .messageId(UUID.randomUUID().toString())
                .persistent(persistent)
                .timestamp(clock.instant().getEpochSecond())
                .contentType(MessageProperties.CONTENT_TYPE_JSON)
                .appId(appId)
                .build();
        return new OutboundMessage(deliveryTag, sequence, properties, encode(sequence));
    }

    private byte[] encode(long sequence) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put(SEQUENCE_FIELD, sequence);
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode message body", e);
        }
    }

    /**
     * Reads the sequence number back out of a body written by {@link #create}.
     * Empty for bodies from other publishers.
     */
    public static OptionalLong readSequence(ObjectMapper objectMapper, byte[] body) {
        if (body == null || body.length == 0) {
            return OptionalLong.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.hasNonNull(SEQUENCE_FIELD) && node.get(SEQUENCE_FIELD).canConvertToLong()) {
                return OptionalLong.of(node.get(SEQUENCE_FIELD).asLong());
            }
            return OptionalLong.empty();
        } catch (IOException e) {
            return OptionalLong.empty();
        }
    }
}
