package com.amqpclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Standard AMQP message properties carried by every outbound message and
 * recovered from every inbound one.
 */
public final class MessageProperties {

    public static final String CONTENT_TYPE_JSON = "application/json";

    private final String messageId;
    private final boolean persistent;
    private final long timestamp;
    private final String contentType;
    private final String appId;
    private final Map<String, String> headers;

    private MessageProperties(Builder builder) {
        this.messageId = builder.messageId;
        this.persistent = builder.persistent;
        this.timestamp = builder.timestamp;
        this.contentType = builder.contentType;
        this.appId = builder.appId;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMessageId() {
        return messageId;
    }

    public boolean isPersistent() {
        return persistent;
    }

    /**
     * Capture time in epoch seconds, the resolution of the AMQP timestamp property.
     */
    public long getTimestamp() {
        return timestamp;
    }

    public String getContentType() {
        return contentType;
    }

    public String getAppId() {
        return appId;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageProperties)) return false;
        MessageProperties that = (MessageProperties) o;
        return persistent == that.persistent
                && timestamp == that.timestamp
                && Objects.equals(messageId, that.messageId)
                && Objects.equals(contentType, that.contentType)
                && Objects.equals(appId, that.appId)
                && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, persistent, timestamp, contentType, appId, headers);
    }

    @Override
    public String toString() {
        return String.format("MessageProperties{messageId='%s', persistent=%s, timestamp=%d, contentType='%s', appId='%s', headers=%s}",
                messageId, persistent, timestamp, contentType, appId, headers);
    }

    public static class Builder {
        private String messageId;
        private boolean persistent;
        private long timestamp;
        private String contentType;
        private String appId;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder timestamp(long epochSeconds) {
            this.timestamp = epochSeconds;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public MessageProperties build() {
            return new MessageProperties(this);
        }
    }
}
