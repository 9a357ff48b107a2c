package com.amqpclient.session;

import java.time.Duration;

/**
 * Behavioural settings of a session that do not concern the connection itself.
 */
public final class SessionSettings {

    public static final long DEFAULT_MAX_MESSAGES = 100;
    public static final Duration DEFAULT_PUBLISH_INTERVAL = Duration.ZERO;
    public static final Duration DEFAULT_CONFIRM_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_DEDUP_WINDOW = 10_000;
    public static final String DEFAULT_APP_ID = "amqp-session-client";

    private final long maxMessages;
    private final boolean persistent;
    private final Duration publishInterval;
    private final Duration confirmDrainTimeout;
    private final Duration shutdownTimeout;
    private final int dedupWindow;
    private final String appId;

    private SessionSettings(Builder builder) {
        this.maxMessages = builder.maxMessages;
        this.persistent = builder.persistent;
        this.publishInterval = builder.publishInterval;
        this.confirmDrainTimeout = builder.confirmDrainTimeout;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.dedupWindow = builder.dedupWindow;
        this.appId = builder.appId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Message quota. Zero means unbounded; the command line refuses to start
     * a publisher with nothing to send.
     */
    public long getMaxMessages() {
        return maxMessages;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public Duration getPublishInterval() {
        return publishInterval;
    }

    public Duration getConfirmDrainTimeout() {
        return confirmDrainTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public int getDedupWindow() {
        return dedupWindow;
    }

    public String getAppId() {
        return appId;
    }

    @Override
    public String toString() {
        return String.format("SessionSettings{maxMessages=%d, persistent=%s, publishInterval=%s, dedupWindow=%d}",
                maxMessages, persistent, publishInterval, dedupWindow);
    }

    public static class Builder {
        private long maxMessages = DEFAULT_MAX_MESSAGES;
        private boolean persistent;
        private Duration publishInterval = DEFAULT_PUBLISH_INTERVAL;
        private Duration confirmDrainTimeout = DEFAULT_CONFIRM_DRAIN_TIMEOUT;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private int dedupWindow = DEFAULT_DEDUP_WINDOW;
        private String appId = DEFAULT_APP_ID;

        public Builder maxMessages(long maxMessages) {
            this.maxMessages = maxMessages;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder publishInterval(Duration interval) {
            this.publishInterval = interval;
            return this;
        }

        public Builder confirmDrainTimeout(Duration timeout) {
            this.confirmDrainTimeout = timeout;
            return this;
        }

        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder dedupWindow(int window) {
            this.dedupWindow = window;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public SessionSettings build() {
            if (maxMessages < 0) {
                throw new IllegalArgumentException("maxMessages must not be negative: " + maxMessages);
            }
            if (dedupWindow <= 0) {
                throw new IllegalArgumentException("dedupWindow must be positive: " + dedupWindow);
            }
            return new SessionSettings(this);
        }
    }
}
