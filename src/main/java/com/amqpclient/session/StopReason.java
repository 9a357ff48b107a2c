package com.amqpclient.session;

/**
 * Why a session was asked to stop.
 */
public enum StopReason {
    QUOTA_REACHED(false),
    INTERRUPTED(false),
    FATAL_PROTOCOL_ERROR(true),
    RECONNECT_EXHAUSTED(true),
    CONFIGURATION_ERROR(true);

    private final boolean failure;

    StopReason(boolean failure) {
        this.failure = failure;
    }

    public boolean isFailure() {
        return failure;
    }
}
