package com.amqpclient.session;

import com.amqpclient.model.DeliveryRecord;

/**
 * How a session ended.
 */
public final class SessionOutcome {

    public enum Result {
        COMPLETED,
        FAILED
    }

    private final Result result;
    private final StopReason stopReason;
    private final boolean forced;
    private final DeliveryRecord record;

    public SessionOutcome(Result result, StopReason stopReason, boolean forced, DeliveryRecord record) {
        this.result = result;
        this.stopReason = stopReason;
        this.forced = forced;
        this.record = record;
    }

    public Result getResult() {
        return result;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    /**
     * True when the shutdown timeout expired before the close handshake finished.
     */
    public boolean isForced() {
        return forced;
    }

    public DeliveryRecord getRecord() {
        return record;
    }

    public int exitCode() {
        return result == Result.COMPLETED ? 0 : 1;
    }

    @Override
    public String toString() {
        return "SessionOutcome{" + result + ", reason=" + stopReason + (forced ? ", forced" : "") + ", " + record + "}";
    }
}
