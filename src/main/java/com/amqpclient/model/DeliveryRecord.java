package com.amqpclient.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome bookkeeping for one session. Owned by the session thread.
 *
 * Acked and nacked counts are per channel lifetime and are reset on
 * reconnect; published and received totals run for the whole session.
 */
public class DeliveryRecord {

    private long published;
    private long acked;
    private long nacked;
    private long received;
    private long duplicates;
    private Instant firstMessageTime;

    public void markFirstMessage(Instant now) {
        if (firstMessageTime == null) {
            firstMessageTime = now;
        }
    }

    public void recordPublished() {
        published++;
    }

    public void recordAcked(long count) {
        acked += count;
    }

    public void recordNacked(long count) {
        nacked += count;
    }

    public void recordReceived() {
        received++;
    }

    public void recordDuplicate() {
        duplicates++;
    }

    /**
     * Drops the confirmation counters of a lost channel.
     */
    public void resetConfirmations() {
        acked = 0;
        nacked = 0;
    }

    public long getPublished() {
        return published;
    }

    public long getAcked() {
        return acked;
    }

    public long getNacked() {
        return nacked;
    }

    public long getReceived() {
        return received;
    }

    public long getDuplicates() {
        return duplicates;
    }

    public Instant getFirstMessageTime() {
        return firstMessageTime;
    }

    public Duration elapsed(Instant now) {
        if (firstMessageTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(firstMessageTime, now);
    }

    /**
     * Messages per second since the first message, rounded to two decimals.
     */
    public double throughput(long count, Instant now) {
        long millis = elapsed(now).toMillis();
        if (millis <= 0) {
            return 0.0;
        }
        double perSecond = count * 1000.0 / millis;
        return Math.round(perSecond * 100.0) / 100.0;
    }

    public DeliveryRecord snapshot() {
        DeliveryRecord copy = new DeliveryRecord();
        copy.published = published;
        copy.acked = acked;
        copy.nacked = nacked;
        copy.received = received;
        copy.duplicates = duplicates;
        copy.firstMessageTime = firstMessageTime;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("DeliveryRecord{published=%d, acked=%d, nacked=%d, received=%d, duplicates=%d}",
                published, acked, nacked, received, duplicates);
    }
}
