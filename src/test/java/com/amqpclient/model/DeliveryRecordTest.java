package com.amqpclient.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class DeliveryRecordTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void testFirstMessageTimeIsKept() {
        DeliveryRecord record = new DeliveryRecord();

        record.markFirstMessage(START);
        record.markFirstMessage(START.plusSeconds(5));

        assertThat(record.getFirstMessageTime()).isEqualTo(START);
        assertThat(record.elapsed(START.plusSeconds(2))).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void testThroughput() {
        DeliveryRecord record = new DeliveryRecord();
        record.markFirstMessage(START);

        assertThat(record.throughput(3, START.plusMillis(2000))).isEqualTo(1.5);
        assertThat(record.throughput(1, START.plusMillis(3000))).isEqualTo(0.33);
        assertThat(record.throughput(10, START)).isZero();
    }

    @Test
    void testThroughputWithoutMessages() {
        DeliveryRecord record = new DeliveryRecord();

        assertThat(record.elapsed(START)).isEqualTo(Duration.ZERO);
        assertThat(record.throughput(0, START)).isZero();
    }

    @Test
    void testResetConfirmationsKeepsTotals() {
        DeliveryRecord record = new DeliveryRecord();
        record.recordPublished();
        record.recordPublished();
        record.recordAcked(1);
        record.recordNacked(1);
        record.recordReceived();
        record.recordDuplicate();

        record.resetConfirmations();

        assertThat(record.getAcked()).isZero();
        assertThat(record.getNacked()).isZero();
        assertThat(record.getPublished()).isEqualTo(2);
        assertThat(record.getReceived()).isEqualTo(1);
        assertThat(record.getDuplicates()).isEqualTo(1);
    }

    @Test
    void testSnapshotIsDetached() {
        DeliveryRecord record = new DeliveryRecord();
        record.recordReceived();

        DeliveryRecord snapshot = record.snapshot();
        record.recordReceived();

        assertThat(snapshot.getReceived()).isEqualTo(1);
        assertThat(record.getReceived()).isEqualTo(2);
    }
}
