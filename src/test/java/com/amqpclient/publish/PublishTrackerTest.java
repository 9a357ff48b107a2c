package com.amqpclient.publish;

import com.amqpclient.config.TopologyConfig;
import com.amqpclient.model.MessageProperties;
import com.amqpclient.session.ManualSessionExecutor;
import com.amqpclient.session.Session;
import com.amqpclient.session.SessionSettings;
import com.amqpclient.session.ShutdownCoordinator;
import com.amqpclient.session.StopReason;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PublishTrackerTest {

    @Mock
    private TransportChannel channel;

    @Mock
    private ShutdownCoordinator shutdown;

    private ManualSessionExecutor executor;
    private Session session;

    @BeforeEach
    void setUp() {
        executor = new ManualSessionExecutor();
        session = new Session(false);
    }

    private PublishTracker tracker(SessionSettings settings) {
        TopologyConfig topology = TopologyConfig.forPublisher("orders", null, "shop").build();
        MessageFactory messageFactory = new MessageFactory(new ObjectMapper(), executor.clock(),
                settings.getAppId(), settings.isPersistent());
        return new PublishTracker(session, topology, settings, executor, executor.clock(), shutdown, messageFactory);
    }

    private PublishTracker confirmingTracker() {
        PublishTracker tracker = tracker(SessionSettings.builder().build());
        tracker.enableConfirmations(channel);
        return tracker;
    }

    @Test
    void testDeliveryTagsStartAtOneAndIncrease() {
        PublishTracker tracker = confirmingTracker();

        assertThat(tracker.publish()).isEqualTo(1);
        assertThat(tracker.publish()).isEqualTo(2);
        assertThat(tracker.publish()).isEqualTo(3);

        assertThat(tracker.getPendingTags()).containsExactly(1L, 2L, 3L);
        assertThat(session.getRecord().getPublished()).isEqualTo(3);
        verify(channel).enableConfirms();
        verify(channel, times(3)).publish(eq("shop"), eq("orders"), any(MessageProperties.class), any(byte[].class));
    }

    @Test
    void testAcksInReverseOrderEmptyThePendingSet() {
        PublishTracker tracker = confirmingTracker();
        tracker.publish();
        tracker.publish();
        tracker.publish();

        tracker.onConfirm(3, false, true);
        tracker.onConfirm(2, false, true);
        tracker.onConfirm(1, false, true);

        assertThat(tracker.hasPending()).isFalse();
        assertThat(session.getRecord().getAcked()).isEqualTo(3);
        assertThat(session.getRecord().getNacked()).isZero();
    }

    @Test
    void testMultipleAckSettlesEveryLowerTag() {
        PublishTracker tracker = confirmingTracker();
        for (int i = 0; i < 5; i++) {
            tracker.publish();
        }
        tracker.onConfirm(2, false, true);

        tracker.onConfirm(4, true, true);

        assertThat(tracker.getPendingTags()).containsExactly(5L);
        assertThat(session.getRecord().getAcked()).isEqualTo(4);
    }

    @Test
    void testNackIsCountedNotRetried() {
        PublishTracker tracker = confirmingTracker();
        tracker.publish();
        tracker.publish();

        tracker.onConfirm(1, false, false);
        tracker.onConfirm(2, false, true);

        assertThat(session.getRecord().getNacked()).isEqualTo(1);
        assertThat(session.getRecord().getAcked()).isEqualTo(1);
        verify(channel, times(2)).publish(anyString(), anyString(), any(MessageProperties.class), any(byte[].class));
    }

    @Test
    void testUnknownTagIsIgnored() {
        PublishTracker tracker = confirmingTracker();
        tracker.publish();

        tracker.onConfirm(7, false, true);
        tracker.onConfirm(1, false, true);
        tracker.onConfirm(1, false, true);

        assertThat(session.getRecord().getAcked()).isEqualTo(1);
    }

    @Test
    void testResetRestartsTagsOnNextChannel() {
        PublishTracker tracker = confirmingTracker();
        tracker.publish();
        tracker.publish();
        tracker.onConfirm(1, false, true);

        tracker.reset();

        assertThat(tracker.hasPending()).isFalse();
        assertThat(session.getRecord().getAcked()).isZero();
        assertThat(session.getRecord().getPublished()).isEqualTo(2);

        TransportChannel next = mock(TransportChannel.class);
        tracker.enableConfirmations(next);
        assertThat(tracker.publish()).isEqualTo(1);
        assertThat(tracker.getMessageNumber()).isEqualTo(3);
    }

    @Test
    void testPublishWithoutChannelFails() {
        PublishTracker tracker = tracker(SessionSettings.builder().build());

        assertThatThrownBy(tracker::publish).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testPersistentMessageProperties() {
        PublishTracker tracker = tracker(SessionSettings.builder().persistent(true).appId("tests").build());
        tracker.enableConfirmations(channel);

        tracker.publish();

        ArgumentCaptor<MessageProperties> properties = ArgumentCaptor.forClass(MessageProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel).publish(eq("shop"), eq("orders"), properties.capture(), body.capture());
        assertThat(properties.getValue().isPersistent()).isTrue();
        assertThat(properties.getValue().getAppId()).isEqualTo("tests");
        assertThat(properties.getValue().getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
        assertThat(properties.getValue().getTimestamp()).isPositive();
        assertThat(new String(body.getValue())).isEqualTo("{\"sequence\":1}");
    }

    @Test
    void testPublishesUntilQuotaThenStops() {
        PublishTracker tracker = tracker(SessionSettings.builder().maxMessages(4).build());
        tracker.start(channel);
        tracker.handle(TransportEvent.confirmsEnabled(channel));

        executor.runPending();

        assertThat(tracker.getMessageNumber()).isEqualTo(4);
        verify(shutdown).stop(StopReason.QUOTA_REACHED);
        assertThat(executor.scheduledTimers()).isZero();
    }

    @Test
    void testShutdownWithNothingPendingClosesAtOnce() {
        PublishTracker tracker = confirmingTracker();
        AtomicInteger closed = new AtomicInteger();

        tracker.beginShutdown(closed::incrementAndGet);

        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void testShutdownWaitsForOutstandingConfirms() {
        PublishTracker tracker = confirmingTracker();
        tracker.publish();
        tracker.publish();
        AtomicInteger closed = new AtomicInteger();

        tracker.beginShutdown(closed::incrementAndGet);
        tracker.onConfirm(1, false, true);
        assertThat(closed.get()).isZero();

        tracker.onConfirm(2, false, true);
        assertThat(closed.get()).isEqualTo(1);

        executor.advance(Duration.ofSeconds(10));
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void testShutdownDrainGivesUpAfterTimeout() {
        PublishTracker tracker = confirmingTracker();
        tracker.publish();
        AtomicInteger closed = new AtomicInteger();

        tracker.beginShutdown(closed::incrementAndGet);
        executor.advance(SessionSettings.DEFAULT_CONFIRM_DRAIN_TIMEOUT);

        assertThat(closed.get()).isEqualTo(1);
        assertThat(tracker.getPendingTags()).containsExactly(1L);
    }
}
