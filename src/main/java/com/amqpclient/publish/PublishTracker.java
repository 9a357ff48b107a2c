package com.amqpclient.publish;

import com.amqpclient.config.TopologyConfig;
import com.amqpclient.model.DeliveryRecord;
import com.amqpclient.model.OutboundMessage;
import com.amqpclient.session.ScheduledTask;
import com.amqpclient.session.Session;
import com.amqpclient.session.SessionExecutor;
import com.amqpclient.session.SessionRole;
import com.amqpclient.session.SessionSettings;
import com.amqpclient.session.ShutdownCoordinator;
import com.amqpclient.session.StopReason;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Publishes in confirm mode and tracks which delivery tags the broker has
 * yet to confirm.
 *
 * Delivery tags count from 1 on every channel. A confirm with
 * {@code multiple} set settles every pending tag up to and including its own.
 */
public class PublishTracker implements SessionRole {
    private static final Logger logger = LoggerFactory.getLogger(PublishTracker.class);

    private final Session session;
    private final TopologyConfig topology;
    private final SessionSettings settings;
    private final SessionExecutor executor;
    private final Clock clock;
    private final ShutdownCoordinator shutdown;
    private final MessageFactory messageFactory;

    private final NavigableSet<Long> pending = new TreeSet<>();
    private TransportChannel channel;
    private long deliveryTag;
    private long messageNumber;
    private boolean stopping;
    private ScheduledTask nextPublish;
    private Runnable drainCallback;
    private ScheduledTask drainTimer;

    public PublishTracker(Session session, TopologyConfig topology, SessionSettings settings,
                          SessionExecutor executor, Clock clock, ShutdownCoordinator shutdown,
                          MessageFactory messageFactory) {
        this.session = session;
        this.topology = topology;
        this.settings = settings;
        this.executor = executor;
        this.clock = clock;
        this.shutdown = shutdown;
        this.messageFactory = messageFactory;
    }

    @Override
    public void start(TransportChannel channel) {
        enableConfirmations(channel);
    }

    /**
     * Puts {@code channel} in confirm mode. Publishing starts once the broker
     * acknowledges with Confirm.SelectOk.
     */
    public void enableConfirmations(TransportChannel channel) {
        this.channel = channel;
        this.deliveryTag = 0;
        this.pending.clear();
        logger.debug("Issuing Confirm.Select");
        channel.enableConfirms();
    }

    @Override
    public void handle(TransportEvent event) {
        switch (event.getType()) {
            case CONFIRMS_ENABLED:
                logger.info("Publisher confirms enabled");
                scheduleNextMessage();
                break;
            case CONFIRM:
                onConfirm(event.getDeliveryTag(), event.isMultiple(), event.isAck());
                break;
            default:
                logger.debug("Publisher ignoring {}", event);
                break;
        }
    }

    /**
     * Sends one message and returns the delivery tag it was assigned.
     */
    public long publish() {
        if (channel == null) {
            throw new IllegalStateException("No channel to publish on");
        }
        DeliveryRecord record = session.getRecord();
        record.markFirstMessage(clock.instant());

        long tag = ++deliveryTag;
        long sequence = ++messageNumber;
        OutboundMessage message = messageFactory.create(tag, sequence);
        pending.add(tag);
        channel.publish(topology.getExchangeName(), topology.getRoutingKey(), message.getProperties(),
                message.getBody());
        record.recordPublished();
        logger.debug("Published message # {} with tag {} ({})", sequence, tag, message.getProperties().getMessageId());
        return tag;
    }

    public void onConfirm(long tag, boolean multiple, boolean ack) {
        long settled;
        if (multiple) {
            SortedSet<Long> upTo = pending.headSet(tag, true);
            settled = upTo.size();
            upTo.clear();
        } else {
            settled = pending.remove(tag) ? 1 : 0;
        }
        if (settled == 0) {
            logger.debug("Confirm for unknown delivery tag {}", tag);
            return;
        }

        DeliveryRecord record = session.getRecord();
        if (ack) {
            record.recordAcked(settled);
        } else {
            record.recordNacked(settled);
            logger.warn("Broker nacked {} message(s) up to tag {}", settled, tag);
        }
        logger.debug("Published {} messages, {} have yet to be confirmed, {} were acked and {} were nacked",
                deliveryTag, pending.size(), record.getAcked(), record.getNacked());

        if (drainCallback != null && pending.isEmpty()) {
            logger.debug("All outstanding confirms received");
            drained();
        }
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public SortedSet<Long> getPendingTags() {
        return Collections.unmodifiableSortedSet(pending);
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public long getMessageNumber() {
        return messageNumber;
    }

    @Override
    public void reset() {
        if (!pending.isEmpty()) {
            logger.warn("Discarding {} unconfirmed deliveries of the lost channel", pending.size());
        }
        cancelNextPublish();
        channel = null;
        deliveryTag = 0;
        pending.clear();
        session.getRecord().resetConfirmations();
    }

    @Override
    public void beginShutdown(Runnable readyToCloseChannel) {
        stopping = true;
        cancelNextPublish();

        Duration timeout = settings.getConfirmDrainTimeout();
        if (pending.isEmpty() || channel == null || timeout.isZero()) {
            readyToCloseChannel.run();
            return;
        }
        logger.info("Waiting up to {} ms for {} outstanding confirms", timeout.toMillis(), pending.size());
        drainCallback = readyToCloseChannel;
        drainTimer = executor.schedule(() -> {
            drainTimer = null;
            logger.warn("{} messages still unconfirmed after {} ms", pending.size(), timeout.toMillis());
            drained();
        }, timeout);
    }

    private void drained() {
        Runnable callback = drainCallback;
        drainCallback = null;
        if (drainTimer != null) {
            drainTimer.cancel();
            drainTimer = null;
        }
        callback.run();
    }

    private void scheduleNextMessage() {
        if (stopping) {
            return;
        }
        logger.debug("Scheduling next message for {} ms", settings.getPublishInterval().toMillis());
        nextPublish = executor.schedule(this::publishNext, settings.getPublishInterval());
    }

    private void publishNext() {
        nextPublish = null;
        if (stopping || channel == null) {
            return;
        }
        publish();
        long max = settings.getMaxMessages();
        if (max > 0 && messageNumber >= max) {
            Instant now = clock.instant();
            DeliveryRecord record = session.getRecord();
            logger.info("{} messages sent in {} ms ({}/s)", messageNumber, record.elapsed(now).toMillis(),
                    record.throughput(messageNumber, now));
            shutdown.stop(StopReason.QUOTA_REACHED);
            return;
        }
        scheduleNextMessage();
    }

    private void cancelNextPublish() {
        if (nextPublish != null) {
            nextPublish.cancel();
            nextPublish = null;
        }
    }
}
