package com.amqpclient.consume;

import com.amqpclient.config.TopologyConfig;
import com.amqpclient.model.DeliveryRecord;
import com.amqpclient.model.InboundMessage;
import com.amqpclient.publish.MessageFactory;
import com.amqpclient.session.Session;
import com.amqpclient.session.SessionRole;
import com.amqpclient.session.SessionSettings;
import com.amqpclient.session.ShutdownCoordinator;
import com.amqpclient.session.StopReason;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Consumes with manual acknowledgements, dropping redelivered duplicates by
 * message id.
 *
 * Duplicates are acknowledged so the broker stops redelivering them, and
 * counted separately from received messages. Deliveries that arrive once the
 * session is stopping are left unacknowledged for the broker to requeue.
 */
public class ConsumeLoop implements SessionRole {
    private static final Logger logger = LoggerFactory.getLogger(ConsumeLoop.class);

    private final Session session;
    private final TopologyConfig topology;
    private final SessionSettings settings;
    private final Clock clock;
    private final ShutdownCoordinator shutdown;
    private final ObjectMapper objectMapper;
    private final SeenMessageIds seen;

    private TransportChannel channel;
    private String consumerTag;
    private boolean stopping;
    private Runnable cancelCallback;

    public ConsumeLoop(Session session, TopologyConfig topology, SessionSettings settings, Clock clock,
                       ShutdownCoordinator shutdown, ObjectMapper objectMapper) {
        this.session = session;
        this.topology = topology;
        this.settings = settings;
        this.clock = clock;
        this.shutdown = shutdown;
        this.objectMapper = objectMapper;
        this.seen = new SeenMessageIds(settings.getDedupWindow());
    }

    @Override
    public void start(TransportChannel channel) {
        startConsuming(channel, topology.getQueueName());
    }

    /**
     * Issues Basic.Consume on {@code queue} and returns the consumer tag.
     */
    public String startConsuming(TransportChannel channel, String queue) {
        this.channel = channel;
        this.consumerTag = "ctag-" + UUID.randomUUID();
        logger.debug("Issuing Basic.Consume on {} as {}", queue, consumerTag);
        channel.consume(queue, consumerTag);
        return consumerTag;
    }

    @Override
    public void handle(TransportEvent event) {
        switch (event.getType()) {
            case CONSUME_OK:
                logger.info("Consuming from {} as {}", topology.getQueueName(), event.getConsumerTag());
                break;
            case DELIVERY:
                onDelivery(event.getMessage());
                break;
            case CONSUMER_CANCELLED:
                onCancelled(event.getConsumerTag());
                break;
            case CANCEL_OK:
                onCancelOk(event.getConsumerTag());
                break;
            default:
                logger.debug("Consumer ignoring {}", event);
                break;
        }
    }

    public void onDelivery(InboundMessage message) {
        if (stopping || channel == null) {
            logger.debug("Leaving delivery {} unacknowledged while stopping", message.getDeliveryTag());
            return;
        }
        DeliveryRecord record = session.getRecord();
        Optional<String> messageId = message.getMessageId();

        if (messageId.isPresent() && !seen.add(messageId.get())) {
            logger.warn("Duplicate message {} (delivery tag {}, redelivered={})",
                    messageId.get(), message.getDeliveryTag(), message.isRedelivered());
            record.recordDuplicate();
            channel.ack(message.getDeliveryTag());
            return;
        }

        record.markFirstMessage(clock.instant());
        if (logger.isDebugEnabled()) {
            OptionalLong sequence = MessageFactory.readSequence(objectMapper, message.getBody());
            logger.debug("Received message {} (sequence {}), acknowledging tag {}",
                    messageId.orElse("<no id>"), sequence.isPresent() ? sequence.getAsLong() : "?",
                    message.getDeliveryTag());
        }
        channel.ack(message.getDeliveryTag());
        record.recordReceived();

        long max = settings.getMaxMessages();
        if (max > 0 && record.getReceived() >= max) {
            Instant now = clock.instant();
            logger.info("{} messages received in {} ms ({}/s)", record.getReceived(),
                    record.elapsed(now).toMillis(), record.throughput(record.getReceived(), now));
            shutdown.stop(StopReason.QUOTA_REACHED);
        }
    }

    /**
     * The broker cancelled the consumer, e.g. because the queue was deleted.
     */
    public void onCancelled(String tag) {
        logger.warn("Consumer {} was cancelled remotely", tag);
        consumerTag = null;
        if (cancelCallback != null) {
            runCancelCallback();
            return;
        }
        if (channel != null) {
            channel.close();
        }
    }

    public void onCancelOk(String tag) {
        logger.debug("Broker acknowledged cancellation of {}", tag);
        consumerTag = null;
        if (cancelCallback != null) {
            runCancelCallback();
        }
    }

    @Override
    public void reset() {
        channel = null;
        consumerTag = null;
        cancelCallback = null;
    }

    @Override
    public void beginShutdown(Runnable readyToCloseChannel) {
        stopping = true;
        if (consumerTag == null || channel == null) {
            readyToCloseChannel.run();
            return;
        }
        logger.info("Cancelling consumer {}", consumerTag);
        cancelCallback = readyToCloseChannel;
        channel.cancel(consumerTag);
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    SeenMessageIds getSeenMessageIds() {
        return seen;
    }

    private void runCancelCallback() {
        Runnable callback = cancelCallback;
        cancelCallback = null;
        callback.run();
    }
}
