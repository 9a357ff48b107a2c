package com.amqpclient.session;

import com.amqpclient.config.ClientRole;
import com.amqpclient.config.ConnectionConfig;
import com.amqpclient.config.TopologyConfig;
import com.amqpclient.consume.ConsumeLoop;
import com.amqpclient.publish.MessageFactory;
import com.amqpclient.publish.PublishTracker;
import com.amqpclient.topology.TopologyConfigurator;
import com.amqpclient.transport.AmqpTransport;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportEvent;
import com.amqpclient.transport.TransportEventSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A publishing or consuming session against one broker.
 *
 * Transport events may arrive on any thread; they are re-posted to the
 * session executor and handled there one at a time, so the components never
 * see concurrent access.
 */
public class AmqpSession implements TransportEventSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AmqpSession.class);

    private final ConnectionConfig connectionConfig;
    private final SessionExecutor executor;
    private final Session session;
    private final ShutdownCoordinator shutdown;
    private final SessionRole role;
    private final TopologyConfigurator topology;
    private final ChannelManager channelManager;
    private final ConnectionManager connectionManager;

    public AmqpSession(ConnectionConfig connectionConfig, TopologyConfig topologyConfig, SessionSettings settings,
                       AmqpTransport transport) {
        this(connectionConfig, topologyConfig, settings, transport, new NettySessionExecutor(),
                Clock.systemUTC(), new ObjectMapper());
    }

    public AmqpSession(ConnectionConfig connectionConfig, TopologyConfig topologyConfig, SessionSettings settings,
                       AmqpTransport transport, SessionExecutor executor, Clock clock, ObjectMapper objectMapper) {
        this.connectionConfig = connectionConfig;
        this.executor = executor;
        this.session = new Session(topologyConfig.isExchangeAssumedToExist());
        this.shutdown = new ShutdownCoordinator(session, executor, settings);

        if (topologyConfig.getRole() == ClientRole.PUBLISHER) {
            MessageFactory messageFactory = new MessageFactory(objectMapper, clock, settings.getAppId(),
                    settings.isPersistent());
            this.role = new PublishTracker(session, topologyConfig, settings, executor, clock, shutdown,
                    messageFactory);
        } else {
            this.role = new ConsumeLoop(session, topologyConfig, settings, clock, shutdown, objectMapper);
        }
        shutdown.setRole(role);

        this.topology = new TopologyConfigurator(session, topologyConfig, role);
        this.channelManager = new ChannelManager(session, topology, shutdown, role);
        this.connectionManager = new ConnectionManager(session, connectionConfig, transport, executor, this,
                channelManager, shutdown, role);
    }

    /**
     * Validates the connection settings and starts connecting.
     *
     * @return completes when the session has closed
     * @throws com.amqpclient.config.ConfigurationException if certificate material is missing
     */
    public CompletableFuture<SessionOutcome> start() {
        connectionConfig.validate();
        logger.debug("Starting session against {}", connectionConfig.describe());
        executor.execute(() -> guarded("connect", connectionManager::connect));
        return shutdown.getTermination();
    }

    /**
     * Requests an orderly close. Callable from any thread, any number of times.
     */
    public void stop(StopReason reason) {
        executor.execute(() -> guarded("stop", () -> shutdown.stop(reason)));
    }

    public CompletableFuture<SessionOutcome> getTermination() {
        return shutdown.getTermination();
    }

    public SessionOutcome awaitTermination(Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        return shutdown.getTermination().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void post(TransportEvent event) {
        executor.execute(() -> guarded(event.getType().name(), () -> dispatch(event)));
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    Session getSession() {
        return session;
    }

    SessionRole getRole() {
        return role;
    }

    ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    void dispatch(TransportEvent event) {
        logger.trace("Handling {}", event);
        if (session.getState().isTerminal()) {
            logger.debug("Session closed, dropping {}", event);
            return;
        }
        switch (event.getType()) {
            case CONNECTION_OPENED:
                connectionManager.onConnectionOpened(event.getConnection());
                break;
            case CONNECTION_FAILED:
                connectionManager.onConnectionFailed(event.getConnection(), event.getReason());
                break;
            case CONNECTION_CLOSED:
                connectionManager.onConnectionClosed(event.getConnection(), event.getReason());
                break;
            case CHANNEL_OPENED:
                channelManager.onChannelOpened(event.getChannel());
                break;
            case CHANNEL_CLOSED:
                channelManager.onChannelClosed(event.getChannel(), event.getReason());
                break;
            case EXCHANGE_DECLARED:
                if (topologyEvent(event)) {
                    topology.onExchangeDeclared(event.getChannel());
                }
                break;
            case QUEUE_DECLARED:
                if (topologyEvent(event)) {
                    topology.onQueueDeclared(event.getChannel());
                }
                break;
            case QUEUE_BOUND:
                if (topologyEvent(event)) {
                    topology.onQueueBound(event.getChannel());
                }
                break;
            default:
                if (session.isCurrent(event.getChannel())) {
                    role.handle(event);
                } else {
                    logger.debug("Ignoring {} from a stale channel", event);
                }
                break;
        }
    }

    private boolean topologyEvent(TransportEvent event) {
        TransportChannel channel = event.getChannel();
        if (!session.isCurrent(channel) || session.isClosing()
                || session.getState() != SessionState.TOPOLOGY_PENDING) {
            logger.debug("Ignoring {} outside of topology setup", event);
            return false;
        }
        return true;
    }

    private void guarded(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling {}, stopping session", what, e);
            if (!session.isClosing()) {
                shutdown.stop(StopReason.FATAL_PROTOCOL_ERROR);
            }
        }
    }
}
