package com.amqpclient.session;

import com.amqpclient.config.ConfigurationException;
import com.amqpclient.config.ConnectionConfig;
import com.amqpclient.transport.AmqpTransport;
import com.amqpclient.transport.CloseReason;
import com.amqpclient.transport.TransportConnection;
import com.amqpclient.transport.TransportEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the broker connection and decides what happens when it goes away:
 * finish the shutdown if one is in progress, otherwise schedule a reconnect.
 */
public class ConnectionManager {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final Session session;
    private final ConnectionConfig config;
    private final AmqpTransport transport;
    private final SessionExecutor executor;
    private final TransportEventSink sink;
    private final ChannelManager channelManager;
    private final ShutdownCoordinator shutdown;
    private final SessionRole role;

    // consecutive attempts that never reached an open connection
    private int failedAttempts;

    public ConnectionManager(Session session, ConnectionConfig config, AmqpTransport transport,
                             SessionExecutor executor, TransportEventSink sink, ChannelManager channelManager,
                             ShutdownCoordinator shutdown, SessionRole role) {
        this.session = session;
        this.config = config;
        this.transport = transport;
        this.executor = executor;
        this.sink = sink;
        this.channelManager = channelManager;
        this.shutdown = shutdown;
        this.role = role;
    }

    /**
     * Requests a new transport connection.
     *
     * @throws ConfigurationException if certificate material is missing
     */
    public void connect() {
        config.validate();
        session.transition(SessionState.CONNECTING);
        logger.info("Connecting to {} (attempt {} of {})",
                config.describe(), failedAttempts + 1, config.getConnectionAttempts());
        TransportConnection connection = transport.connect(config, sink);
        session.setConnection(connection);
    }

    public void onConnectionOpened(TransportConnection connection) {
        if (!session.isCurrent(connection)) {
            logger.debug("Ignoring open of a stale connection");
            return;
        }
        if (session.isClosing()) {
            logger.debug("Connection opened while stopping, closing it");
            connection.close();
            return;
        }
        failedAttempts = 0;
        logger.info("Connection opened");
        session.transition(SessionState.CHANNEL_OPENING);
        channelManager.open(connection);
    }

    public void onConnectionFailed(TransportConnection connection, CloseReason reason) {
        if (!session.isCurrent(connection)) {
            logger.debug("Ignoring failure of a stale connection: {}", reason);
            return;
        }
        failedAttempts++;
        logger.warn("Connection attempt failed: {}", reason);
        connectionLost();
    }

    public void onConnectionClosed(TransportConnection connection, CloseReason reason) {
        if (!session.isCurrent(connection)) {
            logger.debug("Ignoring close of a stale connection: {}", reason);
            return;
        }
        if (!session.isClosing()) {
            logger.warn("Connection closed: {}", reason);
        } else {
            logger.debug("Connection closed: {}", reason);
        }
        connectionLost();
    }

    private void connectionLost() {
        session.setChannel(null);
        if (session.isClosing()) {
            shutdown.onConnectionClosed();
            return;
        }

        session.setConnection(null);
        role.reset();
        session.transition(SessionState.DISCONNECTED);

        if (failedAttempts >= config.getConnectionAttempts()) {
            logger.error("Giving up after {} connection attempts to {}", failedAttempts, config.describe());
            shutdown.stop(StopReason.RECONNECT_EXHAUSTED);
            return;
        }
        logger.warn("Reopening connection in {} ms", config.getReconnectDelay().toMillis());
        session.setReconnectTimer(executor.schedule(this::reconnect, config.getReconnectDelay()));
    }

    private void reconnect() {
        session.setReconnectTimer(null);
        if (session.isClosing()) {
            return;
        }
        try {
            connect();
        } catch (ConfigurationException e) {
            logger.error("Cannot reconnect: {}", e.getMessage());
            shutdown.stop(StopReason.CONFIGURATION_ERROR);
        }
    }

    int getFailedAttempts() {
        return failedAttempts;
    }
}
