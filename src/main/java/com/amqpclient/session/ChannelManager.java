package com.amqpclient.session;

import com.amqpclient.topology.TopologyConfigurator;
import com.amqpclient.transport.CloseReason;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single channel of the session.
 *
 * An exchange declare rejected with 406 PRECONDITION_FAILED means the
 * exchange already exists with other arguments; the channel is reopened and
 * topology continues without declaring it. Any other unexpected channel close
 * takes the connection down with it so the reconnect path starts clean.
 */
public class ChannelManager {
    private static final Logger logger = LoggerFactory.getLogger(ChannelManager.class);

    private final Session session;
    private final TopologyConfigurator topology;
    private final ShutdownCoordinator shutdown;
    private final SessionRole role;

    public ChannelManager(Session session, TopologyConfigurator topology, ShutdownCoordinator shutdown,
                          SessionRole role) {
        this.session = session;
        this.topology = topology;
        this.shutdown = shutdown;
        this.role = role;
    }

    public void open(TransportConnection connection) {
        logger.debug("Creating a new channel");
        topology.reset();
        session.setChannel(connection.openChannel());
    }

    public void onChannelOpened(TransportChannel channel) {
        if (!session.isCurrent(channel)) {
            logger.debug("Ignoring open of a stale channel");
            return;
        }
        if (session.isClosing()) {
            logger.debug("Channel opened while stopping");
            return;
        }
        logger.info("Channel opened");
        session.transition(SessionState.TOPOLOGY_PENDING);
        topology.configure(channel);
    }

    public void onChannelClosed(TransportChannel channel, CloseReason reason) {
        if (!session.isCurrent(channel)) {
            logger.debug("Ignoring close of a stale channel: {}", reason);
            return;
        }
        boolean declaringExchange = topology.isDeclaringExchange();
        topology.reset();

        if (session.isClosing()) {
            logger.debug("Channel closed: {}", reason);
            shutdown.onChannelClosed();
            return;
        }

        session.setChannel(null);
        role.reset();

        if (reason.isDeclareConflict()) {
            if (declaringExchange && session.getState() == SessionState.TOPOLOGY_PENDING) {
                logger.info("Exchange already exists with different arguments, reusing it: {}", reason.getReplyText());
                session.setExchangeKnownToExist(true);
                session.transition(SessionState.CHANNEL_OPENING);
                open(session.getConnection());
                return;
            }
            logger.error("Channel closed by a declare conflict: {}", reason);
            shutdown.stop(StopReason.FATAL_PROTOCOL_ERROR);
            return;
        }

        logger.warn("Channel was closed: {}", reason);
        TransportConnection connection = session.getConnection();
        if (connection != null) {
            connection.close();
        }
    }
}
