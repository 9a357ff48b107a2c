package com.amqpclient.session;

import com.amqpclient.model.DeliveryRecord;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the orderly close: stop the role, close the channel, close the
 * connection, then report the outcome. Safe to trigger more than once; only
 * the first request counts.
 */
public class ShutdownCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final Session session;
    private final SessionExecutor executor;
    private final Duration shutdownTimeout;
    private final CompletableFuture<SessionOutcome> termination = new CompletableFuture<>();

    private SessionRole role;
    private ScheduledTask shutdownTimer;

    public ShutdownCoordinator(Session session, SessionExecutor executor, SessionSettings settings) {
        this.session = session;
        this.executor = executor;
        this.shutdownTimeout = settings.getShutdownTimeout();
    }

    void setRole(SessionRole role) {
        this.role = role;
    }

    public CompletableFuture<SessionOutcome> getTermination() {
        return termination;
    }

    public void stop(StopReason reason) {
        if (session.isClosing() || session.getState().isTerminal()) {
            logger.debug("Already stopping, ignoring stop request ({})", reason);
            return;
        }
        logger.info("Stopping session ({})", reason);
        session.setClosing(true);
        session.setStopReason(reason);
        session.cancelReconnectTimer();

        SessionState state = session.getState();
        if (state == SessionState.DISCONNECTED && session.getConnection() == null) {
            finish(false);
            return;
        }

        if (!shutdownTimeout.isZero()) {
            shutdownTimer = executor.schedule(this::forceClose, shutdownTimeout);
        }
        session.transition(SessionState.STOPPING);

        switch (state) {
            case READY:
                role.beginShutdown(this::closeChannel);
                break;
            case CHANNEL_OPENING:
            case TOPOLOGY_PENDING:
                closeChannel();
                break;
            default:
                closeConnection();
                break;
        }
    }

    /**
     * The role is quiet; close the channel or, if it is already gone, the connection.
     */
    void closeChannel() {
        if (session.getState() != SessionState.STOPPING) {
            return;
        }
        TransportChannel channel = session.getChannel();
        if (channel == null) {
            closeConnection();
            return;
        }
        logger.debug("Closing the channel");
        channel.close();
    }

    /**
     * The channel finished closing during shutdown.
     */
    public void onChannelClosed() {
        session.setChannel(null);
        closeConnection();
    }

    /**
     * The connection finished closing, or failed, during shutdown.
     */
    public void onConnectionClosed() {
        session.setConnection(null);
        finish(false);
    }

    private void closeConnection() {
        TransportConnection connection = session.getConnection();
        if (connection == null) {
            finish(false);
            return;
        }
        logger.debug("Closing connection");
        connection.close();
    }

    private void forceClose() {
        shutdownTimer = null;
        if (session.getState().isTerminal()) {
            return;
        }
        logger.warn("Shutdown did not complete within {} ms, forcing close", shutdownTimeout.toMillis());
        TransportConnection connection = session.getConnection();
        if (connection != null) {
            connection.close();
        }
        finish(true);
    }

    private void finish(boolean forced) {
        if (session.getState().isTerminal()) {
            return;
        }
        if (shutdownTimer != null) {
            shutdownTimer.cancel();
            shutdownTimer = null;
        }
        session.transition(SessionState.CLOSED);

        StopReason reason = session.getStopReason();
        DeliveryRecord record = session.getRecord().snapshot();
        SessionOutcome.Result result = reason != null && reason.isFailure()
                ? SessionOutcome.Result.FAILED
                : SessionOutcome.Result.COMPLETED;
        logger.info("Session closed: published {}, acked {}, nacked {}, received {}, duplicates {}",
                record.getPublished(), record.getAcked(), record.getNacked(),
                record.getReceived(), record.getDuplicates());
        termination.complete(new SessionOutcome(result, reason, forced, record));
    }
}
