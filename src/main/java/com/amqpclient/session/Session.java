package com.amqpclient.session;

import com.amqpclient.model.DeliveryRecord;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state shared by the session components. Only ever touched from the
 * session thread, so nothing here is synchronized.
 */
public class Session {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private SessionState state = SessionState.DISCONNECTED;
    private boolean closing;
    private TransportConnection connection;
    private TransportChannel channel;
    private boolean exchangeKnownToExist;
    private ScheduledTask reconnectTimer;
    private StopReason stopReason;
    private final DeliveryRecord record = new DeliveryRecord();

    public Session(boolean exchangeKnownToExist) {
        this.exchangeKnownToExist = exchangeKnownToExist;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transition(SessionState next) {
        if (state == next) {
            return;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid session transition " + state + " -> " + next);
        }
        logger.debug("Session state {} -> {}", state, next);
        state = next;
    }

    public boolean isClosing() {
        return closing;
    }

    public void setClosing(boolean closing) {
        this.closing = closing;
    }

    public TransportConnection getConnection() {
        return connection;
    }

    public void setConnection(TransportConnection connection) {
        this.connection = connection;
    }

    public TransportChannel getChannel() {
        return channel;
    }

    public void setChannel(TransportChannel channel) {
        this.channel = channel;
    }

    public boolean isCurrent(TransportConnection candidate) {
        return candidate != null && candidate == connection;
    }

    public boolean isCurrent(TransportChannel candidate) {
        return candidate != null && candidate == channel;
    }

    public boolean isExchangeKnownToExist() {
        return exchangeKnownToExist;
    }

    public void setExchangeKnownToExist(boolean exchangeKnownToExist) {
        this.exchangeKnownToExist = exchangeKnownToExist;
    }

    public void setReconnectTimer(ScheduledTask reconnectTimer) {
        this.reconnectTimer = reconnectTimer;
    }

    public boolean isReconnectPending() {
        return reconnectTimer != null;
    }

    public void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public void setStopReason(StopReason stopReason) {
        this.stopReason = stopReason;
    }

    public DeliveryRecord getRecord() {
        return record;
    }
}
