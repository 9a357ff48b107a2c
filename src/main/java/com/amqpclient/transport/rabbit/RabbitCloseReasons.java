package com.amqpclient.transport.rabbit;

import com.amqpclient.transport.CloseReason;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

final class RabbitCloseReasons {

    private RabbitCloseReasons() {
    }

    /**
     * Maps a client shutdown signal to the reply code and text the peer sent.
     * Signals without a close method (socket errors, missed heartbeats) carry
     * reply code 0 and their cause.
     */
    static CloseReason from(ShutdownSignalException signal) {
        Method reason = signal.getReason();
        boolean byApplication = signal.isInitiatedByApplication();
        if (reason instanceof AMQP.Channel.Close) {
            AMQP.Channel.Close close = (AMQP.Channel.Close) reason;
            return new CloseReason(close.getReplyCode(), close.getReplyText(), byApplication, null);
        }
        if (reason instanceof AMQP.Connection.Close) {
            AMQP.Connection.Close close = (AMQP.Connection.Close) reason;
            return new CloseReason(close.getReplyCode(), close.getReplyText(), byApplication, null);
        }
        Throwable cause = signal.getCause() != null ? signal.getCause() : signal;
        return new CloseReason(0, String.valueOf(cause.getMessage()), byApplication, cause);
    }
}
