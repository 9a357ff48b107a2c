package com.amqpclient.transport.rabbit;

import com.amqpclient.config.ConnectionConfig;
import com.amqpclient.transport.CloseReason;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportConnection;
import com.amqpclient.transport.TransportEvent;
import com.amqpclient.transport.TransportEventSink;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

class RabbitConnection implements TransportConnection {
    private static final Logger logger = LoggerFactory.getLogger(RabbitConnection.class);

    @FunctionalInterface
    interface IoTask {
        void run() throws IOException, TimeoutException;
    }

    private final ExecutorService io;
    private final TransportEventSink sink;
    private final AtomicBoolean terminated = new AtomicBoolean();
    private volatile Connection delegate;

    RabbitConnection(ExecutorService io, TransportEventSink sink) {
        this.io = io;
        this.sink = sink;
    }

    void open(ConnectionConfig config, String clientProvidedName) {
        Connection connection;
        try {
            connection = RabbitTransport.newConnectionFactory(config).newConnection(clientProvidedName);
        } catch (IOException | TimeoutException | RuntimeException e) {
            logger.debug("Connection to {} failed", config.describe(), e);
            terminate(TransportEvent.connectionFailed(this, e));
            return;
        }
        delegate = connection;
        connection.addShutdownListener(cause ->
                terminate(TransportEvent.connectionClosed(this, RabbitCloseReasons.from(cause))));
        sink.post(TransportEvent.connectionOpened(this));
    }

    @Override
    public TransportChannel openChannel() {
        RabbitChannel channel = new RabbitChannel(this, sink);
        submit("Channel.Open", () -> {
            Channel created = connection().createChannel();
            if (created == null) {
                sink.post(TransportEvent.channelClosed(channel,
                        CloseReason.failure(new IOException("No channel number available"))));
                return;
            }
            channel.open(created);
        });
        return channel;
    }

    @Override
    public void close() {
        submit("Connection.Close", () -> {
            Connection connection = delegate;
            if (connection != null && connection.isOpen()) {
                connection.close();
            }
        });
    }

    @Override
    public boolean isOpen() {
        Connection connection = delegate;
        return connection != null && connection.isOpen();
    }

    /**
     * Runs {@code task} on this connection's I/O thread. Failures are only
     * logged: a broken connection or channel reports itself through its
     * shutdown listener.
     */
    void submit(String operation, IoTask task) {
        try {
            io.execute(() -> {
                try {
                    task.run();
                } catch (IOException | TimeoutException | ShutdownSignalException e) {
                    logger.debug("{} failed: {}", operation, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("{} dropped, connection already terminated", operation);
        }
    }

    private Connection connection() throws IOException {
        Connection connection = delegate;
        if (connection == null) {
            throw new IOException("Connection is not open");
        }
        return connection;
    }

    private void terminate(TransportEvent event) {
        if (terminated.compareAndSet(false, true)) {
            sink.post(event);
            io.shutdown();
        }
    }
}
