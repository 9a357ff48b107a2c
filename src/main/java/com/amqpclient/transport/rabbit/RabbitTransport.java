package com.amqpclient.transport.rabbit;

import com.amqpclient.config.ConnectionConfig;
import com.amqpclient.security.tls.TlsContextFactory;
import com.amqpclient.transport.AmqpTransport;
import com.amqpclient.transport.TransportConnection;
import com.amqpclient.transport.TransportEventSink;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultSaslConfig;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link AmqpTransport} on top of the RabbitMQ Java client.
 *
 * The client's calls block, so each connection gets one I/O thread that runs
 * them in submission order. Automatic recovery is off; reconnecting is the
 * session's job.
 */
public class RabbitTransport implements AmqpTransport {
    private static final Logger logger = LoggerFactory.getLogger(RabbitTransport.class);

    private final String clientName;
    private final AtomicInteger connectionCount = new AtomicInteger();

    public RabbitTransport(String clientName) {
        this.clientName = clientName;
    }

    @Override
    public TransportConnection connect(ConnectionConfig config, TransportEventSink sink) {
        int number = connectionCount.incrementAndGet();
        ExecutorService io = Executors.newSingleThreadExecutor(new DefaultThreadFactory("amqp-io", true));
        RabbitConnection connection = new RabbitConnection(io, sink);
        logger.debug("Opening connection #{} to {}", number, config.describe());
        io.execute(() -> connection.open(config, clientName + "-" + number));
        return connection;
    }

    static ConnectionFactory newConnectionFactory(ConnectionConfig config) throws SSLException {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setVirtualHost(config.getVirtualHost());
        factory.setRequestedHeartbeat(config.getHeartbeatSeconds());
        factory.setConnectionTimeout(config.getSocketTimeoutMillis());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        if (config.isSecured()) {
            factory.useSslProtocol(new TlsContextFactory(config).buildSslContext());
            factory.setSaslConfig(DefaultSaslConfig.EXTERNAL);
        } else if (config.getUsername() != null) {
            factory.setUsername(config.getUsername());
            factory.setPassword(config.getPassword() != null ? config.getPassword() : "");
        }
        return factory;
    }
}
