package com.amqpclient.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable broker connection parameters. Built once from {@link ClientConfig}
 * and reused for every reconnect.
 */
public final class ConnectionConfig {

    public enum Scheme {
        /** amqp:// with username/password credentials */
        PLAIN,
        /** amqps:// with mutual TLS and SASL EXTERNAL */
        SECURED
    }

    public static final int DEFAULT_PLAIN_ATTEMPTS = 100;
    public static final int DEFAULT_SECURED_ATTEMPTS = 10;
    public static final int DEFAULT_HEARTBEAT_SECONDS = 3600;
    public static final int DEFAULT_SOCKET_TIMEOUT_MILLIS = 5000;
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(20);
    public static final String DEFAULT_TLS_PROTOCOL = "TLSv1.2";

    private final Scheme scheme;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String virtualHost;
    private final Path caCertPath;
    private final Path clientCertPath;
    private final Path clientKeyPath;
    private final String tlsProtocol;
    private final int connectionAttempts;
    private final int heartbeatSeconds;
    private final int socketTimeoutMillis;
    private final Duration reconnectDelay;

    private ConnectionConfig(Builder builder) {
        this.scheme = builder.scheme;
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.virtualHost = builder.virtualHost;
        this.caCertPath = builder.caCertPath;
        this.clientCertPath = builder.clientCertPath;
        this.clientKeyPath = builder.clientKeyPath;
        this.tlsProtocol = builder.tlsProtocol;
        this.connectionAttempts = builder.connectionAttempts > 0
                ? builder.connectionAttempts
                : (builder.scheme == Scheme.SECURED ? DEFAULT_SECURED_ATTEMPTS : DEFAULT_PLAIN_ATTEMPTS);
        this.heartbeatSeconds = builder.heartbeatSeconds;
        this.socketTimeoutMillis = builder.socketTimeoutMillis;
        this.reconnectDelay = builder.reconnectDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(BrokerUrl url) {
        return new Builder()
                .scheme(url.getScheme())
                .host(url.getHost())
                .port(url.getPort())
                .credentials(url.getUsername(), url.getPassword())
                .virtualHost(url.getVirtualHost());
    }

    /**
     * Lists the certificate files a secured connection needs but cannot find.
     * Empty for plain connections.
     */
    public List<Path> missingCertificates() {
        List<Path> missing = new ArrayList<>();
        if (scheme != Scheme.SECURED) {
            return missing;
        }
        for (Path path : new Path[] {caCertPath, clientCertPath, clientKeyPath}) {
            if (path == null || !Files.isRegularFile(path)) {
                missing.add(path);
            }
        }
        return missing;
    }

    /**
     * Fails fast when a secured connection lacks any of its certificate files.
     */
    public void validate() {
        List<Path> missing = missingCertificates();
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Certificate material does not exist: " + missing);
        }
    }

    public Scheme getScheme() {
        return scheme;
    }

    public boolean isSecured() {
        return scheme == Scheme.SECURED;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public Path getCaCertPath() {
        return caCertPath;
    }

    public Path getClientCertPath() {
        return clientCertPath;
    }

    public Path getClientKeyPath() {
        return clientKeyPath;
    }

    public String getTlsProtocol() {
        return tlsProtocol;
    }

    public int getConnectionAttempts() {
        return connectionAttempts;
    }

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public int getSocketTimeoutMillis() {
        return socketTimeoutMillis;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public String describe() {
        return (isSecured() ? "amqps" : "amqp") + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return String.format("ConnectionConfig{target=%s, vhost='%s', attempts=%d, heartbeat=%ds, reconnectDelay=%s}",
                describe(), virtualHost, connectionAttempts, heartbeatSeconds, reconnectDelay);
    }

    public static class Builder {
        private Scheme scheme = Scheme.PLAIN;
        private String host = "localhost";
        private int port = 5672;
        private String username;
        private String password;
        private String virtualHost = BrokerUrl.DEFAULT_VHOST;
        private Path caCertPath;
        private Path clientCertPath;
        private Path clientKeyPath;
        private String tlsProtocol = DEFAULT_TLS_PROTOCOL;
        private int connectionAttempts;
        private int heartbeatSeconds = DEFAULT_HEARTBEAT_SECONDS;
        private int socketTimeoutMillis = DEFAULT_SOCKET_TIMEOUT_MILLIS;
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;

        public Builder scheme(Scheme scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder virtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder certificates(Path caCert, Path clientCert, Path clientKey) {
            this.caCertPath = caCert;
            this.clientCertPath = clientCert;
            this.clientKeyPath = clientKey;
            return this;
        }

        public Builder tlsProtocol(String tlsProtocol) {
            this.tlsProtocol = tlsProtocol;
            return this;
        }

        public Builder connectionAttempts(int attempts) {
            this.connectionAttempts = attempts;
            return this;
        }

        public Builder heartbeatSeconds(int seconds) {
            this.heartbeatSeconds = seconds;
            return this;
        }

        public Builder socketTimeoutMillis(int millis) {
            this.socketTimeoutMillis = millis;
            return this;
        }

        public Builder reconnectDelay(Duration delay) {
            this.reconnectDelay = delay;
            return this;
        }

        public ConnectionConfig build() {
            if (host == null || host.isEmpty()) {
                throw new ConfigurationException("Broker host is required");
            }
            if (reconnectDelay == null || reconnectDelay.isNegative()) {
                throw new ConfigurationException("Reconnect delay must not be negative");
            }
            return new ConnectionConfig(this);
        }
    }
}
