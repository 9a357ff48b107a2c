package com.amqpclient.config;

import com.amqpclient.session.SessionSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Mutable client settings collected from defaults, a properties file,
 * environment variables and command-line options, in that order of
 * precedence. Converted into the immutable {@link ConnectionConfig},
 * {@link TopologyConfig} and {@link SessionSettings} before the session starts.
 */
public class ClientConfig {

    public static final String CLASSPATH_PROPERTIES = "amqp-client.properties";

    public static final String DEFAULT_CA_CERT = "/mnt/ssl/ca/cacert.pem";
    public static final String DEFAULT_CLIENT_CERT = "/mnt/ssl/client/cert.pem";
    public static final String DEFAULT_CLIENT_KEY = "/mnt/ssl/client/key.pem";

    // Routing
    private ClientRole role = ClientRole.PUBLISHER;
    private String brokerUrl = BrokerUrl.DEFAULT_URL;
    private String exchange;
    private String queue;
    private String topic;
    private boolean autoDelete = false;
    private boolean exchangeExists = false;

    // Message flow
    private long maxMessages = SessionSettings.DEFAULT_MAX_MESSAGES;
    private boolean persistent = false;
    private boolean verbose = false;
    private long publishIntervalMillis = SessionSettings.DEFAULT_PUBLISH_INTERVAL.toMillis();
    private long confirmDrainTimeoutMillis = SessionSettings.DEFAULT_CONFIRM_DRAIN_TIMEOUT.toMillis();
    private long shutdownTimeoutMillis = SessionSettings.DEFAULT_SHUTDOWN_TIMEOUT.toMillis();
    private int dedupWindow = SessionSettings.DEFAULT_DEDUP_WINDOW;
    private String appId = SessionSettings.DEFAULT_APP_ID;

    // Connection
    private long reconnectDelayMillis = ConnectionConfig.DEFAULT_RECONNECT_DELAY.toMillis();
    private int connectionAttempts = 0; // 0 = scheme default
    private int heartbeatSeconds = ConnectionConfig.DEFAULT_HEARTBEAT_SECONDS;
    private int socketTimeoutMillis = ConnectionConfig.DEFAULT_SOCKET_TIMEOUT_MILLIS;

    // TLS material
    private String caCertPath = DEFAULT_CA_CERT;
    private String clientCertPath = DEFAULT_CLIENT_CERT;
    private String clientKeyPath = DEFAULT_CLIENT_KEY;

    public ClientConfig() {
        loadFromClasspath();
        loadFromEnvironment(System.getenv());
    }

    private void loadFromClasspath() {
        try (InputStream in = ClientConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_PROPERTIES)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                loadFromProperties(properties);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + CLASSPATH_PROPERTIES, e);
        }
    }

    /**
     * Load configuration from environment variables.
     */
    void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("AMQP_BROKER_URL")) {
            brokerUrl = env.get("AMQP_BROKER_URL");
        }
        if (env.containsKey("AMQP_RECONNECT_DELAY_MS")) {
            reconnectDelayMillis = parseLong("AMQP_RECONNECT_DELAY_MS", env.get("AMQP_RECONNECT_DELAY_MS"));
        }
        if (env.containsKey("AMQP_PUBLISH_INTERVAL_MS")) {
            publishIntervalMillis = parseLong("AMQP_PUBLISH_INTERVAL_MS", env.get("AMQP_PUBLISH_INTERVAL_MS"));
        }
        if (env.containsKey("AMQP_CA_CERT")) {
            caCertPath = env.get("AMQP_CA_CERT");
        }
        if (env.containsKey("AMQP_CLIENT_CERT")) {
            clientCertPath = env.get("AMQP_CLIENT_CERT");
        }
        if (env.containsKey("AMQP_CLIENT_KEY")) {
            clientKeyPath = env.get("AMQP_CLIENT_KEY");
        }
    }

    /**
     * Load configuration from a properties file on disk.
     */
    public void loadFromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file does not exist: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            Properties properties = new Properties();
            properties.load(in);
            loadFromProperties(properties);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file, e);
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("broker.url")) {
            brokerUrl = properties.getProperty("broker.url");
        }
        if (properties.containsKey("exchange")) {
            exchange = properties.getProperty("exchange");
        }
        if (properties.containsKey("queue")) {
            queue = properties.getProperty("queue");
        }
        if (properties.containsKey("topic")) {
            topic = properties.getProperty("topic");
        }
        if (properties.containsKey("max.messages")) {
            maxMessages = parseLong("max.messages", properties.getProperty("max.messages"));
        }
        if (properties.containsKey("persistent")) {
            persistent = Boolean.parseBoolean(properties.getProperty("persistent"));
        }
        if (properties.containsKey("publish.interval.ms")) {
            publishIntervalMillis = parseLong("publish.interval.ms", properties.getProperty("publish.interval.ms"));
        }
        if (properties.containsKey("reconnect.delay.ms")) {
            reconnectDelayMillis = parseLong("reconnect.delay.ms", properties.getProperty("reconnect.delay.ms"));
        }
        if (properties.containsKey("connection.attempts")) {
            connectionAttempts = (int) parseLong("connection.attempts", properties.getProperty("connection.attempts"));
        }
        if (properties.containsKey("heartbeat.seconds")) {
            heartbeatSeconds = (int) parseLong("heartbeat.seconds", properties.getProperty("heartbeat.seconds"));
        }
        if (properties.containsKey("socket.timeout.ms")) {
            socketTimeoutMillis = (int) parseLong("socket.timeout.ms", properties.getProperty("socket.timeout.ms"));
        }
        if (properties.containsKey("confirm.drain.timeout.ms")) {
            confirmDrainTimeoutMillis = parseLong("confirm.drain.timeout.ms", properties.getProperty("confirm.drain.timeout.ms"));
        }
        if (properties.containsKey("shutdown.timeout.ms")) {
            shutdownTimeoutMillis = parseLong("shutdown.timeout.ms", properties.getProperty("shutdown.timeout.ms"));
        }
        if (properties.containsKey("dedup.window")) {
            dedupWindow = (int) parseLong("dedup.window", properties.getProperty("dedup.window"));
        }
        if (properties.containsKey("queue.auto-delete")) {
            autoDelete = Boolean.parseBoolean(properties.getProperty("queue.auto-delete"));
        }
        if (properties.containsKey("app.id")) {
            appId = properties.getProperty("app.id");
        }
        if (properties.containsKey("tls.ca-cert")) {
            caCertPath = properties.getProperty("tls.ca-cert");
        }
        if (properties.containsKey("tls.client-cert")) {
            clientCertPath = properties.getProperty("tls.client-cert");
        }
        if (properties.containsKey("tls.client-key")) {
            clientKeyPath = properties.getProperty("tls.client-key");
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Setting " + key + " is not a number: " + value, e);
        }
    }

    public ConnectionConfig toConnectionConfig() {
        BrokerUrl url = BrokerUrl.parse(brokerUrl);
        if (reconnectDelayMillis < 0) {
            throw new ConfigurationException("Reconnect delay must not be negative: " + reconnectDelayMillis);
        }
        ConnectionConfig.Builder builder = ConnectionConfig.builder(url)
                .connectionAttempts(connectionAttempts)
                .heartbeatSeconds(heartbeatSeconds)
                .socketTimeoutMillis(socketTimeoutMillis)
                .reconnectDelay(Duration.ofMillis(reconnectDelayMillis));
        if (url.isSecured()) {
            builder.certificates(toPath(caCertPath), toPath(clientCertPath), toPath(clientKeyPath));
        }
        return builder.build();
    }

    public TopologyConfig toTopologyConfig() {
        TopologyConfig.Builder builder = role == ClientRole.PUBLISHER
                ? TopologyConfig.forPublisher(queue, topic, exchange)
                : TopologyConfig.forConsumer(queue, topic, exchange);
        return builder
                .queueAutoDelete(autoDelete)
                .exchangeAssumedToExist(exchangeExists)
                .build();
    }

    public SessionSettings toSessionSettings() {
        if (publishIntervalMillis < 0) {
            throw new ConfigurationException("Publish interval must not be negative: " + publishIntervalMillis);
        }
        try {
            return SessionSettings.builder()
                    .maxMessages(maxMessages)
                    .persistent(persistent)
                    .publishInterval(Duration.ofMillis(publishIntervalMillis))
                    .confirmDrainTimeout(Duration.ofMillis(Math.max(0, confirmDrainTimeoutMillis)))
                    .shutdownTimeout(Duration.ofMillis(Math.max(0, shutdownTimeoutMillis)))
                    .dedupWindow(dedupWindow)
                    .appId(appId)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static Path toPath(String path) {
        return path == null || path.isEmpty() ? null : Paths.get(path);
    }

    /**
     * Export configuration as a map, without credentials.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("role", role);
        map.put("broker", BrokerUrl.redact(brokerUrl));
        map.put("exchange", exchange);
        map.put("queue", queue);
        map.put("topic", topic);
        map.put("maxMessages", maxMessages);
        map.put("persistent", persistent);
        map.put("publishIntervalMillis", publishIntervalMillis);
        map.put("reconnectDelayMillis", reconnectDelayMillis);
        return map;
    }

    // Getters and setters

    public ClientRole getRole() {
        return role;
    }

    public void setRole(ClientRole role) {
        this.role = role;
    }

    public String getBrokerUrl() {
        return brokerUrl;
    }

    public void setBrokerUrl(String brokerUrl) {
        this.brokerUrl = brokerUrl;
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public void setAutoDelete(boolean autoDelete) {
        this.autoDelete = autoDelete;
    }

    public boolean isExchangeExists() {
        return exchangeExists;
    }

    public void setExchangeExists(boolean exchangeExists) {
        this.exchangeExists = exchangeExists;
    }

    public long getMaxMessages() {
        return maxMessages;
    }

    public void setMaxMessages(long maxMessages) {
        this.maxMessages = maxMessages;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public long getPublishIntervalMillis() {
        return publishIntervalMillis;
    }

    public void setPublishIntervalMillis(long publishIntervalMillis) {
        this.publishIntervalMillis = publishIntervalMillis;
    }

    public long getReconnectDelayMillis() {
        return reconnectDelayMillis;
    }

    public void setReconnectDelayMillis(long reconnectDelayMillis) {
        this.reconnectDelayMillis = reconnectDelayMillis;
    }

    public int getConnectionAttempts() {
        return connectionAttempts;
    }

    public void setConnectionAttempts(int connectionAttempts) {
        this.connectionAttempts = connectionAttempts;
    }

    public String getCaCertPath() {
        return caCertPath;
    }

    public void setCaCertPath(String caCertPath) {
        this.caCertPath = caCertPath;
    }

    public String getClientCertPath() {
        return clientCertPath;
    }

    public void setClientCertPath(String clientCertPath) {
        this.clientCertPath = clientCertPath;
    }

    public String getClientKeyPath() {
        return clientKeyPath;
    }

    public void setClientKeyPath(String clientKeyPath) {
        this.clientKeyPath = clientKeyPath;
    }

    @Override
    public String toString() {
        return String.format("ClientConfig{role=%s, broker=%s, exchange=%s, queue=%s, topic=%s, maxMessages=%d}",
                role, BrokerUrl.redact(brokerUrl), exchange, queue, topic, maxMessages);
    }
}
