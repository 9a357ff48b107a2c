package com.amqpclient.integration;

import com.amqpclient.config.BrokerUrl;
import com.amqpclient.config.ConnectionConfig;
import com.amqpclient.config.TopologyConfig;
import com.amqpclient.session.AmqpSession;
import com.amqpclient.session.SessionOutcome;
import com.amqpclient.session.SessionSettings;
import com.amqpclient.session.StopReason;
import com.amqpclient.transport.rabbit.RabbitTransport;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Publish and consume round trips against a real RabbitMQ broker.
 */
@DisplayName("RabbitMQ session round trips")
@Tag("docker")
class RabbitSessionIntegrationTest {

    private static final Logger log = LoggerFactory.getLogger(RabbitSessionIntegrationTest.class);
    private static final int TIMEOUT_SECONDS = 60;
    private static final Duration AWAIT = Duration.ofSeconds(30);

    private static RabbitMQContainer broker;

    @BeforeAll
    static void startBroker() {
        Assumptions.assumeTrue(isDockerAvailable(), "Docker is not available - skipping broker round trips");
        broker = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.13-alpine"));
        broker.start();
    }

    @AfterAll
    static void stopBroker() {
        if (broker != null) {
            broker.stop();
        }
    }

    private static boolean isDockerAvailable() {
        try {
            DockerClientFactory.instance().client();
            return true;
        } catch (Exception e) {
            log.warn("Docker is not available: {}", e.getMessage());
            return false;
        }
    }

    private static ConnectionConfig connectionConfig() {
        String url = "amqp://" + broker.getAdminUsername() + ":" + broker.getAdminPassword()
                + "@" + broker.getHost() + ":" + broker.getAmqpPort();
        return ConnectionConfig.builder(BrokerUrl.parse(url))
                .reconnectDelay(Duration.ofMillis(200))
                .connectionAttempts(3)
                .build();
    }

    @Test
    @Timeout(TIMEOUT_SECONDS)
    @DisplayName("Published messages are confirmed and consumed once each")
    void testPublishThenConsume() throws Exception {
        SessionSettings publishSettings = SessionSettings.builder().maxMessages(20).persistent(true).build();
        SessionOutcome published;
        try (AmqpSession publisher = new AmqpSession(connectionConfig(),
                TopologyConfig.forPublisher("roundtrip", null, null).build(), publishSettings,
                new RabbitTransport("it-publisher"))) {
            publisher.start();
            published = publisher.awaitTermination(AWAIT);
        }

        assertThat(published.getResult()).isEqualTo(SessionOutcome.Result.COMPLETED);
        assertThat(published.getStopReason()).isEqualTo(StopReason.QUOTA_REACHED);
        assertThat(published.getRecord().getPublished()).isEqualTo(20);
        assertThat(published.getRecord().getAcked()).isEqualTo(20);

        SessionSettings consumeSettings = SessionSettings.builder().maxMessages(20).build();
        SessionOutcome consumed;
        try (AmqpSession consumer = new AmqpSession(connectionConfig(),
                TopologyConfig.forConsumer("roundtrip", null, null).build(), consumeSettings,
                new RabbitTransport("it-consumer"))) {
            consumer.start();
            consumed = consumer.awaitTermination(AWAIT);
        }

        assertThat(consumed.exitCode()).isZero();
        assertThat(consumed.getRecord().getReceived()).isEqualTo(20);
        assertThat(consumed.getRecord().getDuplicates()).isZero();
    }

    @Test
    @Timeout(TIMEOUT_SECONDS)
    @DisplayName("Conflicting exchange type is tolerated by reopening the channel")
    void testExistingExchangeOfAnotherKind() throws Exception {
        // a direct exchange named "events" makes the topic declaration fail with 406
        try (AmqpSession first = new AmqpSession(connectionConfig(),
                TopologyConfig.forPublisher("events", null, null).build(),
                SessionSettings.builder().maxMessages(1).build(), new RabbitTransport("it-direct"))) {
            first.start();
            assertThat(first.awaitTermination(AWAIT).exitCode()).isZero();
        }

        SessionOutcome outcome;
        try (AmqpSession second = new AmqpSession(connectionConfig(),
                TopologyConfig.forPublisher(null, "events", null).build(),
                SessionSettings.builder().maxMessages(3).build(), new RabbitTransport("it-topic"))) {
            second.start();
            outcome = second.awaitTermination(AWAIT);
        }

        assertThat(outcome.getStopReason()).isEqualTo(StopReason.QUOTA_REACHED);
        assertThat(outcome.getRecord().getAcked()).isEqualTo(3);
    }

    @Test
    @Timeout(TIMEOUT_SECONDS)
    @DisplayName("Unreachable broker exhausts the attempt budget")
    void testUnreachableBroker() throws Exception {
        ConnectionConfig unreachable = ConnectionConfig.builder(BrokerUrl.parse("amqp://127.0.0.1:1"))
                .reconnectDelay(Duration.ofMillis(50))
                .connectionAttempts(2)
                .build();

        SessionOutcome outcome;
        try (AmqpSession session = new AmqpSession(unreachable,
                TopologyConfig.forPublisher("nowhere", null, null).build(),
                SessionSettings.builder().maxMessages(1).build(), new RabbitTransport("it-unreachable"))) {
            session.start();
            outcome = session.awaitTermination(AWAIT);
        }

        assertThat(outcome.getStopReason()).isEqualTo(StopReason.RECONNECT_EXHAUSTED);
        assertThat(outcome.exitCode()).isEqualTo(1);
    }
}
