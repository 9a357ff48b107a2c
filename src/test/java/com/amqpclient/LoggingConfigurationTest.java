package com.amqpclient;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class LoggingConfigurationTest {

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private LoggerContext context;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        if (context != null) {
            context.stop();
        }
        System.setOut(originalOut);
    }

    @Test
    void testApplicationConfigPrintsMessageText() throws JoranException {
        Logger logger = configure("logback.xml").getLogger("com.amqpclient.publish.PublishTracker");

        logger.info("{} messages sent in {} ms ({}/s)", 5, 2000, 2.5);
        logger.warn("Reopening connection in {} ms", 20000);

        String[] lines = output().split("\\R");
        assertThat(lines).containsExactly(
                "[INFO] (" + Thread.currentThread().getName() + ") 5 messages sent in 2000 ms (2.5/s)",
                "[WARN] (" + Thread.currentThread().getName() + ") Reopening connection in 20000 ms");
    }

    @Test
    void testApplicationConfigQuietensClientLibraries() throws JoranException {
        LoggerContext configured = configure("logback.xml");

        configured.getLogger("com.rabbitmq.client.impl.AMQConnection").info("frame handler started");
        configured.getLogger("com.amqpclient.session.ShutdownCoordinator").info("Session closed");

        assertThat(output()).doesNotContain("frame handler started").contains("Session closed");
    }

    @Test
    void testTestConfigPrintsLoggerAndMessage() throws JoranException {
        Logger logger = configure("logback-test.xml").getLogger("com.amqpclient.session.ConnectionManager");

        logger.debug("Connection opened");

        assertThat(output()).isEqualTo("[DEBUG] (" + Thread.currentThread().getName()
                + ") ConnectionManager - Connection opened" + System.lineSeparator());
    }

    private LoggerContext configure(String resource) throws JoranException {
        URL config = getClass().getClassLoader().getResource(resource);
        assertThat(config).as(resource).isNotNull();

        context = new LoggerContext();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(config);
        return context;
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }
}
