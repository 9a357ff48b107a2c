package com.amqpclient;

import ch.qos.logback.classic.Level;
import com.amqpclient.config.ClientConfig;
import com.amqpclient.config.ClientRole;
import com.amqpclient.config.ConfigurationException;
import com.amqpclient.config.ConnectionConfig;
import com.amqpclient.config.TopologyConfig;
import com.amqpclient.session.AmqpSession;
import com.amqpclient.session.SessionOutcome;
import com.amqpclient.session.SessionSettings;
import com.amqpclient.session.StopReason;
import com.amqpclient.transport.rabbit.RabbitTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class AmqpClientApplication {
    private static final Logger logger = LoggerFactory.getLogger(AmqpClientApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String CLIENT_NAME = "amqp-session-client";
    private static final long SHUTDOWN_HOOK_GRACE_MILLIS = 1000;

    private static volatile boolean interrupted = false;

    public static void main(String[] args) {
        int status = run(args);
        // System.exit blocks forever when called while shutdown hooks run
        if (!interrupted) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        ClientConfig config;
        try {
            config = parseArguments(args, new ClientConfig());
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            printUsage();
            return EXIT_USAGE;
        } catch (ConfigurationException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FAILURE;
        }
        if (config == null) {
            return EXIT_OK;
        }
        if (config.isVerbose()) {
            enableDebugLogging();
        }

        ConnectionConfig connectionConfig;
        TopologyConfig topologyConfig;
        SessionSettings settings;
        try {
            connectionConfig = config.toConnectionConfig();
            topologyConfig = config.toTopologyConfig();
            settings = config.toSessionSettings();
            connectionConfig.validate();
        } catch (ConfigurationException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FAILURE;
        }

        if (config.getRole() == ClientRole.PUBLISHER && settings.getMaxMessages() == 0) {
            logger.info("Nothing to send, max messages is 0");
            return EXIT_OK;
        }

        logger.info("Configuration: {}", config.toMap());
        logger.debug("{}", connectionConfig);
        logger.debug("{}", topologyConfig);

        Instant start = Instant.now();
        try (AmqpSession session = new AmqpSession(connectionConfig, topologyConfig, settings,
                new RabbitTransport(CLIENT_NAME))) {
            CompletableFuture<SessionOutcome> termination = session.start();

            long hookTimeoutMillis = settings.getShutdownTimeout().toMillis() + SHUTDOWN_HOOK_GRACE_MILLIS;
            Thread shutdownHook = new Thread(() -> {
                interrupted = true;
                logger.info("Interrupted, shutting down");
                session.stop(StopReason.INTERRUPTED);
                SessionOutcome outcome = awaitQuietly(termination, hookTimeoutMillis);
                int hookStatus = outcome != null ? outcome.exitCode() : EXIT_FAILURE;
                logger.info("Exiting with status {}", hookStatus);
                // halt, unlike System.exit, does not wait for the running hooks
                Runtime.getRuntime().halt(hookStatus);
            }, "amqp-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            SessionOutcome outcome = termination.join();
            removeShutdownHook(shutdownHook);

            logger.info("Execution time: {} ms", Duration.between(start, Instant.now()).toMillis());
            if (outcome.isForced()) {
                logger.warn("Session did not close cleanly");
            }
            return outcome.exitCode();
        } catch (ConfigurationException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static ClientConfig parseArguments(String[] args, ClientConfig config) throws UsageException {
        // the config file goes first so that command-line options override it
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.loadFromFile(Paths.get(args[i + 1]));
            }
        }

        String command = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--broker":
                    config.setBrokerUrl(value(args, i++));
                    break;
                case "--exchange":
                    config.setExchange(value(args, i++));
                    break;
                case "--queue":
                    config.setQueue(value(args, i++));
                    break;
                case "--topic":
                    config.setTopic(value(args, i++));
                    break;
                case "--max-messages":
                    config.setMaxMessages(number(args, i++));
                    break;
                case "--persistent":
                    config.setPersistent(true);
                    break;
                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;
                case "--ca-cert":
                    config.setCaCertPath(value(args, i++));
                    break;
                case "--client-cert":
                    config.setClientCertPath(value(args, i++));
                    break;
                case "--client-key":
                    config.setClientKeyPath(value(args, i++));
                    break;
                case "--publish-interval":
                    config.setPublishIntervalMillis(number(args, i++));
                    break;
                case "--reconnect-delay":
                    config.setReconnectDelayMillis(number(args, i++));
                    break;
                case "--connection-attempts":
                    config.setConnectionAttempts((int) number(args, i++));
                    break;
                case "--auto-delete":
                    config.setAutoDelete(true);
                    break;
                case "--exchange-exists":
                    config.setExchangeExists(true);
                    break;
                case "--config":
                    value(args, i++);
                    break;
                case "--help":
                case "-h":
                    printUsage();
                    return null;
                default:
                    if (args[i].startsWith("-")) {
                        throw new UsageException("Unknown option: " + args[i]);
                    }
                    if (command != null) {
                        throw new UsageException("Unexpected argument: " + args[i]);
                    }
                    command = args[i];
            }
        }

        if (command == null) {
            throw new UsageException("Missing command: publish or consume");
        }
        try {
            config.setRole(ClientRole.fromCommand(command));
        } catch (ConfigurationException e) {
            throw new UsageException(e.getMessage());
        }
        return config;
    }

    private static String value(String[] args, int i) throws UsageException {
        if (i + 1 >= args.length) {
            throw new UsageException("Option " + args[i] + " needs a value");
        }
        return args[i + 1];
    }

    private static long number(String[] args, int i) throws UsageException {
        String value = value(args, i);
        try {
            long number = Long.parseLong(value);
            if (number < 0) {
                throw new UsageException("Option " + args[i] + " must not be negative: " + value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new UsageException("Option " + args[i] + " expects a number: " + value);
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    private static SessionOutcome awaitQuietly(CompletableFuture<SessionOutcome> termination, long timeoutMillis) {
        try {
            return termination.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the session to close");
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Session did not close within {} ms: {}", timeoutMillis, e.toString());
        }
        return null;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM shutdown already in progress");
        }
    }

    private static void printUsage() {
        System.out.println("AMQP session client - publish or consume with confirms and reconnects");
        System.out.println();
        System.out.println("Usage: java -jar amqp-session-client.jar publish|consume [OPTIONS]");
        System.out.println();
        System.out.println("Routing Options:");
        System.out.println("  --broker URL              Broker URL, amqp:// or amqps:// (default: amqp://localhost:5672)");
        System.out.println("  --exchange NAME           Exchange name (default: the queue or topic name)");
        System.out.println("  --queue NAME              Queue to publish to or consume from (direct exchange)");
        System.out.println("  --topic NAME              Topic routing key (topic exchange)");
        System.out.println("  --auto-delete             Declare the queue auto-delete");
        System.out.println("  --exchange-exists         Do not declare the exchange");
        System.out.println();
        System.out.println("Message Options:");
        System.out.println("  --max-messages N          Messages to send or receive, 0 = unbounded consume (default: 100)");
        System.out.println("  --persistent              Publish with delivery mode 2");
        System.out.println("  --publish-interval MS     Delay between publishes (default: 0)");
        System.out.println();
        System.out.println("Connection Options:");
        System.out.println("  --reconnect-delay MS      Delay before reconnecting (default: 20000)");
        System.out.println("  --connection-attempts N   Consecutive failed attempts before giving up");
        System.out.println("  --ca-cert PATH            CA bundle for amqps (default: " + ClientConfig.DEFAULT_CA_CERT + ")");
        System.out.println("  --client-cert PATH        Client certificate (default: " + ClientConfig.DEFAULT_CLIENT_CERT + ")");
        System.out.println("  --client-key PATH         Client private key (default: " + ClientConfig.DEFAULT_CLIENT_KEY + ")");
        System.out.println();
        System.out.println("Other Options:");
        System.out.println("  --config FILE             Properties file with the same settings");
        System.out.println("  --verbose, -v             Debug logging");
        System.out.println("  --help, -h                Show this help message");
        System.out.println();
        System.out.println("Environment Variables:");
        System.out.println("  AMQP_BROKER_URL, AMQP_RECONNECT_DELAY_MS, AMQP_PUBLISH_INTERVAL_MS,");
        System.out.println("  AMQP_CA_CERT, AMQP_CLIENT_CERT, AMQP_CLIENT_KEY");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar amqp-session-client.jar publish --queue test --max-messages 10");
        System.out.println("  java -jar amqp-session-client.jar consume --broker amqps://broker:5671 --topic events");
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
