package com.amqpclient.config;

public enum ClientRole {
    PUBLISHER,
    CONSUMER;

    public static ClientRole fromCommand(String command) {
        switch (command.toLowerCase()) {
            case "publish":
            case "publisher":
            case "send":
                return PUBLISHER;
            case "consume":
            case "consumer":
            case "receive":
                return CONSUMER;
            default:
                throw new ConfigurationException("Unknown role: " + command + " (expected publish or consume)");
        }
    }
}
