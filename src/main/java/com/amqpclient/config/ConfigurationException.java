package com.amqpclient.config;

/**
 * Invalid or incomplete client configuration. Always raised before any
 * connection attempt is made.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
