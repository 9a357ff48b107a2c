package com.amqpclient.model;

/**
 * Exchange types used by the client. A queue target routes through a direct
 * exchange, a topic target through a topic exchange.
 */
public enum ExchangeKind {
    DIRECT("direct"),
    TOPIC("topic");

    private final String type;

    ExchangeKind(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public static ExchangeKind fromType(String type) {
        for (ExchangeKind kind : values()) {
            if (kind.type.equalsIgnoreCase(type)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported exchange type: " + type);
    }
}
