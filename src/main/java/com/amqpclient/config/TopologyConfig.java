package com.amqpclient.config;

import com.amqpclient.model.ExchangeKind;

/**
 * Exchange, queue and binding the session declares on every fresh channel.
 *
 * A queue target routes through a direct exchange and a topic target through
 * a topic exchange. When no exchange name is given it defaults to the routing
 * key.
 */
public final class TopologyConfig {

    private final ClientRole role;
    private final String exchangeName;
    private final ExchangeKind exchangeKind;
    private final String queueName;
    private final String routingKey;
    private final boolean queueDurable;
    private final boolean queueExclusive;
    private final boolean queueAutoDelete;
    private final boolean exchangeAssumedToExist;

    private TopologyConfig(Builder builder) {
        this.role = builder.role;
        this.exchangeName = builder.exchangeName;
        this.exchangeKind = builder.exchangeKind;
        this.queueName = builder.queueName;
        this.routingKey = builder.routingKey;
        this.queueDurable = builder.queueDurable;
        this.queueExclusive = builder.queueExclusive;
        this.queueAutoDelete = builder.queueAutoDelete;
        this.exchangeAssumedToExist = builder.exchangeAssumedToExist;
    }

    /**
     * Publisher routing. Exactly one of queue or topic must be given.
     */
    public static Builder forPublisher(String queue, String topic, String exchange) {
        boolean hasQueue = notEmpty(queue);
        boolean hasTopic = notEmpty(topic);
        if (hasQueue && hasTopic) {
            throw new ConfigurationException("You may only specify either a queue or a topic");
        }
        if (!hasQueue && !hasTopic) {
            throw new ConfigurationException("You must specify either a queue or a topic");
        }

        String routingKey = hasTopic ? topic : queue;
        return new Builder()
                .role(ClientRole.PUBLISHER)
                .exchangeKind(hasTopic ? ExchangeKind.TOPIC : ExchangeKind.DIRECT)
                .routingKey(routingKey)
                .exchangeName(notEmpty(exchange) ? exchange : routingKey)
                .queueName(hasTopic ? null : queue);
    }

    /**
     * Consumer routing. A topic binds a queue named after the topic unless a
     * queue name is given as well.
     */
    public static Builder forConsumer(String queue, String topic, String exchange) {
        boolean hasQueue = notEmpty(queue);
        boolean hasTopic = notEmpty(topic);
        if (!hasQueue && !hasTopic) {
            throw new ConfigurationException("You must specify either a queue or a topic");
        }

        String bindingKey = hasTopic ? topic : queue;
        return new Builder()
                .role(ClientRole.CONSUMER)
                .exchangeKind(hasTopic ? ExchangeKind.TOPIC : ExchangeKind.DIRECT)
                .routingKey(bindingKey)
                .exchangeName(notEmpty(exchange) ? exchange : bindingKey)
                .queueName(hasQueue ? queue : topic);
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    public ClientRole getRole() {
        return role;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public ExchangeKind getExchangeKind() {
        return exchangeKind;
    }

    /**
     * Queue to declare and bind, or {@code null} for a topic publisher.
     */
    public String getQueueName() {
        return queueName;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public boolean isQueueDurable() {
        return queueDurable;
    }

    public boolean isQueueExclusive() {
        return queueExclusive;
    }

    public boolean isQueueAutoDelete() {
        return queueAutoDelete;
    }

    public boolean isExchangeAssumedToExist() {
        return exchangeAssumedToExist;
    }

    /**
     * A topic publisher has no queue of its own; everything else declares
     * and binds one.
     */
    public boolean declaresQueue() {
        return queueName != null;
    }

    @Override
    public String toString() {
        return String.format("TopologyConfig{role=%s, exchange='%s' (%s), queue='%s', routingKey='%s'}",
                role, exchangeName, exchangeKind.getType(), queueName, routingKey);
    }

    public static class Builder {
        private ClientRole role = ClientRole.PUBLISHER;
        private String exchangeName;
        private ExchangeKind exchangeKind = ExchangeKind.DIRECT;
        private String queueName;
        private String routingKey;
        private boolean queueDurable = true;
        private boolean queueExclusive = false;
        private boolean queueAutoDelete = false;
        private boolean exchangeAssumedToExist = false;

        public Builder role(ClientRole role) {
            this.role = role;
            return this;
        }

        public Builder exchangeName(String exchangeName) {
            this.exchangeName = exchangeName;
            return this;
        }

        public Builder exchangeKind(ExchangeKind exchangeKind) {
            this.exchangeKind = exchangeKind;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder queueDurable(boolean durable) {
            this.queueDurable = durable;
            return this;
        }

        public Builder queueExclusive(boolean exclusive) {
            this.queueExclusive = exclusive;
            return this;
        }

        public Builder queueAutoDelete(boolean autoDelete) {
            this.queueAutoDelete = autoDelete;
            return this;
        }

        public Builder exchangeAssumedToExist(boolean assumed) {
            this.exchangeAssumedToExist = assumed;
            return this;
        }

        public TopologyConfig build() {
            if (exchangeName == null || exchangeName.isEmpty()) {
                throw new ConfigurationException("Exchange name is required");
            }
            if (routingKey == null) {
                throw new ConfigurationException("Routing key is required");
            }
            if (role == ClientRole.CONSUMER && queueName == null) {
                throw new ConfigurationException("A consumer needs a queue to consume from");
            }
            return new TopologyConfig(this);
        }
    }
}
