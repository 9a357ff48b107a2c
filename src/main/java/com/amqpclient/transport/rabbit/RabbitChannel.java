package com.amqpclient.transport.rabbit;

import com.amqpclient.model.ExchangeKind;
import com.amqpclient.model.InboundMessage;
import com.amqpclient.model.MessageProperties;
import com.amqpclient.transport.TransportChannel;
import com.amqpclient.transport.TransportConnection;
import com.amqpclient.transport.TransportEvent;
import com.amqpclient.transport.TransportEventSink;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

class RabbitChannel implements TransportChannel {

    private final RabbitConnection connection;
    private final TransportEventSink sink;
    private final AtomicBoolean closeReported = new AtomicBoolean();
    private volatile Channel delegate;

    RabbitChannel(RabbitConnection connection, TransportEventSink sink) {
        this.connection = connection;
        this.sink = sink;
    }

    void open(Channel channel) {
        delegate = channel;
        channel.addShutdownListener(cause -> {
            if (closeReported.compareAndSet(false, true)) {
                sink.post(TransportEvent.channelClosed(this, RabbitCloseReasons.from(cause)));
            }
        });
        channel.addConfirmListener(
                (deliveryTag, multiple) -> sink.post(TransportEvent.confirm(this, deliveryTag, multiple, true)),
                (deliveryTag, multiple) -> sink.post(TransportEvent.confirm(this, deliveryTag, multiple, false)));
        sink.post(TransportEvent.channelOpened(this));
    }

    @Override
    public TransportConnection getConnection() {
        return connection;
    }

    @Override
    public void declareExchange(String exchange, ExchangeKind kind, boolean durable) {
        connection.submit("Exchange.Declare", () -> {
            channel().exchangeDeclare(exchange, kind.getType(), durable);
            sink.post(TransportEvent.exchangeDeclared(this));
        });
    }

    @Override
    public void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete) {
        connection.submit("Queue.Declare", () -> {
            channel().queueDeclare(queue, durable, exclusive, autoDelete, null);
            sink.post(TransportEvent.queueDeclared(this));
        });
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        connection.submit("Queue.Bind", () -> {
            channel().queueBind(queue, exchange, routingKey);
            sink.post(TransportEvent.queueBound(this));
        });
    }

    @Override
    public void enableConfirms() {
        connection.submit("Confirm.Select", () -> {
            channel().confirmSelect();
            sink.post(TransportEvent.confirmsEnabled(this));
        });
    }

    @Override
    public void publish(String exchange, String routingKey, MessageProperties properties, byte[] body) {
        AMQP.BasicProperties basicProperties = RabbitMessages.toBasicProperties(properties);
        connection.submit("Basic.Publish", () -> channel().basicPublish(exchange, routingKey, basicProperties, body));
    }

    @Override
    public void consume(String queue, String consumerTag) {
        connection.submit("Basic.Consume", () -> {
            Channel channel = channel();
            channel.basicConsume(queue, false, consumerTag, new SessionConsumer(channel));
        });
    }

    @Override
    public void ack(long deliveryTag) {
        connection.submit("Basic.Ack", () -> channel().basicAck(deliveryTag, false));
    }

    @Override
    public void cancel(String consumerTag) {
        connection.submit("Basic.Cancel", () -> channel().basicCancel(consumerTag));
    }

    @Override
    public void close() {
        connection.submit("Channel.Close", () -> {
            Channel channel = delegate;
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
        });
    }

    @Override
    public boolean isOpen() {
        Channel channel = delegate;
        return channel != null && channel.isOpen();
    }

    private Channel channel() throws IOException {
        Channel channel = delegate;
        if (channel == null) {
            throw new IOException("Channel is not open");
        }
        return channel;
    }

    private class SessionConsumer extends DefaultConsumer {

        SessionConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleConsumeOk(String consumerTag) {
            super.handleConsumeOk(consumerTag);
            sink.post(TransportEvent.consumeOk(RabbitChannel.this, consumerTag));
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            sink.post(TransportEvent.cancelOk(RabbitChannel.this, consumerTag));
        }

        @Override
        public void handleCancel(String consumerTag) {
            sink.post(TransportEvent.consumerCancelled(RabbitChannel.this, consumerTag));
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                                   byte[] body) {
            InboundMessage message = new InboundMessage(envelope.getDeliveryTag(), envelope.isRedeliver(),
                    envelope.getExchange(), envelope.getRoutingKey(), RabbitMessages.fromBasicProperties(properties),
                    body);
            sink.post(TransportEvent.delivery(RabbitChannel.this, consumerTag, message));
        }
    }
}
