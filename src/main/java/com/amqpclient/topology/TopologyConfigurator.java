package com.amqpclient.topology;

import com.amqpclient.config.TopologyConfig;
import com.amqpclient.session.Session;
import com.amqpclient.session.SessionRole;
import com.amqpclient.session.SessionState;
import com.amqpclient.transport.TransportChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares exchange, queue and binding on a fresh channel, one step at a
 * time, then hands the channel to the role.
 */
public class TopologyConfigurator {
    private static final Logger logger = LoggerFactory.getLogger(TopologyConfigurator.class);

    enum Step {
        IDLE,
        EXCHANGE,
        QUEUE,
        BINDING,
        DONE
    }

    private final Session session;
    private final TopologyConfig config;
    private final SessionRole role;

    private Step step = Step.IDLE;

    public TopologyConfigurator(Session session, TopologyConfig config, SessionRole role) {
        this.session = session;
        this.config = config;
        this.role = role;
    }

    public void configure(TransportChannel channel) {
        if (session.isExchangeKnownToExist()) {
            logger.debug("Exchange {} is known to exist, not declaring it", config.getExchangeName());
            declareQueue(channel);
            return;
        }
        step = Step.EXCHANGE;
        logger.info("Declaring exchange {} ({})", config.getExchangeName(), config.getExchangeKind().getType());
        channel.declareExchange(config.getExchangeName(), config.getExchangeKind(), true);
    }

    public void onExchangeDeclared(TransportChannel channel) {
        if (step != Step.EXCHANGE) {
            logger.debug("Unexpected Exchange.DeclareOk in step {}", step);
            return;
        }
        logger.debug("Exchange {} declared", config.getExchangeName());
        declareQueue(channel);
    }

    public void onQueueDeclared(TransportChannel channel) {
        if (step != Step.QUEUE) {
            logger.debug("Unexpected Queue.DeclareOk in step {}", step);
            return;
        }
        step = Step.BINDING;
        logger.info("Binding {} to {} with {}", config.getQueueName(), config.getExchangeName(),
                config.getRoutingKey());
        channel.bindQueue(config.getQueueName(), config.getExchangeName(), config.getRoutingKey());
    }

    public void onQueueBound(TransportChannel channel) {
        if (step != Step.BINDING) {
            logger.debug("Unexpected Queue.BindOk in step {}", step);
            return;
        }
        complete(channel);
    }

    /**
     * True while an Exchange.Declare is outstanding, so a 406 close can be
     * attributed to it.
     */
    public boolean isDeclaringExchange() {
        return step == Step.EXCHANGE;
    }

    public void reset() {
        step = Step.IDLE;
    }

    Step getStep() {
        return step;
    }

    private void declareQueue(TransportChannel channel) {
        if (!config.declaresQueue()) {
            complete(channel);
            return;
        }
        step = Step.QUEUE;
        logger.info("Declaring queue {}", config.getQueueName());
        channel.declareQueue(config.getQueueName(), config.isQueueDurable(), config.isQueueExclusive(),
                config.isQueueAutoDelete());
    }

    private void complete(TransportChannel channel) {
        step = Step.DONE;
        session.transition(SessionState.READY);
        logger.debug("Topology ready, starting {}", config.getRole());
        role.start(channel);
    }
}
