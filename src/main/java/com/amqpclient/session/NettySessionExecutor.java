package com.amqpclient.session;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link SessionExecutor} backed by a single-threaded Netty event executor.
 */
public class NettySessionExecutor implements SessionExecutor {
    private static final Logger logger = LoggerFactory.getLogger(NettySessionExecutor.class);

    private static final long QUIET_PERIOD_MILLIS = 0;
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 2000;

    private final EventExecutor executor;

    public NettySessionExecutor() {
        this(new DefaultEventExecutor(new DefaultThreadFactory("amqp-session")));
    }

    NettySessionExecutor(EventExecutor executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        if (executor.isShuttingDown()) {
            logger.debug("Session executor is shutting down, dropping task");
            return;
        }
        executor.execute(guarded(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toNanos(), TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public boolean inSessionThread() {
        return executor.inEventLoop();
    }

    @Override
    public void shutdown() {
        executor.shutdownGracefully(QUIET_PERIOD_MILLIS, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Unhandled error on session thread", e);
            }
        };
    }
}
