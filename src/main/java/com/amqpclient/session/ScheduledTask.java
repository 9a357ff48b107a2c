package com.amqpclient.session;

/**
 * Handle to a timer registered with a {@link SessionExecutor}.
 */
@FunctionalInterface
public interface ScheduledTask {

    void cancel();
}
