package com.amqpclient.session;

import java.time.Duration;

/**
 * The single thread that owns all session state. Tasks run one at a time in
 * submission order; timers run on the same thread.
 */
public interface SessionExecutor {

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    boolean inSessionThread();

    void shutdown();
}
