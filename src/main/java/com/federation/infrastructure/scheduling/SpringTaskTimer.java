package com.federation.infrastructure.scheduling;

import com.federation.application.port.out.TaskTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TaskTimer} over Spring's {@link TaskScheduler}. Task failures are logged and never kill the timer.
 */
public class SpringTaskTimer implements TaskTimer {

    private static final Logger log = LoggerFactory.getLogger(SpringTaskTimer.class);

    private final TaskScheduler scheduler;
    private final Clock clock;

    public SpringTaskTimer(TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(guarded(task), clock.instant().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration period) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(guarded(task), clock.instant().plus(period), period);
        return () -> future.cancel(false);
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled federation task failed: {}", e.getMessage(), e);
            }
        };
    }
}
