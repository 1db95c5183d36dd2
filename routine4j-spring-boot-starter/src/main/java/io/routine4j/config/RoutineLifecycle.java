package io.routine4j.config;

import io.routine4j.Routines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the scheduler when the Spring context starts and stops it when the context stops.
 *
 * <p>A {@link Routines} instance is single-use: once stopped, its executor is shut down for good. A
 * context restarted after {@code stop()} therefore keeps the scheduler stopped and logs a warning
 * instead of failing the whole context start.
 *
 * <p>Stopping waits for in-flight runs (up to {@code routine.shutdown-grace-period}) on a separate
 * thread, so other lifecycle beans in the same phase stop in parallel.
 */
public class RoutineLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RoutineLifecycle.class);

    private final Routines routines;
    private volatile boolean stopped = false;

    public RoutineLifecycle(Routines routines) {
        this.routines = Objects.requireNonNull(routines, "routines must not be null");
    }

    @Override
    public void start() {
        if (stopped) {
            log.warn("Routines were stopped with the context and cannot be restarted; scheduler stays stopped");
            return;
        }
        routines.start();
    }

    @Override
    public void stop() {
        stopped = true;
        routines.stop();
    }

    @Override
    public void stop(Runnable callback) {
        stopped = true;
        Thread stopper = new Thread(() -> {
            try {
                routines.stop();
            } catch (RuntimeException e) {
                log.error("Routines stop failed msg={}", e.getMessage(), e);
            } finally {
                callback.run();
            }
        });
        stopper.setName("routine.lifecycle-stop");
        stopper.setDaemon(true);
        stopper.start();
    }

    @Override
    public boolean isRunning() {
        return routines.isRunning();
    }

    // started last, stopped first
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
