package labrunner.coordinator.scheduler;

import labrunner.coordinator.config.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives a {@link HostScheduler} at a fixed interval.
 *
 * Uses a single-threaded executor, so ticks never overlap. A failing tick
 * is logged and the next one still runs.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final HostScheduler hostScheduler;
    private final Duration tickInterval;

    private volatile boolean running = false;

    public Scheduler(HostScheduler hostScheduler, RunnerConfig config) {
        this(hostScheduler, config.hostSchedulerTickInterval());
    }

    public Scheduler(HostScheduler hostScheduler, Duration tickInterval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "labrunner-host-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.hostScheduler = hostScheduler;
        this.tickInterval = tickInterval;
    }

    /**
     * Start ticking. The first tick runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = tickInterval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("host-scheduler", hostScheduler::tick),
                0,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Host scheduler ({}) ticking every {}ms", hostScheduler.getClass().getSimpleName(), intervalMs);
    }

    /**
     * Stop the scheduler gracefully, letting a running tick finish.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
