package org.caureq.hostwatch.service.alerts;

import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.config.AppProps;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs {@link AlertEvaluationEngine#runSweep} with a fixed delay on its own thread.
 * <p>
 * Stopping cancels future runs, asks an in-flight sweep to stop at the next pair boundary and
 * waits for it. Scheduled and manual sweeps never overlap.
 */
@Slf4j
@Component
public class AlertSweepScheduler implements SmartLifecycle {
    private final AlertEvaluationEngine engine;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final AppProps.AlertsProps props;

    private final ReentrantLock sweepLock = new ReentrantLock();
    private volatile boolean accepting = true;
    private volatile boolean running;
    private volatile ScheduledFuture<?> future;
    private volatile SweepReport lastReport;

    public AlertSweepScheduler(AlertEvaluationEngine engine,
                               @Qualifier("alertSweepTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                               AppProps appProps) {
        this.engine = engine;
        this.taskScheduler = taskScheduler;
        this.props = appProps.alertsOrDefault();
    }

    @Override
    public synchronized void start() {
        if (running) return;
        accepting = true;
        running = true;
        if (!props.schedulerOn()) {
            log.info("[Alerts] scheduler disabled (app.alerts.scheduler-enabled=false), manual sweeps only");
            return;
        }
        int interval = props.sweepIntervalOrDefault();
        int delay = props.initialDelayOrDefault();
        future = taskScheduler.scheduleWithFixedDelay(this::scheduledSweep,
                Instant.now().plusSeconds(delay), Duration.ofSeconds(interval));
        log.info("[Alerts] scheduler started interval={}s initialDelay={}s", interval, delay);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        accepting = false;
        var f = future;
        if (f != null) f.cancel(false);
        future = null;
        int timeout = props.shutdownTimeoutOrDefault();
        try {
            // wait for an in-flight sweep; it checks `accepting` between pairs
            if (sweepLock.tryLock(timeout, TimeUnit.SECONDS)) {
                sweepLock.unlock();
            } else {
                log.warn("[Alerts] in-flight sweep still running after {}s, stopping anyway", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        running = false;
        log.info("[Alerts] scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one sweep on the calling thread, waiting for any in-flight sweep first.
     *
     * @throws IllegalStateException once the scheduler has been stopped
     */
    public SweepReport triggerNow() {
        if (!accepting) throw new IllegalStateException("alert engine is stopped");
        sweepLock.lock();
        try {
            if (!accepting) throw new IllegalStateException("alert engine is stopped");
            return record(engine.runSweep(() -> !accepting));
        } finally {
            sweepLock.unlock();
        }
    }

    public SweepReport lastReport() {
        return lastReport;
    }

    void scheduledSweep() {
        if (!accepting) return;
        if (!sweepLock.tryLock()) {
            log.debug("[Alerts] previous sweep still running, skipping tick");
            return;
        }
        try {
            record(engine.runSweep(() -> !accepting));
        } catch (Exception e) {
            // keep the schedule alive; the next tick retries
            log.error("[Alerts] sweep failed", e);
        } finally {
            sweepLock.unlock();
        }
    }

    private SweepReport record(SweepReport r) {
        lastReport = r;
        return r;
    }
}
