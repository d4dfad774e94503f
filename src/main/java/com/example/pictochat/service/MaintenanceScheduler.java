package com.example.pictochat.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a maintenance task at a fixed rate on a single daemon thread.
 * A failing run is logged and the next one still happens.
 */
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final Runnable task;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;

    public MaintenanceScheduler(String name, Runnable task) {
        this.task = task;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, name + "-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    public synchronized void start(Duration interval) {
        if (future != null) return;
        long ms = Math.max(1, interval.toMillis());
        future = scheduler.scheduleAtFixedRate(this::runSafely, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Maintenance scheduled every {}", interval);
    }

    public synchronized boolean isRunning() {
        return future != null && !future.isCancelled();
    }

    private void runSafely() {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("Maintenance run failed: {}", e.toString(), e);
        }
    }

    public synchronized void shutdown() {
        if (future != null) future.cancel(false);
        scheduler.shutdownNow();
    }
}
