package com.omrchecker.orchestrator.parsing.service;

import com.omrchecker.orchestrator.config.OmrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Optional periodic driver for callback delivery: each tick sends never-attempted callbacks, then runs one
 * retry pass over failed ones. Disabled unless {@code omr.callbacks.sweep-enabled} is set.
 */
@Service
public class CallbackSweepService {
    private static final Logger log = LoggerFactory.getLogger(CallbackSweepService.class);

    private final WebhookService webhookService;
    private final OmrProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public CallbackSweepService(WebhookService webhookService, OmrProperties properties) {
        this.webhookService = webhookService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getCallbacks().isSweepEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int intervalSeconds = properties.getCallbacks().getSweepIntervalSeconds();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("omr-callback-sweep");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
            log.info("Callback sweep started, interval {}s", intervalSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (scheduler != null) {
                scheduler.shutdownNow();
                try {
                    scheduler.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                scheduler = null;
            }
        }
    }

    /**
     * Runs one sweep on the calling thread and returns the number of callbacks delivered.
     */
    public int sweepOnce() {
        int delivered = webhookService.deliverPendingCallbacks();
        delivered += webhookService.retryFailedCallbacks(properties.getCallbacks().getMaxAttempts());
        return delivered;
    }

    private void sweepSafely() {
        try {
            int delivered = sweepOnce();
            if (delivered > 0) {
                log.info("Callback sweep delivered {} webhooks", delivered);
            }
        } catch (Exception e) {
            // keep the schedule alive
            log.warn("Callback sweep failed", e);
        }
    }
}
