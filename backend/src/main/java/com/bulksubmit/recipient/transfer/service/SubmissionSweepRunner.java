package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.config.RecipientProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
public class SubmissionSweepRunner {
    private static final Logger log = LoggerFactory.getLogger(SubmissionSweepRunner.class);

    private final SubmissionRegistry registry;
    private final RecipientProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public SubmissionSweepRunner(SubmissionRegistry registry, RecipientProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            int interval = properties.getSweepIntervalMinutes();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("submission-sweep");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::sweepOnce, interval, interval, TimeUnit.MINUTES);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }

    void sweepOnce() {
        try {
            int removed = registry.sweep(Instant.now());
            if (removed > 0) {
                log.info("Submission sweep removed {} submissions", removed);
            }
        } catch (Exception e) {
            log.warn("Submission sweep failed", e);
        }
    }
}
