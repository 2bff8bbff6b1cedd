package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.fetch.ManifestFetcher;
import com.bulksubmit.recipient.transfer.fetch.ManifestFetcherListener;
import com.bulksubmit.recipient.transfer.model.JobStatus;
import com.bulksubmit.recipient.transfer.model.JobView;
import com.bulksubmit.recipient.transfer.model.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * One manifest transfer inside a submission. Every status change goes through
 * {@link JobStateMachine}; the fetcher's events are translated into job events while the job is
 * started and ignored once it has been aborted.
 */
public class TransferJob {
    private static final Logger log = LoggerFactory.getLogger(TransferJob.class);

    private final String jobId;
    private final String submissionId;
    private final String manifestUrl;
    private final String outputFormat;
    private final Instant createdAt;
    private final ManifestFetcher fetcher;
    private final Executor transferExecutor;

    private JobSnapshot snapshot = JobSnapshot.initial();
    private ManifestFetcherListener boundListener;
    private CompletableFuture<Void> running;
    private volatile TransferJobListener owner;

    public TransferJob(
        String jobId,
        String submissionId,
        String manifestUrl,
        String outputFormat,
        ManifestFetcher fetcher,
        Executor transferExecutor
    ) {
        this.jobId = jobId;
        this.submissionId = submissionId;
        this.manifestUrl = manifestUrl;
        this.outputFormat = outputFormat;
        this.createdAt = Instant.now();
        this.fetcher = fetcher;
        this.transferExecutor = transferExecutor;
    }

    public String getJobId() {
        return jobId;
    }

    public String getSubmissionId() {
        return submissionId;
    }

    public String getManifestUrl() {
        return manifestUrl;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return snapshot.status();
    }

    public synchronized int getProgress() {
        return snapshot.progress();
    }

    public synchronized String getError() {
        return snapshot.error();
    }

    public synchronized JobView toView() {
        return new JobView(
            jobId,
            manifestUrl,
            snapshot.status(),
            snapshot.progress(),
            snapshot.error(),
            fetcher.status(),
            createdAt
        );
    }

    /**
     * Whether a fetcher run started by this job has not returned yet. A job that failed or was
     * aborted can still be running until the fetcher notices.
     */
    public synchronized boolean isRunning() {
        return running != null && !running.isDone();
    }

    public CompletableFuture<Void> start(TransferJobListener listener) {
        CompletableFuture<Void> finished = new CompletableFuture<>();
        synchronized (this) {
            if (snapshot.status() == JobStatus.IN_PROGRESS) {
                throw new IllegalStateException("Job " + jobId + " has already been started.");
            }
            if (isRunning()) {
                throw new IllegalStateException("Job " + jobId + " is still running.");
            }
            if (manifestUrl == null || manifestUrl.isBlank()) {
                throw new IllegalStateException("Job " + jobId + " has no manifestUrl.");
            }
            detachListener();
            owner = listener;
            boundListener = new FetcherEvents();
            fetcher.addListener(boundListener);
            fetcher.reset();
            apply(JobEvent.start());
            running = finished;
        }
        log.info("Job {} started for manifest {}", jobId, manifestUrl);
        try {
            CompletableFuture.runAsync(this::execute, transferExecutor).whenComplete((ignored, error) -> {
                if (error != null) {
                    finished.completeExceptionally(error);
                } else {
                    finished.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            finished.completeExceptionally(e);
            throw e;
        }
        return finished;
    }

    public void abort() {
        synchronized (this) {
            if (snapshot.status() == JobStatus.ABORTED) {
                return;
            }
            apply(JobEvent.abort());
            detachListener();
            owner = null;
        }
        fetcher.abort();
        log.info("Job {} aborted", jobId);
    }

    /**
     * Deletes every file this job wrote for its manifest. Completes with the number of files
     * removed.
     */
    public CompletableFuture<Integer> rollback() {
        return CompletableFuture.supplyAsync(() -> fetcher.undoAll(manifestUrl), transferExecutor)
            .whenComplete((removed, error) -> {
                if (error != null) {
                    log.warn("Rollback of job {} failed: {}", jobId, error.getMessage());
                } else {
                    log.info("Rolled back {} files of job {}", removed, jobId);
                }
            });
    }

    private void execute() {
        synchronized (this) {
            if (snapshot.status() != JobStatus.IN_PROGRESS) {
                return;
            }
        }
        fetcher.run(manifestUrl);
    }

    private void apply(JobEvent event) {
        snapshot = JobStateMachine.apply(snapshot, event);
    }

    private void detachListener() {
        if (boundListener != null) {
            fetcher.removeListener(boundListener);
            boundListener = null;
        }
    }

    private final class FetcherEvents implements ManifestFetcherListener {
        @Override
        public void onStart() {
            synchronized (TransferJob.this) {
                apply(JobEvent.start());
            }
        }

        @Override
        public void onProgress(int downloaded, int total) {
            synchronized (TransferJob.this) {
                apply(JobEvent.progress(downloaded, total));
            }
            log.debug("Job {} progress {}/{}", jobId, downloaded, total);
        }

        @Override
        public void onError(TransferException error) {
            TransferJobListener listener;
            synchronized (TransferJob.this) {
                apply(JobEvent.error(error.getMessage()));
                listener = snapshot.status() == JobStatus.ABORTED ? null : owner;
            }
            if (listener != null) {
                listener.onError(TransferJob.this, error);
            }
        }

        @Override
        public void onComplete() {
            synchronized (TransferJob.this) {
                apply(JobEvent.complete());
            }
            log.info("Job {} finished with status {}", jobId, getStatus().code());
        }

        @Override
        public void onAbort() {
            synchronized (TransferJob.this) {
                apply(JobEvent.abort());
            }
        }

        @Override
        public void onDownloadComplete(String fileUrl, int resourceCount) {
            TransferJobListener listener = owner;
            if (listener != null) {
                listener.onFileComplete(TransferJob.this, fileUrl, resourceCount);
            }
        }
    }
}
