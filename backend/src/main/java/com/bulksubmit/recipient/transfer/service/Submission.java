package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.JobView;
import com.bulksubmit.recipient.transfer.model.SubmissionStatus;
import com.bulksubmit.recipient.transfer.model.SubmissionSummary;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Submission {
    private static final Logger log = LoggerFactory.getLogger(Submission.class);

    private final String slug;
    private final String submissionId;
    private final SubmitterIdentity submitter;
    private final Instant createdAt;
    private final Path directory;
    private final ErrorManifest errorManifest;
    private final Map<String, TransferJob> jobs = new LinkedHashMap<>();
    private final TransferJobListener jobListener = new OutcomeRecorder();

    private SubmissionStatus status = SubmissionStatus.IN_PROGRESS;

    public Submission(
        String submissionId,
        SubmitterIdentity submitter,
        Path storageRoot,
        String baseUrl,
        ObjectMapper objectMapper
    ) {
        this.submissionId = submissionId;
        this.submitter = submitter;
        this.slug = computeSlug(submissionId, submitter);
        this.createdAt = Instant.now();
        this.directory = storageRoot.resolve(slug);
        this.errorManifest = new ErrorManifest(submissionId, slug, baseUrl, directory.resolve("files"), objectMapper);
    }

    public static String computeSlug(String submissionId, SubmitterIdentity submitter) {
        String key = submitter.system() + "|" + submitter.value() + ":" + submissionId;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public String getSlug() {
        return slug;
    }

    public String getSubmissionId() {
        return submissionId;
    }

    public SubmitterIdentity getSubmitter() {
        return submitter;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Path getDirectory() {
        return directory;
    }

    public ErrorManifest getErrorManifest() {
        return errorManifest;
    }

    public synchronized SubmissionStatus getStatus() {
        return status;
    }

    public synchronized void addJob(TransferJob job) {
        jobs.put(job.getJobId(), job);
    }

    public synchronized TransferJob removeJob(String jobId) {
        return jobs.remove(jobId);
    }

    public synchronized List<TransferJob> getJobs() {
        return new ArrayList<>(jobs.values());
    }

    public synchronized Optional<TransferJob> findJobByManifestUrl(String manifestUrl) {
        for (TransferJob job : jobs.values()) {
            if (job.getManifestUrl().equals(manifestUrl)) {
                return Optional.of(job);
            }
        }
        return Optional.empty();
    }

    /**
     * Starts every job that is not running or finished. A failed or aborted job whose previous run
     * has not returned yet is left alone. Outcomes of started jobs are recorded in
     * this submission's error manifest.
     */
    public void start() {
        for (TransferJob job : getJobs()) {
            if (job.getStatus().isRestartable() && !job.isRunning()) {
                job.start(jobListener);
            }
        }
    }

    public synchronized void complete() {
        status = SubmissionStatus.COMPLETE;
        log.info("Submission {} marked complete", this);
    }

    public void abort() {
        synchronized (this) {
            status = SubmissionStatus.ABORTED;
        }
        for (TransferJob job : getJobs()) {
            job.abort();
            job.rollback();
        }
        log.info("Submission {} aborted", this);
    }

    /**
     * Swaps the job for {@code oldManifestUrl} with {@code replacement}: the old job is aborted,
     * its files are rolled back and its status entry is dropped before the replacement starts.
     */
    public void replaceManifest(String oldManifestUrl, TransferJob replacement) throws IOException {
        Optional<TransferJob> previous = findJobByManifestUrl(oldManifestUrl);
        if (previous.isPresent()) {
            TransferJob job = previous.get();
            job.abort();
            job.rollback();
            removeJob(job.getJobId());
        }
        addJob(replacement);
        replacement.start(jobListener);
        if (errorManifest.hasManifestUrl(oldManifestUrl)) {
            errorManifest.removeManifestUrl(oldManifestUrl);
        }
    }

    public synchronized double getProgress() {
        if (jobs.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (TransferJob job : jobs.values()) {
            total += job.getProgress();
        }
        return Math.round(total / jobs.size() * 100.0) / 100.0;
    }

    public synchronized SubmissionSummary toSummary() {
        List<JobView> views = new ArrayList<>();
        for (TransferJob job : jobs.values()) {
            views.add(job.toView());
        }
        return new SubmissionSummary(slug, submissionId, submitter, createdAt, status, getProgress(), views);
    }

    @Override
    public String toString() {
        return "Submission(" + submissionId + ", " + submitter.display() + ")";
    }

    private final class OutcomeRecorder implements TransferJobListener {
        @Override
        public void onError(TransferJob job, TransferException error) {
            try {
                errorManifest.addError(error, job.getManifestUrl());
            } catch (IOException e) {
                log.warn("Failed to record error for manifest {}: {}", job.getManifestUrl(), e.getMessage());
            }
        }

        @Override
        public void onFileComplete(TransferJob job, String fileUrl, int resourceCount) {
            try {
                errorManifest.addSuccess(job.getManifestUrl());
            } catch (IOException e) {
                log.warn("Failed to record success for manifest {}: {}", job.getManifestUrl(), e.getMessage());
            }
        }
    }
}
