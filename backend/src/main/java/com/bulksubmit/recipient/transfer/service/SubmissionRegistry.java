package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.config.RecipientProperties;
import com.bulksubmit.recipient.transfer.model.SubmissionStatus;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class SubmissionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubmissionRegistry.class);

    private final RecipientProperties properties;
    private final ObjectMapper objectMapper;
    private final Path storageRoot;
    private final Map<String, Submission> submissions = new ConcurrentHashMap<>();

    public SubmissionRegistry(RecipientProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.storageRoot = Path.of(properties.getStorageDir()).toAbsolutePath().normalize();
    }

    public Submission findOrCreate(String submissionId, SubmitterIdentity submitter) {
        String slug = Submission.computeSlug(submissionId, submitter);
        return submissions.computeIfAbsent(slug, key -> {
            log.info("Registering submission {} from {}", submissionId, submitter.display());
            return new Submission(submissionId, submitter, storageRoot, properties.getBaseUrl(), objectMapper);
        });
    }

    public Optional<Submission> find(String submissionId, SubmitterIdentity submitter) {
        return find(Submission.computeSlug(submissionId, submitter));
    }

    public Optional<Submission> find(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(submissions.get(slug));
    }

    public List<Submission> getAll() {
        return new ArrayList<>(submissions.values());
    }

    public boolean delete(String slug) {
        return submissions.remove(slug) != null;
    }

    /**
     * Drops submissions older than their configured lifetime and deletes their files. Finished
     * and aborted submissions use the completed lifetime; all others use the pending one.
     * Returns the number of submissions removed.
     */
    public int sweep(Instant now) {
        int removed = 0;
        for (Submission submission : getAll()) {
            Duration lifetime = lifetimeOf(submission.getStatus());
            if (submission.getCreatedAt().plus(lifetime).isAfter(now)) {
                continue;
            }
            if (!submissions.remove(submission.getSlug(), submission)) {
                continue;
            }
            removed++;
            for (TransferJob job : submission.getJobs()) {
                job.abort();
            }
            try {
                FileSystemUtils.deleteRecursively(submission.getDirectory());
            } catch (IOException e) {
                log.warn("Failed to delete files of expired submission {}: {}", submission, e.getMessage());
            }
            log.info("Removed expired submission {}", submission);
        }
        return removed;
    }

    private Duration lifetimeOf(SubmissionStatus status) {
        double hours = status.isTerminal()
            ? properties.getCompletedSubmissionLifetimeHours()
            : properties.getPendingSubmissionLifetimeHours();
        return Duration.ofMillis(Math.max(0L, Math.round(hours * 3_600_000d)));
    }
}
