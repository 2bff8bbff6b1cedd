package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.config.RecipientProperties;
import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.SubmissionStatus;
import com.bulksubmit.recipient.transfer.model.SubmissionSummary;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Service
public class BulkSubmitService {
    private static final Logger log = LoggerFactory.getLogger(BulkSubmitService.class);
    private static final String TERMINAL_MESSAGE = "Submission is already complete or aborted";

    private final SubmissionRegistry registry;
    private final TransferJobFactory jobFactory;
    private final RecipientProperties properties;

    public BulkSubmitService(SubmissionRegistry registry, TransferJobFactory jobFactory, RecipientProperties properties) {
        this.registry = registry;
        this.jobFactory = jobFactory;
        this.properties = properties;
    }

    /**
     * Applies a bulk-submit request and returns the message reported back to the sender.
     */
    public String submit(BulkSubmitRequest request) {
        SubmitAction action = request.action();
        log.info(
            "Requested action {} for submitter {}, submissionId {}",
            action,
            request.submitter().display(),
            request.submissionId()
        );
        return switch (action) {
            case ABORT -> abort(request);
            case COMPLETE -> complete(request);
            case START -> start(request);
            case REPLACE -> replace(request);
        };
    }

    String start(BulkSubmitRequest request) {
        if (!request.hasManifestUrl()) {
            throw BulkSubmitException.invalid("manifestUrl is required to start a transfer");
        }
        Submission submission = registry.findOrCreate(request.submissionId(), request.submitter());
        synchronized (submission) {
            requireOpen(submission);
            Optional<TransferJob> existing = submission.findJobByManifestUrl(request.manifestUrl());
            if (existing.isPresent() && !existing.get().getStatus().isRestartable()) {
                throw BulkSubmitException.invalid("Manifest " + request.manifestUrl() + " has already been submitted");
            }
            if (existing.isPresent() && existing.get().isRunning()) {
                throw BulkSubmitException.invalid("Manifest " + request.manifestUrl() + " is still being transferred");
            }
            TransferJob job = existing.orElseGet(() -> newJob(submission, request));
            submission.addJob(job);
            submission.start();
            return "Job " + job.getJobId() + " started successfully! Submission: " + submission.getSlug();
        }
    }

    String complete(BulkSubmitRequest request) {
        Submission submission = registry.findOrCreate(request.submissionId(), request.submitter());
        synchronized (submission) {
            requireOpen(submission);
            if (submission.getJobs().isEmpty() && request.hasManifestUrl()) {
                TransferJob job = newJob(submission, request);
                submission.addJob(job);
                submission.start();
                submission.complete();
                return "Job " + job.getJobId() + " started successfully and marked as complete. Submission: "
                    + submission.getSlug();
            }
            submission.complete();
            return "Submission " + submission.getSlug() + " marked as complete";
        }
    }

    String abort(BulkSubmitRequest request) {
        Submission submission = registry.find(request.submissionId(), request.submitter())
            .orElseThrow(() -> BulkSubmitException.notFound("Submission not found for the given submitter and submissionId"));
        synchronized (submission) {
            requireOpen(submission);
            submission.abort();
            return "Submission " + submission.getSlug() + " marked as aborted";
        }
    }

    String replace(BulkSubmitRequest request) {
        if (!request.hasManifestUrl()) {
            throw BulkSubmitException.invalid("manifestUrl is required when replacesManifestUrl is given");
        }
        Submission submission = registry.find(request.submissionId(), request.submitter())
            .orElseThrow(() -> BulkSubmitException.notFound("Submission not found for the given submitter and submissionId"));
        synchronized (submission) {
            requireOpen(submission);
            String replaced = request.replacesManifestUrl();
            if (submission.findJobByManifestUrl(replaced).isEmpty()) {
                throw BulkSubmitException.notFound("No transfer found for manifest " + replaced);
            }
            TransferJob job = newJob(submission, request);
            try {
                submission.replaceManifest(replaced, job);
            } catch (IOException e) {
                throw new BulkSubmitException(
                    HttpStatus.INTERNAL_SERVER_ERROR,
                    IssueType.PROCESSING,
                    "Failed to replace manifest " + replaced + ": " + e.getMessage(),
                    e
                );
            }
            return "Manifest " + replaced + " replaced by " + request.manifestUrl() + ". Job " + job.getJobId()
                + " started successfully! Submission: " + submission.getSlug();
        }
    }

    /**
     * Resolves the submission a status request refers to and returns its status URL.
     */
    public String kickoff(String submissionId, SubmitterIdentity submitter) {
        Submission submission = registry.find(submissionId, submitter)
            .orElseThrow(() -> BulkSubmitException.notFound("No submission found for the given submitter and submissionId"));
        return properties.getBaseUrl() + "/$bulk-submit-status/" + submission.getSlug();
    }

    public StatusPollResult pollStatus(String slug) {
        Submission submission = requireSubmission(slug);
        SubmissionStatus status = submission.getStatus();
        if (status == SubmissionStatus.ABORTED) {
            throw new BulkSubmitException(HttpStatus.INTERNAL_SERVER_ERROR, IssueType.EXCEPTION, "The submission has been aborted");
        }
        double progress = submission.getProgress();
        if (status == SubmissionStatus.COMPLETE && progress == 100d) {
            return StatusPollResult.ready(submission.getErrorManifest().toManifest());
        }
        return StatusPollResult.inProgress(progress);
    }

    public SubmissionSummary summary(String slug) {
        return requireSubmission(slug).toSummary();
    }

    public Path statusFile(String slug, String fileName) {
        Submission submission = requireSubmission(slug);
        return submission.getErrorManifest().findFile(fileName)
            .filter(Files::isRegularFile)
            .orElseThrow(() -> BulkSubmitException.notFound("File not found"));
    }

    private Submission requireSubmission(String slug) {
        return registry.find(slug)
            .orElseThrow(() -> BulkSubmitException.notFound(
                "No submission found for the given id. Perhaps it expired and was cleaned up."
            ));
    }

    private void requireOpen(Submission submission) {
        if (submission.getStatus().isTerminal()) {
            throw BulkSubmitException.invalid(TERMINAL_MESSAGE);
        }
    }

    private TransferJob newJob(Submission submission, BulkSubmitRequest request) {
        String fhirBaseUrl = request.fhirBaseUrl() == null || request.fhirBaseUrl().isBlank()
            ? originOf(request.manifestUrl())
            : request.fhirBaseUrl();
        return jobFactory.create(
            submission,
            request.manifestUrl(),
            fhirBaseUrl,
            request.outputFormat(),
            request.fileRequestHeaders()
        );
    }

    private static String originOf(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return url;
            }
            return uri.getScheme() + "://" + uri.getRawAuthority();
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
