package com.bulksubmit.recipient.transfer.model;

import java.time.Instant;
import java.util.List;

public record SubmissionSummary(
    String slug,
    String submissionId,
    SubmitterIdentity submitter,
    Instant createdAt,
    SubmissionStatus status,
    double progress,
    List<JobView> jobs
) {
}
