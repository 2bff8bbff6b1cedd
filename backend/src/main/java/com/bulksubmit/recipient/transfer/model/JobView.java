package com.bulksubmit.recipient.transfer.model;

import java.time.Instant;

public record JobView(
    String jobId,
    String manifestUrl,
    JobStatus status,
    int progress,
    String error,
    String fetcherStatus,
    Instant createdAt
) {
}
