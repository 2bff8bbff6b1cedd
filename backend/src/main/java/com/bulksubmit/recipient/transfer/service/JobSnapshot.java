package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.JobStatus;

public record JobSnapshot(
    JobStatus status,
    int progress,
    String error
) {
    public static JobSnapshot initial() {
        return new JobSnapshot(JobStatus.PENDING, 0, null);
    }
}
