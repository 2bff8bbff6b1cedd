package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.JobStatus;

public final class JobStateMachine {
    private JobStateMachine() {
    }

    public static JobSnapshot apply(JobSnapshot current, JobEvent event) {
        JobStatus status = current.status();
        return switch (event.type()) {
            case START -> new JobSnapshot(JobStatus.IN_PROGRESS, 0, null);
            case PROGRESS -> {
                if (status != JobStatus.IN_PROGRESS && status != JobStatus.FAILED) {
                    yield current;
                }
                yield new JobSnapshot(status, percent(event.downloaded(), event.total()), current.error());
            }
            case ERROR -> status == JobStatus.ABORTED
                ? current
                : new JobSnapshot(JobStatus.FAILED, current.progress(), event.message());
            case COMPLETE -> status == JobStatus.IN_PROGRESS || status == JobStatus.FAILED
                ? new JobSnapshot(JobStatus.COMPLETE, 100, current.error())
                : current;
            case ABORT -> new JobSnapshot(JobStatus.ABORTED, current.progress(), current.error());
        };
    }

    static int percent(int downloaded, int total) {
        if (total <= 0) {
            return 0;
        }
        int value = (int) Math.round(downloaded * 100.0 / total);
        return Math.max(0, Math.min(100, value));
    }
}
