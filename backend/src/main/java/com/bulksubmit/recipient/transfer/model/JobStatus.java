package com.bulksubmit.recipient.transfer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    COMPLETE("complete"),
    FAILED("failed"),
    ABORTED("aborted");

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isRestartable() {
        return this == PENDING || this == FAILED || this == ABORTED;
    }
}
