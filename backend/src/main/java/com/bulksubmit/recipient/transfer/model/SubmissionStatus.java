package com.bulksubmit.recipient.transfer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubmissionStatus {
    IN_PROGRESS("in-progress"),
    COMPLETE("complete"),
    ABORTED("aborted");

    private final String code;

    SubmissionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ABORTED;
    }

    public static SubmissionStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (SubmissionStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
