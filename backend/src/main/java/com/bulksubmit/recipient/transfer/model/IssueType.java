package com.bulksubmit.recipient.transfer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    INVALID("invalid"),
    NOT_FOUND("not-found"),
    PROCESSING("processing"),
    EXCEPTION("exception"),
    NOT_SUPPORTED("not-supported"),
    INFORMATIONAL("informational");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
