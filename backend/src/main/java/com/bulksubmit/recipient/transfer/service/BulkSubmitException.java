package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.IssueType;
import org.springframework.http.HttpStatus;

public class BulkSubmitException extends RuntimeException {
    private final HttpStatus status;
    private final IssueType issueType;

    public BulkSubmitException(HttpStatus status, IssueType issueType, String message) {
        super(message);
        this.status = status;
        this.issueType = issueType;
    }

    public BulkSubmitException(HttpStatus status, IssueType issueType, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.issueType = issueType;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public IssueType getIssueType() {
        return issueType;
    }

    public static BulkSubmitException invalid(String message) {
        return new BulkSubmitException(HttpStatus.BAD_REQUEST, IssueType.INVALID, message);
    }

    public static BulkSubmitException notFound(String message) {
        return new BulkSubmitException(HttpStatus.NOT_FOUND, IssueType.NOT_FOUND, message);
    }
}
