package com.bulksubmit.recipient.transfer.model;

public class TransferException extends RuntimeException {
    private final TransferErrorContext context;

    public TransferException(String message, TransferErrorContext context) {
        super(message);
        this.context = context == null ? TransferErrorContext.of(IssueType.PROCESSING) : context;
    }

    public TransferException(String message, TransferErrorContext context, Throwable cause) {
        super(message, cause);
        this.context = context == null ? TransferErrorContext.of(IssueType.PROCESSING) : context;
    }

    public TransferErrorContext getContext() {
        return context;
    }

    public IssueType getIssueType() {
        return context.issueType() == null ? IssueType.PROCESSING : context.issueType();
    }
}
