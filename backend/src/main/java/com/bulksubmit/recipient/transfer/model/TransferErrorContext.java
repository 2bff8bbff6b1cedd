package com.bulksubmit.recipient.transfer.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TransferErrorContext(
    IssueType issueType,
    RequestDescriptor request,
    ResponseDescriptor response,
    String filePath,
    JsonNode resource,
    Integer lineNumber
) {
    public static TransferErrorContext of(IssueType issueType) {
        return new TransferErrorContext(issueType, null, null, null, null, null);
    }

    public TransferErrorContext withIssueType(IssueType value) {
        return new TransferErrorContext(value, request, response, filePath, resource, lineNumber);
    }

    public TransferErrorContext withExchange(RequestDescriptor requestValue, ResponseDescriptor responseValue) {
        return new TransferErrorContext(issueType, requestValue, responseValue, filePath, resource, lineNumber);
    }

    public TransferErrorContext withFilePath(String value) {
        return new TransferErrorContext(issueType, request, response, value, resource, lineNumber);
    }

    public TransferErrorContext withResource(JsonNode value, Integer line) {
        return new TransferErrorContext(issueType, request, response, filePath, value, line);
    }
}
