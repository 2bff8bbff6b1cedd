package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.SubmissionStatus;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;

import java.util.Map;

public record BulkSubmitRequest(
    SubmitterIdentity submitter,
    String submissionId,
    SubmissionStatus submissionStatus,
    String manifestUrl,
    String replacesManifestUrl,
    String fhirBaseUrl,
    String outputFormat,
    Map<String, String> fileRequestHeaders
) {
    public SubmissionStatus effectiveStatus() {
        return submissionStatus == null ? SubmissionStatus.IN_PROGRESS : submissionStatus;
    }

    public SubmitAction action() {
        return switch (effectiveStatus()) {
            case ABORTED -> SubmitAction.ABORT;
            case COMPLETE -> SubmitAction.COMPLETE;
            case IN_PROGRESS -> hasText(replacesManifestUrl) ? SubmitAction.REPLACE : SubmitAction.START;
        };
    }

    public boolean hasManifestUrl() {
        return hasText(manifestUrl);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
