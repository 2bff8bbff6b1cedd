package com.bulksubmit.recipient.transfer.fetch;

import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.TransferErrorContext;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.fasterxml.jackson.databind.JsonNode;

public final class ManifestValidator {
    private ManifestValidator() {
    }

    public static void validate(JsonNode manifest) {
        if (manifest == null || !manifest.isObject()) {
            throw invalid("Manifest is not a JSON object");
        }
        JsonNode transactionTime = manifest.get("transactionTime");
        if (transactionTime == null || transactionTime.isNull() || transactionTime.asText().isEmpty()) {
            throw invalid("Manifest is missing transactionTime");
        }
        JsonNode requiresAccessToken = manifest.get("requiresAccessToken");
        if (requiresAccessToken == null || !requiresAccessToken.isBoolean()) {
            throw invalid("Manifest has missing or invalid requiresAccessToken");
        }
        JsonNode output = manifest.get("output");
        if (output == null || !output.isArray()) {
            throw invalid("Manifest output must be an array");
        }
        JsonNode deleted = manifest.get("deleted");
        if (deleted != null && !deleted.isArray()) {
            throw invalid("Manifest deleted must be an array if present");
        }
        JsonNode error = manifest.get("error");
        if (error != null && !error.isNull() && !error.isArray()) {
            throw invalid("Manifest error must be an array if present");
        }
        requireObjectEntries(output, "output");
        requireObjectEntries(deleted, "deleted");
        requireObjectEntries(error, "error");
    }

    private static void requireObjectEntries(JsonNode files, String field) {
        if (files == null || !files.isArray()) {
            return;
        }
        for (JsonNode entry : files) {
            if (!entry.isObject()) {
                throw invalid("Manifest " + field + " entries must be objects");
            }
        }
    }

    private static TransferException invalid(String message) {
        return new TransferException(message, TransferErrorContext.of(IssueType.INVALID));
    }
}
