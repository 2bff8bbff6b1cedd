package com.bulksubmit.recipient.transfer.api;

import com.bulksubmit.recipient.transfer.model.SubmissionStatus;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import com.bulksubmit.recipient.transfer.service.BulkSubmitException;
import com.bulksubmit.recipient.transfer.service.BulkSubmitRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the FHIR {@code Parameters} bodies accepted by the bulk-submit endpoints.
 */
final class FhirParameters {
    static final String DEFAULT_OUTPUT_FORMAT = "application/fhir+ndjson";
    private static final List<String> KICKOFF_FORMATS = List.of("application/fhir+ndjson", "application/ndjson", "ndjson");

    private final JsonNode parameters;

    private FhirParameters(JsonNode parameters) {
        this.parameters = parameters;
    }

    static FhirParameters of(JsonNode body) {
        if (body == null || !body.isObject() || !body.path("parameter").isArray()) {
            throw BulkSubmitException.invalid("Invalid request body. Expected a FHIR Parameters resource.");
        }
        return new FhirParameters(body.get("parameter"));
    }

    static BulkSubmitRequest readSubmitRequest(JsonNode body) {
        FhirParameters params = of(body);
        SubmitterIdentity submitter = params.submitter();
        String submissionId = params.submissionId();

        JsonNode statusParam = params.find("submissionStatus");
        String statusCode = statusParam == null ? null : text(statusParam.path("valueCoding").path("code"));
        SubmissionStatus status = null;
        if (statusCode != null) {
            status = SubmissionStatus.fromCode(statusCode);
            if (status == null) {
                throw BulkSubmitException.invalid(
                    "Invalid submissionStatus parameter. Must be one of in-progress, complete, or aborted."
                );
            }
        }

        String manifestUrl = params.urlValue("manifestUrl");
        if (status == null && manifestUrl == null) {
            throw BulkSubmitException.invalid("Either submissionStatus or manifestUrl SHALL be populated");
        }

        String outputFormat = params.stringValue("outputFormat");
        if (outputFormat == null) {
            outputFormat = DEFAULT_OUTPUT_FORMAT;
        }
        String normalizedFormat = outputFormat.toLowerCase(Locale.ROOT);
        if (!normalizedFormat.startsWith("application/fhir+ndjson")
            && !normalizedFormat.startsWith("application/ndjson")
            && !normalizedFormat.startsWith("ndjson")) {
            throw BulkSubmitException.invalid(
                "Invalid outputFormat parameter. Only ndjson formats are supported by this server."
            );
        }

        String fhirBaseUrl = params.urlValue("FHIRBaseUrl");
        if (fhirBaseUrl == null) {
            fhirBaseUrl = params.urlValue("fhirBaseUrl");
        }

        return new BulkSubmitRequest(
            submitter,
            submissionId,
            status,
            manifestUrl,
            params.urlValue("replacesManifestUrl"),
            fhirBaseUrl,
            outputFormat,
            params.fileRequestHeaders()
        );
    }

    static void requireKickoffFormat(FhirParameters params) {
        String outputFormat = params.stringValue("_outputFormat");
        if (outputFormat != null && !KICKOFF_FORMATS.contains(outputFormat)) {
            throw BulkSubmitException.invalid(
                "Invalid _outputFormat parameter. Only ndjson formats are supported by this server."
            );
        }
    }

    SubmitterIdentity submitter() {
        JsonNode param = find("submitter");
        JsonNode identifier = param == null ? null : param.get("valueIdentifier");
        if (identifier == null || !identifier.isObject() || text(identifier.path("value")) == null) {
            throw BulkSubmitException.invalid("Missing or invalid submitter parameter");
        }
        return new SubmitterIdentity(text(identifier.path("system")), text(identifier.path("value")));
    }

    String submissionId() {
        String value = stringValue("submissionId");
        if (value == null) {
            throw BulkSubmitException.invalid("Missing or invalid submissionId parameter");
        }
        return value;
    }

    private Map<String, String> fileRequestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        for (JsonNode param : parameters) {
            if (!"fileRequestHeaders".equals(param.path("name").asText())) {
                continue;
            }
            String name = null;
            String value = null;
            for (JsonNode part : param.path("part")) {
                String partName = part.path("name").asText();
                if ("headerName".equals(partName)) {
                    name = text(part.path("valueString"));
                } else if ("headerValue".equals(partName)) {
                    value = text(part.path("valueString"));
                }
            }
            if (name == null || value == null) {
                throw BulkSubmitException.invalid("fileRequestHeaders requires both headerName and headerValue");
            }
            headers.put(name, value);
        }
        return headers;
    }

    private JsonNode find(String name) {
        for (JsonNode param : parameters) {
            if (name.equals(param.path("name").asText())) {
                return param;
            }
        }
        return null;
    }

    private String stringValue(String name) {
        JsonNode param = find(name);
        return param == null ? null : text(param.path("valueString"));
    }

    private String urlValue(String name) {
        JsonNode param = find(name);
        if (param == null) {
            return null;
        }
        String value = text(param.path("valueString"));
        if (value == null) {
            value = text(param.path("valueUrl"));
        }
        if (value == null) {
            value = text(param.path("valueUri"));
        }
        return value;
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
