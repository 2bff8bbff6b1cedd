package com.bulksubmit.recipient.transfer.util;

import com.bulksubmit.recipient.transfer.model.IssueType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;

public final class OperationOutcomes {
    public static final String RELATED_ARTIFACT_EXTENSION =
        "http://hl7.org/fhir/StructureDefinition/artifact-relatedArtifact";

    private OperationOutcomes() {
    }

    /**
     * Builds a response outcome with a single issue whose text goes into {@code diagnostics}.
     */
    public static ObjectNode diagnostics(ObjectMapper mapper, String severity, IssueType code, String message) {
        ObjectNode outcome = mapper.createObjectNode();
        outcome.put("resourceType", "OperationOutcome");
        ObjectNode issue = outcome.putArray("issue").addObject();
        issue.put("severity", severity);
        issue.put("code", code.code());
        issue.put("diagnostics", message);
        return outcome;
    }

    /**
     * Builds the outcome recorded for a failed transfer: a single issue carrying the message as
     * {@code details.text}, plus a related-artifact extension when the failure concerns a
     * specific resource.
     */
    public static ObjectNode forTransferError(ObjectMapper mapper, IssueType code, String message, JsonNode resource) {
        ObjectNode outcome = mapper.createObjectNode();
        outcome.put("resourceType", "OperationOutcome");
        outcome.put("id", UUID.randomUUID().toString());
        ObjectNode issue = outcome.putArray("issue").addObject();
        issue.put("severity", "error");
        issue.put("code", code == null ? IssueType.PROCESSING.code() : code.code());
        issue.putObject("details").put("text", message);
        if (resource != null && resource.isObject()) {
            ArrayNode extensions = outcome.putArray("extension");
            ObjectNode extension = extensions.addObject();
            extension.put("url", RELATED_ARTIFACT_EXTENSION);
            ObjectNode artifact = extension.putObject("valueRelatedArtifact");
            artifact.put("type", "comments-on");
            artifact.put(
                "resourceReference",
                resource.path("resourceType").asText("undefined") + "/" + resource.path("id").asText("undefined")
            );
        }
        return outcome;
    }
}
