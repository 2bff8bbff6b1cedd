package com.bulksubmit.recipient.transfer.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Pattern;

public final class FhirResourceValidator {
    private static final Pattern FHIR_ID = Pattern.compile("[A-Za-z0-9\\-.]{1,64}");

    private FhirResourceValidator() {
    }

    /**
     * Returns a description of the first rule the resource breaks, or {@code null} when it is
     * acceptable for a file whose declared type is {@code expectedType}.
     */
    public static String findViolation(JsonNode resource, String expectedType) {
        if (resource == null || !resource.isObject()) {
            return "Resource is not an object";
        }
        JsonNode typeNode = resource.get("resourceType");
        String resourceType = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
        if (!FhirResourceTypes.isKnown(resourceType)) {
            return "Invalid FHIR resourceType: " + (typeNode == null || typeNode.isNull() ? "undefined" : typeNode.asText());
        }
        JsonNode idNode = resource.get("id");
        if (idNode == null || !idNode.isTextual() || !isValidId(idNode.asText())) {
            return "Resource ID is missing or invalid";
        }
        if (expectedType != null && !expectedType.isBlank() && !resourceType.equals(expectedType)) {
            return "Resource type " + resourceType + " does not match expected type " + expectedType;
        }
        return null;
    }

    /**
     * FHIR id grammar. Ids are also used as attachment file names, so {@code .} and {@code ..}
     * are refused.
     */
    public static boolean isValidId(String id) {
        return id != null && FHIR_ID.matcher(id).matches() && !id.equals(".") && !id.equals("..");
    }
}
