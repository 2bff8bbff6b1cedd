package com.bulksubmit.recipient.transfer.api;

import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.SubmissionSummary;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import com.bulksubmit.recipient.transfer.service.BulkSubmitException;
import com.bulksubmit.recipient.transfer.service.BulkSubmitRequest;
import com.bulksubmit.recipient.transfer.service.BulkSubmitService;
import com.bulksubmit.recipient.transfer.service.StatusPollResult;
import com.bulksubmit.recipient.transfer.util.OperationOutcomes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.nio.file.Path;

@RestController
public class BulkSubmitController {
    static final MediaType FHIR_JSON = MediaType.valueOf("application/fhir+json");
    static final MediaType FHIR_NDJSON = MediaType.valueOf("application/fhir+ndjson");

    private final BulkSubmitService bulkSubmitService;
    private final ObjectMapper objectMapper;

    public BulkSubmitController(BulkSubmitService bulkSubmitService, ObjectMapper objectMapper) {
        this.bulkSubmitService = bulkSubmitService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/$bulk-submit")
    public ResponseEntity<ObjectNode> submit(@RequestBody(required = false) JsonNode body) {
        BulkSubmitRequest request = FhirParameters.readSubmitRequest(body);
        String message = bulkSubmitService.submit(request);
        return ResponseEntity.ok()
            .contentType(FHIR_JSON)
            .body(OperationOutcomes.diagnostics(objectMapper, "information", IssueType.INFORMATIONAL, message));
    }

    @PostMapping("/$bulk-submit-status")
    public ResponseEntity<ObjectNode> kickoffStatus(
        @RequestBody(required = false) JsonNode body,
        @RequestHeader(name = HttpHeaders.ACCEPT, required = false) String accept,
        @RequestHeader(name = "Prefer", required = false) String prefer
    ) {
        FhirParameters params = FhirParameters.of(body);
        SubmitterIdentity submitter = params.submitter();
        String submissionId = params.submissionId();
        FhirParameters.requireKickoffFormat(params);
        if (accept != null && !accept.isBlank() && !accept.trim().equals(FHIR_JSON.toString())) {
            throw BulkSubmitException.invalid("Invalid Accept header. Only application/fhir+json is supported by this server.");
        }
        if (prefer != null && !prefer.isBlank() && !prefer.trim().equals("respond-async")) {
            throw BulkSubmitException.invalid("Invalid Prefer header. Only respond-async is supported by this server.");
        }

        String statusUrl = bulkSubmitService.kickoff(submissionId, submitter);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .header(HttpHeaders.CONTENT_LOCATION, statusUrl)
            .header(HttpHeaders.CACHE_CONTROL, "no-cache")
            .header(HttpHeaders.PRAGMA, "no-cache")
            .header(HttpHeaders.EXPIRES, "0")
            .contentType(FHIR_JSON)
            .body(OperationOutcomes.diagnostics(
                objectMapper,
                "information",
                IssueType.INFORMATIONAL,
                "Check job status at " + statusUrl
            ));
    }

    @GetMapping("/$bulk-submit-status/{slug}")
    public ResponseEntity<ObjectNode> pollStatus(@PathVariable("slug") String slug) {
        StatusPollResult result = bulkSubmitService.pollStatus(slug);
        if (result.ready()) {
            return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(result.manifest());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .header("X-Progress", formatProgress(result.progress()) + "% processed")
            .build();
    }

    @GetMapping("/$bulk-submit-status/{slug}/summary")
    public SubmissionSummary summary(@PathVariable("slug") String slug) {
        return bulkSubmitService.summary(slug);
    }

    @GetMapping("/jobs/{slug}/files/{fileName}")
    public ResponseEntity<Resource> statusFile(
        @PathVariable("slug") String slug,
        @PathVariable("fileName") String fileName
    ) {
        Path file = bulkSubmitService.statusFile(slug, fileName);
        return ResponseEntity.ok()
            .contentType(FHIR_NDJSON)
            .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + fileName + "\"")
            .body(new FileSystemResource(file));
    }

    static String formatProgress(double progress) {
        return BigDecimal.valueOf(progress).stripTrailingZeros().toPlainString();
    }
}
