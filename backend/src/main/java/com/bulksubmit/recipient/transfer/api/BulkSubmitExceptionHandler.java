package com.bulksubmit.recipient.transfer.api;

import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.service.BulkSubmitException;
import com.bulksubmit.recipient.transfer.util.OperationOutcomes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class BulkSubmitExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(BulkSubmitExceptionHandler.class);

  private final ObjectMapper objectMapper;

  public BulkSubmitExceptionHandler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @ExceptionHandler(BulkSubmitException.class)
  public ResponseEntity<ObjectNode> handleBulkSubmit(BulkSubmitException ex) {
    if (ex.getStatus().is5xxServerError()) {
      log.warn("Bulk submit request failed: {}", ex.getMessage());
    }
    return ResponseEntity.status(ex.getStatus())
        .contentType(BulkSubmitController.FHIR_JSON)
        .body(OperationOutcomes.diagnostics(objectMapper, "error", ex.getIssueType(), ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ObjectNode> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(BulkSubmitController.FHIR_JSON)
        .body(OperationOutcomes.diagnostics(
            objectMapper,
            "error",
            IssueType.INVALID,
            "Invalid request body. Expected a FHIR Parameters resource."
        ));
  }
}
