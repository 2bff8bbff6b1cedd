package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.bulksubmit.recipient.transfer.util.OperationOutcomes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-submission processing outcomes, one entry per source manifest. Successful files only
 * bump a counter; each error is appended to the entry's NDJSON file as an OperationOutcome.
 */
public class ErrorManifest {
    private final String submissionId;
    private final String slug;
    private final String baseUrl;
    private final Path filesDir;
    private final ObjectMapper objectMapper;
    private final Instant transactionTime = Instant.now();
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public ErrorManifest(String submissionId, String slug, String baseUrl, Path filesDir, ObjectMapper objectMapper) {
        this.submissionId = submissionId;
        this.slug = slug;
        this.baseUrl = baseUrl;
        this.filesDir = filesDir;
        this.objectMapper = objectMapper;
    }

    public Instant getTransactionTime() {
        return transactionTime;
    }

    public synchronized void addSuccess(String manifestUrl) throws IOException {
        entryFor(manifestUrl).success++;
    }

    public synchronized void addError(Throwable error, String manifestUrl) throws IOException {
        IssueType issueType = IssueType.PROCESSING;
        JsonNode resource = null;
        if (error instanceof TransferException transfer) {
            issueType = transfer.getIssueType();
            resource = transfer.getContext().resource();
        }
        ObjectNode outcome = OperationOutcomes.forTransferError(objectMapper, issueType, error.getMessage(), resource);
        Entry entry = entryFor(manifestUrl);
        Files.createDirectories(entry.file.getParent());
        Files.writeString(
            entry.file,
            objectMapper.writeValueAsString(outcome) + "\n",
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
        entry.error++;
    }

    public synchronized boolean hasManifestUrl(String manifestUrl) {
        return entries.containsKey(manifestUrl);
    }

    public synchronized void removeManifestUrl(String manifestUrl) throws IOException {
        Entry entry = entries.remove(manifestUrl);
        if (entry == null) {
            throw new IllegalArgumentException("No status entry exists for manifest " + manifestUrl);
        }
        Files.deleteIfExists(entry.file);
    }

    public synchronized int getSuccessCount(String manifestUrl) {
        Entry entry = entries.get(manifestUrl);
        return entry == null ? 0 : entry.success;
    }

    public synchronized int getErrorCount(String manifestUrl) {
        Entry entry = entries.get(manifestUrl);
        return entry == null ? 0 : entry.error;
    }

    public synchronized Optional<Path> findFile(String fileName) {
        for (Entry entry : entries.values()) {
            if (entry.fileName.equals(fileName)) {
                return Optional.of(entry.file);
            }
        }
        return Optional.empty();
    }

    public synchronized ObjectNode toManifest() {
        ObjectNode manifest = objectMapper.createObjectNode();
        manifest.putObject("extension").put("submissionId", submissionId);
        manifest.put("transactionTime", transactionTime.toString());
        manifest.put("request", baseUrl + "/$bulk-submit-status");
        manifest.put("requiresAccessToken", false);
        manifest.putArray("output");
        ArrayNode errors = manifest.putArray("error");
        for (Map.Entry<String, Entry> item : entries.entrySet()) {
            Entry entry = item.getValue();
            ObjectNode node = errors.addObject();
            node.put("type", "OperationOutcome");
            node.put("url", baseUrl + "/jobs/" + slug + "/files/" + entry.fileName);
            ObjectNode extension = node.putObject("extension");
            extension.put("manifestUrl", item.getKey());
            ObjectNode counts = extension.putObject("countSeverity");
            counts.put("success", entry.success);
            counts.put("error", entry.error);
        }
        return manifest;
    }

    private Entry entryFor(String manifestUrl) throws IOException {
        Entry existing = entries.get(manifestUrl);
        if (existing != null) {
            return existing;
        }
        String fileName = UUID.randomUUID() + ".ndjson";
        Path file = filesDir.resolve(fileName);
        Files.createDirectories(filesDir);
        Files.writeString(file, "", StandardCharsets.UTF_8);
        Entry entry = new Entry(fileName, file);
        entries.put(manifestUrl, entry);
        return entry;
    }

    private static final class Entry {
        private final String fileName;
        private final Path file;
        private int success;
        private int error;

        private Entry(String fileName, Path file) {
            this.fileName = fileName;
            this.file = file;
        }
    }
}
