package com.bulksubmit.recipient.transfer.fetch;

import com.bulksubmit.recipient.transfer.http.FileHttpClient;
import com.bulksubmit.recipient.transfer.http.StreamedResponse;
import com.bulksubmit.recipient.transfer.model.ExportManifest;
import com.bulksubmit.recipient.transfer.model.ExportType;
import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.ManifestFile;
import com.bulksubmit.recipient.transfer.model.RequestDescriptor;
import com.bulksubmit.recipient.transfer.model.ResponseDescriptor;
import com.bulksubmit.recipient.transfer.model.TransferErrorContext;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.bulksubmit.recipient.transfer.queue.CancellationSignal;
import com.bulksubmit.recipient.transfer.queue.TaskQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Downloads every file listed in a bulk export manifest into a destination directory, validating
 * each NDJSON resource on the way. Files are processed one at a time through a {@link TaskQueue};
 * problems with individual files or attachments are reported to listeners and never stop the run.
 */
public class ManifestFetcher {
    private static final Logger log = LoggerFactory.getLogger(ManifestFetcher.class);
    private static final String NDJSON_ACCEPT = "application/fhir+ndjson,application/ndjson;q=0.9,*/*;q=0.1";
    private static final String DOCUMENTS_FOLDER = "documents";

    private final FileHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Path destinationDir;
    private final String fhirBaseUrl;
    private final Map<String, String> fileRequestHeaders;
    private final TaskQueue<Integer> queue;
    private final List<ManifestFetcherListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicInteger downloaded = new AtomicInteger();

    private volatile int total;
    private volatile CancellationSignal requestSignal = new CancellationSignal();
    private volatile CompletableFuture<Void> allDownloaded;

    public ManifestFetcher(
        FileHttpClient httpClient,
        ObjectMapper objectMapper,
        Path destinationDir,
        String fhirBaseUrl,
        Map<String, String> fileRequestHeaders,
        Executor downloadExecutor
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.destinationDir = destinationDir;
        this.fhirBaseUrl = fhirBaseUrl;
        this.fileRequestHeaders = FileHttpClient.copyHeaders(fileRequestHeaders);
        this.queue = new TaskQueue<>(downloadExecutor);
    }

    public void addListener(ManifestFetcherListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ManifestFetcherListener listener) {
        listeners.remove(listener);
    }

    public String status() {
        if (aborted.get()) {
            return "Download aborted";
        }
        int totalFiles = total;
        if (totalFiles == 0) {
            return "No files to download";
        }
        int done = downloaded.get();
        if (done == totalFiles) {
            return "All files downloaded";
        }
        return "Downloaded " + done + " of " + totalFiles + " files";
    }

    /**
     * Blocks until the manifest and all of its files have been processed or the fetcher is
     * aborted. Always finishes by notifying {@code onComplete} exactly once.
     */
    public void run(String manifestUrl) {
        if (aborted.get()) {
            log.debug("Fetcher for {} was aborted before it started", manifestUrl);
            emit(ManifestFetcherListener::onComplete);
            return;
        }
        emit(ManifestFetcherListener::onStart);
        try {
            ExportManifest manifest = fetchManifest(manifestUrl, requestSignal);
            downloadAllFiles(manifest, manifestUrl);
        } catch (TransferException e) {
            if (!aborted.get()) {
                emit(listener -> listener.onError(e));
            }
        } catch (RuntimeException e) {
            if (!aborted.get()) {
                TransferException wrapped = new TransferException(
                    e.getMessage(),
                    TransferErrorContext.of(IssueType.EXCEPTION),
                    e
                );
                emit(listener -> listener.onError(wrapped));
            }
        }
        emit(ManifestFetcherListener::onComplete);
    }

    /**
     * Clears a previous abort so the next {@link #run} downloads again. Must not be called while a
     * run is in flight.
     */
    public void reset() {
        aborted.set(false);
    }

    public void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        emit(ManifestFetcherListener::onAbort);
        queue.abortAll();
        CancellationSignal previous = requestSignal;
        requestSignal = new CancellationSignal();
        previous.cancel();
        CompletableFuture<Void> waiting = allDownloaded;
        if (waiting != null) {
            waiting.cancel(false);
        }
    }

    /**
     * Deletes the NDJSON files previously written for the given manifest. Returns how many files
     * were removed. Failures for individual files are reported to listeners.
     */
    public int undoAll(String manifestUrl) {
        ExportManifest manifest = fetchManifest(manifestUrl, new CancellationSignal());
        int removed = 0;
        for (ExportType exportType : ExportType.values()) {
            for (ManifestFile file : manifest.filesOf(exportType)) {
                try {
                    Path target = targetFile(file, exportType, manifestUrl);
                    if (Files.deleteIfExists(target)) {
                        removed++;
                    }
                } catch (IOException | RuntimeException e) {
                    TransferException error = new TransferException(
                        "Failed to remove file " + file.url() + ": " + e.getMessage(),
                        TransferErrorContext.of(IssueType.PROCESSING),
                        e
                    );
                    emit(listener -> listener.onError(error));
                }
            }
        }
        log.debug("Rolled back {} files for manifest {}", removed, manifestUrl);
        return removed;
    }

    private ExportManifest fetchManifest(String manifestUrl, CancellationSignal signal) {
        JsonNode body;
        try {
            body = httpClient.getJson(manifestUrl, fileRequestHeaders, signal);
        } catch (TransferException e) {
            throw new TransferException(
                "Failed to download manifest: " + e.getMessage(),
                e.getContext().withIssueType(IssueType.NOT_FOUND),
                e
            );
        }
        ManifestValidator.validate(body);
        try {
            return objectMapper.treeToValue(body, ExportManifest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransferException(
                "Manifest could not be read: " + e.getMessage(),
                TransferErrorContext.of(IssueType.INVALID),
                e
            );
        }
    }

    private void downloadAllFiles(ExportManifest manifest, String manifestUrl) {
        queue.abortAll();
        downloaded.set(0);
        total = manifest.fileCount();
        if (total == 0) {
            return;
        }

        CompletableFuture<Void> done = new CompletableFuture<>();
        allDownloaded = done;
        int expected = total;
        Runnable advance = () -> {
            int current = downloaded.incrementAndGet();
            emit(listener -> listener.onProgress(current, expected));
            if (current == expected) {
                done.complete(null);
            }
        };
        Consumer<Integer> onSuccess = count -> advance.run();
        Consumer<Throwable> onFailure = failure -> {
            if (!aborted.get()) {
                TransferException error = new TransferException(
                    "File task failed: " + failure,
                    TransferErrorContext.of(IssueType.EXCEPTION),
                    failure
                );
                log.warn("{}", error.getMessage());
                emit(listener -> listener.onError(error));
            }
            advance.run();
        };
        queue.addSuccessListener(onSuccess);
        queue.addErrorListener(onFailure);
        try {
            if (aborted.get()) {
                return;
            }
            for (ExportType exportType : ExportType.values()) {
                for (ManifestFile file : manifest.filesOf(exportType)) {
                    queue.enqueue(signal -> downloadFile(file, exportType, manifestUrl, signal));
                }
            }
            awaitAll(done);
        } finally {
            queue.removeSuccessListener(onSuccess);
            queue.removeErrorListener(onFailure);
            allDownloaded = null;
        }
    }

    private void awaitAll(CompletableFuture<Void> done) {
        try {
            done.get();
        } catch (CancellationException e) {
            log.debug("Download wait released by abort");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException("Download was interrupted", TransferErrorContext.of(IssueType.EXCEPTION), e);
        } catch (ExecutionException e) {
            throw new TransferException(
                "Download failed: " + e.getCause().getMessage(),
                TransferErrorContext.of(IssueType.EXCEPTION),
                e.getCause()
            );
        }
    }

    private Integer downloadFile(ManifestFile file, ExportType exportType, String manifestUrl, CancellationSignal signal) {
        if (aborted.get() || signal.isCancelled()) {
            return 0;
        }
        FileProgress progress = new FileProgress();
        String reportedUrl = file == null ? null : file.url();
        try {
            emit(listener -> listener.onDownloadStart(reportedUrl));
            String fileUrl = resolveFileUrl(file, manifestUrl);
            Path target = targetFile(file, exportType, manifestUrl);
            progress.filePath = target;
            Files.createDirectories(target.getParent());

            try (StreamedResponse response = httpClient.open(fileUrl, NDJSON_ACCEPT, fileRequestHeaders, signal);
                 BufferedWriter writer = Files.newBufferedWriter(
                     target,
                     StandardCharsets.UTF_8,
                     StandardOpenOption.CREATE,
                     StandardOpenOption.APPEND
                 )) {
                progress.request = response.request();
                progress.response = response.response();
                if (isJsonDocument(response.contentType())) {
                    writeDocument(response.body(), file, exportType, fileUrl, writer, progress, signal);
                } else if (isNdjson(response.contentType())) {
                    writeLines(response.body(), file, exportType, fileUrl, writer, progress, signal);
                } else {
                    throw new TransferException(
                        "Unsupported content type " + response.contentType(),
                        TransferErrorContext.of(IssueType.NOT_SUPPORTED)
                    );
                }
            }

            progress.resource = null;
            progress.issueType = IssueType.PROCESSING;
            if (file.count() != null && file.count() != progress.count) {
                throw new TransferException(
                    "File " + file.url() + " expected " + file.count() + " resources but got " + progress.count,
                    TransferErrorContext.of(IssueType.PROCESSING)
                );
            }
            log.debug("Downloaded {} resources from {}", progress.count, fileUrl);
            int count = progress.count;
            emit(listener -> listener.onDownloadComplete(reportedUrl, count));
        } catch (Exception e) {
            if (aborted.get()) {
                return progress.count;
            }
            TransferException error = fileError(file, e, progress);
            log.warn("{}", error.getMessage());
            emit(listener -> listener.onError(error));
        }
        return progress.count;
    }

    private void writeLines(
        InputStream body,
        ManifestFile file,
        ExportType exportType,
        String fileUrl,
        BufferedWriter writer,
        FileProgress progress,
        CancellationSignal signal
    ) throws IOException {
        NdjsonLineReader reader = new NdjsonLineReader(body);
        String line;
        while ((line = reader.nextRecord()) != null) {
            progress.lineNumber = reader.lineNumber();
            progress.resource = null;
            JsonNode resource;
            try {
                resource = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                progress.issueType = IssueType.INVALID;
                throw new TransferException(
                    "Invalid JSON on line " + progress.lineNumber + ": " + e.getOriginalMessage(),
                    TransferErrorContext.of(IssueType.INVALID),
                    e
                );
            }
            acceptResource(resource, file, exportType, fileUrl, writer, progress, signal);
        }
    }

    private void writeDocument(
        InputStream body,
        ManifestFile file,
        ExportType exportType,
        String fileUrl,
        BufferedWriter writer,
        FileProgress progress,
        CancellationSignal signal
    ) throws IOException {
        JsonNode document;
        try {
            document = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            progress.issueType = IssueType.INVALID;
            throw new TransferException(
                "Invalid JSON: " + e.getOriginalMessage(),
                TransferErrorContext.of(IssueType.INVALID),
                e
            );
        }
        List<JsonNode> resources = new ArrayList<>();
        if (document != null && document.isArray()) {
            document.forEach(resources::add);
        } else {
            resources.add(document);
        }
        for (int i = 0; i < resources.size(); i++) {
            progress.lineNumber = i + 1;
            acceptResource(resources.get(i), file, exportType, fileUrl, writer, progress, signal);
        }
    }

    private void acceptResource(
        JsonNode resource,
        ManifestFile file,
        ExportType exportType,
        String fileUrl,
        BufferedWriter writer,
        FileProgress progress,
        CancellationSignal signal
    ) throws IOException {
        progress.resource = resource;
        progress.issueType = IssueType.PROCESSING;
        String violation = FhirResourceValidator.findViolation(resource, file.type());
        if (violation != null) {
            progress.issueType = IssueType.INVALID;
            throw new TransferException(violation, TransferErrorContext.of(IssueType.INVALID));
        }
        writer.write(objectMapper.writeValueAsString(resource));
        writer.write('\n');
        progress.count++;

        if ("DocumentReference".equals(resource.path("resourceType").asText())) {
            downloadAttachments(resource, exportType, fileUrl, signal);
        }
    }

    private void downloadAttachments(JsonNode documentReference, ExportType exportType, String fileUrl, CancellationSignal signal) {
        JsonNode content = documentReference.get("content");
        if (content == null || !content.isArray()) {
            return;
        }
        String documentId = documentReference.path("id").asText();
        Path documentsDir = destinationDir.resolve(exportType.folder()).resolve(DOCUMENTS_FOLDER);
        for (JsonNode entry : content) {
            if (aborted.get() || signal.isCancelled()) {
                return;
            }
            JsonNode attachment = entry.get("attachment");
            if (attachment == null || !attachment.isObject()) {
                continue;
            }
            String url = attachment.path("url").asText("");
            String data = attachment.path("data").asText("");
            if (!url.isEmpty()) {
                downloadAttachment(url, documentId, documentsDir, fileUrl, signal);
            } else if (!data.isEmpty()) {
                saveInlineAttachment(data, attachment.path("contentType").asText(null), documentId, documentsDir);
            }
        }
    }

    private void downloadAttachment(String url, String documentId, Path documentsDir, String fileUrl, CancellationSignal signal) {
        try {
            String absoluteUrl = AttachmentUrlResolver.resolve(url, fhirBaseUrl, fileUrl);
            String name = basename(URI.create(absoluteUrl));
            if (name.isEmpty()) {
                name = "document-" + documentId;
            }
            Path target = insideDirectory(documentsDir, name);
            Files.createDirectories(documentsDir);
            try (StreamedResponse response = httpClient.open(absoluteUrl, "*/*", fileRequestHeaders, signal)) {
                Files.copy(response.body(), target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (Exception e) {
            if (aborted.get()) {
                return;
            }
            reportAttachmentError("Failed to download attachment from " + url + ": " + e.getMessage(), documentId, e);
        }
    }

    private void saveInlineAttachment(String data, String contentType, String documentId, Path documentsDir) {
        if (aborted.get()) {
            return;
        }
        try {
            Path target = insideDirectory(documentsDir, documentId + ContentTypeExtensions.forContentType(contentType));
            byte[] bytes = decodeBase64(data);
            Files.createDirectories(documentsDir);
            Files.write(target, bytes);
        } catch (IOException | RuntimeException e) {
            reportAttachmentError(
                "Failed to save inline attachment for DocumentReference " + documentId + ": " + e.getMessage(),
                documentId,
                e
            );
        }
    }

    private static Path insideDirectory(Path directory, String name) {
        Path base = directory.normalize();
        Path target = base.resolve(name).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new TransferException(
                "Attachment name " + name + " resolves outside " + base,
                TransferErrorContext.of(IssueType.PROCESSING)
            );
        }
        return target;
    }

    private static byte[] decodeBase64(String data) {
        if (data.indexOf('\n') >= 0 || data.indexOf('\r') >= 0) {
            return Base64.getMimeDecoder().decode(data);
        }
        return Base64.getDecoder().decode(data.strip());
    }

    private void reportAttachmentError(String message, String documentId, Exception cause) {
        ObjectNode reference = objectMapper.createObjectNode();
        reference.put("resourceType", "DocumentReference");
        reference.put("id", documentId);
        TransferException error = new TransferException(
            message,
            TransferErrorContext.of(IssueType.PROCESSING).withResource(reference, null),
            cause
        );
        log.warn("{}", message);
        emit(listener -> listener.onError(error));
    }

    private TransferException fileError(ManifestFile file, Exception e, FileProgress progress) {
        TransferErrorContext base = e instanceof TransferException transfer
            ? transfer.getContext()
            : TransferErrorContext.of(progress.issueType);
        RequestDescriptor request = base.request() != null ? base.request() : progress.request;
        ResponseDescriptor response = base.response() != null ? base.response() : progress.response;
        IssueType issueType = e instanceof TransferException transfer && transfer.getIssueType() != IssueType.PROCESSING
            ? transfer.getIssueType()
            : progress.issueType;
        TransferErrorContext context = base
            .withIssueType(issueType)
            .withExchange(request, response)
            .withFilePath(progress.filePath == null ? null : progress.filePath.toString())
            .withResource(progress.resource, progress.lineNumber > 0 ? progress.lineNumber : null);
        String name = file == null || file.url() == null ? "<missing url>" : basename(file.url());
        return new TransferException("Failed to download file " + name + ": " + e.getMessage(), context, e);
    }

    private String resolveFileUrl(ManifestFile file, String manifestUrl) {
        if (file.url() == null || file.url().isBlank()) {
            throw new TransferException("File entry is missing url", TransferErrorContext.of(IssueType.INVALID));
        }
        try {
            return URI.create(manifestUrl).resolve(file.url().trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new TransferException("Invalid file URL " + file.url(), TransferErrorContext.of(IssueType.INVALID), e);
        }
    }

    private Path targetFile(ManifestFile file, ExportType exportType, String manifestUrl) {
        String name = basename(URI.create(resolveFileUrl(file, manifestUrl)));
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new TransferException(
                "Cannot derive a file name from " + file.url(),
                TransferErrorContext.of(IssueType.INVALID)
            );
        }
        return destinationDir.resolve(exportType.folder()).resolve(name);
    }

    private static String basename(URI uri) {
        String path = uri.getPath();
        return basename(path == null ? "" : path);
    }

    private static String basename(String path) {
        String trimmed = path;
        int query = trimmed.indexOf('?');
        if (query >= 0) {
            trimmed = trimmed.substring(0, query);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static boolean isJsonDocument(String contentType) {
        String mime = mimeType(contentType);
        return mime.equals("application/json") || mime.equals("application/fhir+json");
    }

    private static boolean isNdjson(String contentType) {
        String mime = mimeType(contentType);
        return mime.isEmpty()
            || mime.endsWith("ndjson")
            || mime.equals("text/plain")
            || mime.equals("application/octet-stream");
    }

    private static String mimeType(String contentType) {
        if (contentType == null) {
            return "";
        }
        return contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    }

    private void emit(Consumer<ManifestFetcherListener> event) {
        for (ManifestFetcherListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Manifest fetcher listener failed", e);
            }
        }
    }

    private static final class FileProgress {
        private Path filePath;
        private RequestDescriptor request;
        private ResponseDescriptor response;
        private JsonNode resource;
        private IssueType issueType = IssueType.PROCESSING;
        private int lineNumber;
        private int count;
    }
}
