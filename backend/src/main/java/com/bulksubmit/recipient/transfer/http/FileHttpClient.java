package com.bulksubmit.recipient.transfer.http;

import com.bulksubmit.recipient.config.RecipientProperties;
import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.RequestDescriptor;
import com.bulksubmit.recipient.transfer.model.ResponseDescriptor;
import com.bulksubmit.recipient.transfer.model.TransferErrorContext;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.bulksubmit.recipient.transfer.queue.CancellationSignal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

@Service
public class FileHttpClient {
    private static final Logger log = LoggerFactory.getLogger(FileHttpClient.class);
    private static final int MAX_ERROR_BODY_BYTES = 4096;

    private final RecipientProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public FileHttpClient(
        RecipientProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public JsonNode getJson(String url, Map<String, String> headers, CancellationSignal signal) {
        try (StreamedResponse response = open(url, "application/json,application/fhir+json;q=0.9,*/*;q=0.1", headers, signal)) {
            try {
                return objectMapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw new TransferException(
                    "Response from " + url + " is not valid JSON",
                    TransferErrorContext.of(IssueType.INVALID).withExchange(response.request(), response.response()),
                    e
                );
            }
        } catch (IOException e) {
            throw new TransferException(
                "Request to " + url + " failed: " + e.getMessage(),
                TransferErrorContext.of(IssueType.PROCESSING),
                e
            );
        }
    }

    /**
     * Opens a streaming GET. The caller owns the returned response and must close it. Cancelling
     * the signal closes the body stream so a blocked reader fails fast.
     */
    public StreamedResponse open(
        String url,
        String acceptHeader,
        Map<String, String> headers,
        CancellationSignal signal
    ) {
        Map<String, String> safeHeaders = headers == null ? Map.of() : headers;
        RequestDescriptor requestDescriptor = new RequestDescriptor("GET", url, safeHeaders);
        TransferErrorContext context = TransferErrorContext.of(IssueType.PROCESSING)
            .withExchange(requestDescriptor, null);

        URI uri = parseUri(url);
        if (uri == null || uri.getHost() == null) {
            throw new TransferException("Invalid URL " + url, context);
        }
        if (signal != null && signal.isCancelled()) {
            throw new TransferException("Request to " + url + " was aborted", context);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", acceptHeader == null || acceptHeader.isBlank() ? "*/*" : acceptHeader);
        for (Map.Entry<String, String> header : safeHeaders.entrySet()) {
            try {
                builder.setHeader(header.getKey(), header.getValue());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping request header {} for {}: {}", header.getKey(), url, e.getMessage());
            }
        }

        CompletableFuture<HttpResponse<InputStream>> pending =
            client.sendAsync(builder.GET().build(), HttpResponse.BodyHandlers.ofInputStream());
        Runnable releasePending = signal == null ? () -> { } : signal.onCancel(() -> pending.cancel(true));
        HttpResponse<InputStream> response;
        try {
            response = pending.get();
        } catch (CancellationException e) {
            throw new TransferException("Request to " + url + " was aborted", context, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new TransferException("Request to " + url + " timed out", context, cause);
            }
            throw new TransferException("Request to " + url + " failed: " + describe(cause), context, cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransferException("Request to " + url + " was interrupted", context, e);
        } finally {
            releasePending.run();
        }

        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String errorBody = readErrorBody(response.body());
            ResponseDescriptor failed = new ResponseDescriptor(response.uri(), response.statusCode(), contentType, errorBody);
            throw new TransferException(
                "Request to " + url + " failed with status " + response.statusCode(),
                context.withExchange(requestDescriptor, failed)
            );
        }

        InputStream body = response.body();
        Runnable release = signal == null ? () -> { } : signal.onCancel(() -> closeOnCancel(url, body));
        ResponseDescriptor descriptor = new ResponseDescriptor(response.uri(), response.statusCode(), contentType, null);
        return new StreamedResponse(requestDescriptor, descriptor, body, release);
    }

    public static Map<String, String> copyHeaders(Map<String, String> headers) {
        return headers == null ? Map.of() : new LinkedHashMap<>(headers);
    }

    private String readErrorBody(InputStream body) {
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(MAX_ERROR_BODY_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Failed to read error response body", e);
            return null;
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private void closeOnCancel(String url, InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close cancelled response for {}", url, e);
        }
    }

    private URI parseUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(input.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return uri;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
