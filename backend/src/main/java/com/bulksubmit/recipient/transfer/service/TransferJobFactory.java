package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.fetch.ManifestFetcher;
import com.bulksubmit.recipient.transfer.http.FileHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

@Component
public class TransferJobFactory {
    private final FileHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService transferExecutor;
    private final ExecutorService downloadExecutor;

    public TransferJobFactory(
        FileHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("transferExecutor") ExecutorService transferExecutor,
        @Qualifier("downloadExecutor") ExecutorService downloadExecutor
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.transferExecutor = transferExecutor;
        this.downloadExecutor = downloadExecutor;
    }

    public TransferJob create(
        Submission submission,
        String manifestUrl,
        String fhirBaseUrl,
        String outputFormat,
        Map<String, String> fileRequestHeaders
    ) {
        String jobId = UUID.randomUUID().toString();
        Path destination = submission.getDirectory().resolve("jobs").resolve(jobId);
        ManifestFetcher fetcher = new ManifestFetcher(
            httpClient,
            objectMapper,
            destination,
            fhirBaseUrl,
            fileRequestHeaders,
            downloadExecutor
        );
        return new TransferJob(jobId, submission.getSubmissionId(), manifestUrl, outputFormat, fetcher, transferExecutor);
    }
}
