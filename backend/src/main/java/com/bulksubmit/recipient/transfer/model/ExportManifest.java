package com.bulksubmit.recipient.transfer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportManifest(
    String transactionTime,
    String request,
    boolean requiresAccessToken,
    List<ManifestFile> output,
    List<ManifestFile> deleted,
    List<ManifestFile> error
) {
    public List<ManifestFile> filesOf(ExportType exportType) {
        List<ManifestFile> files = switch (exportType) {
            case OUTPUT -> output;
            case DELETED -> deleted;
            case ERROR -> error;
        };
        return files == null ? List.of() : files;
    }

    public int fileCount() {
        int total = 0;
        for (ExportType exportType : ExportType.values()) {
            total += filesOf(exportType).size();
        }
        return total;
    }
}
