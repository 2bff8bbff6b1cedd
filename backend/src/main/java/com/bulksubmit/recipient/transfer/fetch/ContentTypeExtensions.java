package com.bulksubmit.recipient.transfer.fetch;

import java.util.Locale;
import java.util.Map;

final class ContentTypeExtensions {
    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
        Map.entry("image/jpeg", ".jpg"),
        Map.entry("image/jpg", ".jpg"),
        Map.entry("image/png", ".png"),
        Map.entry("image/gif", ".gif"),
        Map.entry("image/bmp", ".bmp"),
        Map.entry("image/svg+xml", ".svg"),
        Map.entry("application/pdf", ".pdf"),
        Map.entry("application/msword", ".doc"),
        Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", ".docx"),
        Map.entry("text/plain", ".txt"),
        Map.entry("text/html", ".html"),
        Map.entry("application/xml", ".xml"),
        Map.entry("text/xml", ".xml"),
        Map.entry("application/json", ".json"),
        Map.entry("text/csv", ".csv")
    );

    private ContentTypeExtensions() {
    }

    static String forContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return "";
        }
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return EXTENSIONS.getOrDefault(mime, "");
    }
}
