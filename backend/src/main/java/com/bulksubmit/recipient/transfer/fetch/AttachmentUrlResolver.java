package com.bulksubmit.recipient.transfer.fetch;

import java.net.URI;

public final class AttachmentUrlResolver {
    private AttachmentUrlResolver() {
    }

    public static String resolve(String attachmentUrl, String fhirBaseUrl, String fileUrl) {
        if (attachmentUrl.startsWith("http")) {
            return attachmentUrl;
        }
        String base = stripTrailingSlash(fhirBaseUrl);
        if (attachmentUrl.startsWith("/")) {
            return base + attachmentUrl;
        }
        if (attachmentUrl.startsWith(".")) {
            return URI.create(fileUrl).resolve(attachmentUrl).toString();
        }
        return base + "/" + attachmentUrl;
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
