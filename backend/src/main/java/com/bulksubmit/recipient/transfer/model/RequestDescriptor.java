package com.bulksubmit.recipient.transfer.model;

import java.util.Map;

public record RequestDescriptor(
    String method,
    String url,
    Map<String, String> headers
) {
}
