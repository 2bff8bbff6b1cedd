package com.bulksubmit.recipient.transfer.model;

import java.net.URI;

public record ResponseDescriptor(
    URI finalUri,
    int statusCode,
    String contentType,
    String body
) {
}
