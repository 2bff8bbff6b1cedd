package com.bulksubmit.recipient.transfer.http;

import com.bulksubmit.recipient.transfer.model.RequestDescriptor;
import com.bulksubmit.recipient.transfer.model.ResponseDescriptor;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

public final class StreamedResponse implements Closeable {
    private final RequestDescriptor request;
    private final ResponseDescriptor response;
    private final InputStream body;
    private final Runnable release;

    StreamedResponse(RequestDescriptor request, ResponseDescriptor response, InputStream body, Runnable release) {
        this.request = request;
        this.response = response;
        this.body = body;
        this.release = release;
    }

    public RequestDescriptor request() {
        return request;
    }

    public ResponseDescriptor response() {
        return response;
    }

    public InputStream body() {
        return body;
    }

    public String contentType() {
        return response.contentType();
    }

    @Override
    public void close() throws IOException {
        release.run();
        body.close();
    }
}
