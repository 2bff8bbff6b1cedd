package com.bulksubmit.recipient.transfer.fetch;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads newline-delimited records from a byte stream. Line breaks may fall anywhere in the
 * underlying chunks; a trailing record without a final newline is still returned.
 */
public class NdjsonLineReader implements Closeable {
    private final BufferedReader reader;
    private int lineNumber;

    public NdjsonLineReader(InputStream in) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /**
     * Returns the next non-blank line, or {@code null} at end of stream.
     */
    public String nextRecord() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (!line.isBlank()) {
                return line;
            }
        }
        return null;
    }

    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
