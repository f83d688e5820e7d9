package com.example.appendagetransfer.remote;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Status and body stream of a response. The body must be consumed or closed.
 */
public final class SessionResponse implements Closeable {
    private final int status;
    private final InputStream body;

    public SessionResponse(int status, InputStream body) {
        this.status = status;
        this.body = body == null ? InputStream.nullInputStream() : body;
    }

    public static SessionResponse of(int status, String body) {
        return new SessionResponse(status, new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    public int status() {
        return status;
    }

    public InputStream body() {
        return body;
    }

    public String bodyAsString() throws IOException {
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
