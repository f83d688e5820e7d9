package com.example.appendagetransfer.remote;

import java.nio.file.Path;
import java.util.Map;

/**
 * One request sent through an {@link ArchiveSession}. The body is either JSON text,
 * a local file streamed with {@code contentType}, or absent.
 */
public record SessionRequest(
        String method,
        String path,
        Map<String, String> headers,
        String contentType,
        String jsonBody,
        Path fileBody
) {
    public static final String JSON = "application/json";
    public static final String OCTET_STREAM = "application/octet-stream";

    public SessionRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (contentType == null) {
            contentType = fileBody != null ? OCTET_STREAM : JSON;
        }
    }

    public static SessionRequest get(String path) {
        return new SessionRequest("GET", path, Map.of(), JSON, null, null);
    }

    /**
     * GET that carries a JSON body, as the archive expects for lookups that need extra
     * arguments such as a custom owner id or a frame name.
     */
    public static SessionRequest get(String path, String body) {
        return new SessionRequest("GET", path, Map.of(), JSON, body, null);
    }

    public static SessionRequest json(String method, String path, String body) {
        return new SessionRequest(method, path, Map.of(), JSON, body, null);
    }

    public static SessionRequest file(String path, Path body, Map<String, String> headers) {
        return file(path, body, headers, OCTET_STREAM);
    }

    public static SessionRequest file(String path, Path body, Map<String, String> headers, String contentType) {
        return new SessionRequest("POST", path, headers, contentType, null, body);
    }
}
