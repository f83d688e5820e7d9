package com.example.appendagetransfer.remote;

import com.example.appendagetransfer.error.AuthFailureException;
import com.example.appendagetransfer.error.JobNotFoundException;
import com.example.appendagetransfer.error.NetworkException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.error.RemoteRejectionException;
import com.example.appendagetransfer.error.RemoteRejectionException.Reason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Maps archive response statuses onto the remote error taxonomy. Which statuses count as
 * transient is configurable.
 */
public final class ResponseClassifier {
    static final int STATUS_SERVER_PROCESSING_ERROR = 299;
    static final int STATUS_PLEASE_AUTHENTICATE = 460;
    static final int STATUS_BAD_CREDENTIALS = 462;
    static final int STATUS_INSUFFICIENT_RIGHTS = 463;
    static final int STATUS_NOT_FOUND = 404;
    static final int STATUS_INSUFFICIENT_STORAGE = 507;

    private final Set<Integer> transientStatuses;
    private final ObjectMapper mapper;

    public ResponseClassifier(Set<Integer> transientStatuses, ObjectMapper mapper) {
        this.transientStatuses = Set.copyOf(transientStatuses);
        this.mapper = mapper;
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < STATUS_SERVER_PROCESSING_ERROR;
    }

    /**
     * Builds the exception for a non-success response. {@code jobLookup} marks requests
     * whose 404 means the job itself is missing.
     */
    public RemoteException classify(int status, String body, String path, boolean jobLookup) {
        if (status == STATUS_SERVER_PROCESSING_ERROR) {
            String message = serverMessage(body);
            Reason reason = message.toUpperCase(Locale.ROOT).contains("QUOTA") ? Reason.QUOTA : Reason.VALIDATION;
            return new RemoteRejectionException(reason, message);
        }
        if (status == STATUS_PLEASE_AUTHENTICATE || status == STATUS_BAD_CREDENTIALS) {
            return new AuthFailureException("Archive rejected the session (HTTP " + status + ") for " + path);
        }
        if (status == STATUS_INSUFFICIENT_RIGHTS) {
            return new RemoteRejectionException(Reason.PERMISSION, "Insufficient rights for " + path);
        }
        if (status == STATUS_NOT_FOUND) {
            if (jobLookup) {
                return new JobNotFoundException("No job at " + path);
            }
            return new RemoteRejectionException(Reason.NOT_FOUND, "Nothing at " + path);
        }
        if (status == STATUS_INSUFFICIENT_STORAGE) {
            return new RemoteRejectionException(Reason.QUOTA, "Storage quota exceeded for " + path);
        }
        if (transientStatuses.contains(status)) {
            return new NetworkException(status, path);
        }
        return new RemoteRejectionException(Reason.VALIDATION, "Unexpected status " + status + " for " + path);
    }

    public NetworkException connectionFailure(String path, IOException cause) {
        return new NetworkException("Connection failed for " + path + ": " + cause.getMessage(), cause);
    }

    private String serverMessage(String body) {
        if (body == null || body.isBlank()) {
            return "Server processing error";
        }
        try {
            JsonNode node = mapper.readTree(body);
            JsonNode error = node.get("ERROR");
            return error == null ? body : error.asText();
        } catch (IOException ex) {
            return body;
        }
    }
}
