package com.example.appendagetransfer.remote;

import java.io.IOException;

/**
 * Authenticated transport to the archive for one selected project. Login, session
 * renewal and connection handling belong to the implementation.
 */
@FunctionalInterface
public interface ArchiveSession {
    /**
     * Sends the request and returns the raw response, whatever its status.
     *
     * @throws IOException if the request could not be sent or the connection dropped
     */
    SessionResponse execute(SessionRequest request) throws IOException;
}
