package com.example.appendagetransfer.model;

/**
 * Non-fatal finding of a tree walk. {@code error} marks findings that lost data
 * (an unreadable directory) as opposed to a policy fallback (a degraded sequence).
 */
public record WalkDiagnostic(
        String relativePath,
        String errorType,
        String message,
        boolean error
) {
}
