package com.example.appendagetransfer.model;

/**
 * Server-side view of one media unit attached to a job. {@code online} turns true once
 * processing (including preview generation) has finished; {@code size} is 0 until the
 * first upload completes and holds the sum of all frames for image sequences.
 */
public record Appendage(
        long id,
        long parentId,
        String fileName,
        AppendageType type,
        MediaKind mediaKind,
        boolean online,
        boolean hasPreviews,
        long size
) {
}
