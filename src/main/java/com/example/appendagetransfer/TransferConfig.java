package com.example.appendagetransfer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime settings for transfers.
 */
public record TransferConfig(
        int threadCount,
        RetryPolicy retryPolicy,
        Optional<Duration> unitTimeout,
        Set<Integer> transientStatusCodes,
        boolean awaitOnline,
        Duration onlineTimeout,
        Duration pollInterval,
        String framePattern,
        int minSequenceLength,
        List<String> sequenceExtensions,
        double sequenceFps,
        boolean followLinks,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        String appendageMessage,
        int statusId,
        Optional<Path> reportDirectory,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    /**
     * Settings used when no configuration file is given.
     */
    public static TransferConfig defaults() {
        return new ConfigLoader().fromRaw(new ConfigLoader.RawConfig());
    }

    public TransferConfig withThreadCount(int count) {
        return new TransferConfig(
                count, retryPolicy, unitTimeout, transientStatusCodes,
                awaitOnline, onlineTimeout, pollInterval,
                framePattern, minSequenceLength, sequenceExtensions, sequenceFps,
                followLinks, excludeFilePatterns, excludeDirectoryPatterns,
                appendageMessage, statusId,
                reportDirectory, s3SyncEnabled, s3Bucket, s3Prefix, s3Region);
    }

    public TransferConfig withRetryPolicy(RetryPolicy policy) {
        return new TransferConfig(
                threadCount, policy, unitTimeout, transientStatusCodes,
                awaitOnline, onlineTimeout, pollInterval,
                framePattern, minSequenceLength, sequenceExtensions, sequenceFps,
                followLinks, excludeFilePatterns, excludeDirectoryPatterns,
                appendageMessage, statusId,
                reportDirectory, s3SyncEnabled, s3Bucket, s3Prefix, s3Region);
    }

    public TransferConfig withUnitTimeout(Duration timeout) {
        return new TransferConfig(
                threadCount, retryPolicy, Optional.ofNullable(timeout), transientStatusCodes,
                awaitOnline, onlineTimeout, pollInterval,
                framePattern, minSequenceLength, sequenceExtensions, sequenceFps,
                followLinks, excludeFilePatterns, excludeDirectoryPatterns,
                appendageMessage, statusId,
                reportDirectory, s3SyncEnabled, s3Bucket, s3Prefix, s3Region);
    }

    public TransferConfig withOnlinePolling(boolean await, Duration timeout, Duration interval) {
        return new TransferConfig(
                threadCount, retryPolicy, unitTimeout, transientStatusCodes,
                await, timeout, interval,
                framePattern, minSequenceLength, sequenceExtensions, sequenceFps,
                followLinks, excludeFilePatterns, excludeDirectoryPatterns,
                appendageMessage, statusId,
                reportDirectory, s3SyncEnabled, s3Bucket, s3Prefix, s3Region);
    }

    public TransferConfig withReportDirectory(Path directory) {
        return new TransferConfig(
                threadCount, retryPolicy, unitTimeout, transientStatusCodes,
                awaitOnline, onlineTimeout, pollInterval,
                framePattern, minSequenceLength, sequenceExtensions, sequenceFps,
                followLinks, excludeFilePatterns, excludeDirectoryPatterns,
                appendageMessage, statusId,
                Optional.ofNullable(directory), s3SyncEnabled, s3Bucket, s3Prefix, s3Region);
    }
}
