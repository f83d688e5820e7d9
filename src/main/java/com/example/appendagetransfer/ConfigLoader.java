package com.example.appendagetransfer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class ConfigLoader {
    private static final int DEFAULT_MAX_ATTEMPTS = 5;
    private static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 500;
    private static final long DEFAULT_MAX_BACKOFF_MILLIS = 30_000;
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    private static final long DEFAULT_ONLINE_TIMEOUT_MILLIS = 60_000;
    private static final long DEFAULT_POLL_INTERVAL_MILLIS = 2_000;
    private static final String DEFAULT_FRAME_PATTERN = "^(.*?)(\\d+)(\\.[A-Za-z0-9]+)$";
    private static final int DEFAULT_MIN_SEQUENCE_LENGTH = 2;
    private static final double DEFAULT_SEQUENCE_FPS = 24.0;
    private static final List<String> DEFAULT_SEQUENCE_EXTENSIONS = List.of(
            "png", "jpg", "jpeg", "exr", "dpx", "tif", "tiff", "tga", "bmp", "cin", "hdr", "jp2", "psd"
    );
    private static final int EMPTY_STATUS_ID = -1;
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            ".git"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public TransferConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        return fromRaw(raw);
    }

    TransferConfig fromRaw(RawConfig raw) {
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        RetryPolicy retryPolicy = new RetryPolicy(
                positive(raw.maxAttempts, DEFAULT_MAX_ATTEMPTS),
                Duration.ofMillis(nonNegative(raw.initialBackoffMillis, DEFAULT_INITIAL_BACKOFF_MILLIS)),
                Duration.ofMillis(nonNegative(raw.maxBackoffMillis, DEFAULT_MAX_BACKOFF_MILLIS)),
                raw.backoffMultiplier != null && raw.backoffMultiplier >= 1.0
                        ? raw.backoffMultiplier
                        : DEFAULT_BACKOFF_MULTIPLIER
        );
        Optional<Duration> unitTimeout = Optional.ofNullable(raw.unitTimeoutMillis)
                .filter(value -> value > 0)
                .map(Duration::ofMillis);
        Set<Integer> transientStatusCodes = raw.transientStatusCodes == null || raw.transientStatusCodes.isEmpty()
                ? defaultTransientStatusCodes()
                : Set.copyOf(raw.transientStatusCodes);

        boolean awaitOnline = raw.awaitOnline != null && raw.awaitOnline;
        Duration onlineTimeout = Duration.ofMillis(positive(raw.onlineTimeoutMillis, DEFAULT_ONLINE_TIMEOUT_MILLIS));
        Duration pollInterval = Duration.ofMillis(positive(raw.pollIntervalMillis, DEFAULT_POLL_INTERVAL_MILLIS));

        String framePattern = optionalString(raw.framePattern, DEFAULT_FRAME_PATTERN);
        validateFramePattern(framePattern);
        int minSequenceLength = raw.minSequenceLength != null && raw.minSequenceLength >= 2
                ? raw.minSequenceLength
                : DEFAULT_MIN_SEQUENCE_LENGTH;
        List<String> sequenceExtensions = raw.sequenceExtensions == null || raw.sequenceExtensions.isEmpty()
                ? DEFAULT_SEQUENCE_EXTENSIONS
                : raw.sequenceExtensions.stream().map(ext -> ext.replaceFirst("^\\.", "").toLowerCase()).toList();
        double sequenceFps = raw.sequenceFps != null && raw.sequenceFps > 0 ? raw.sequenceFps : DEFAULT_SEQUENCE_FPS;
        boolean followLinks = raw.followLinks != null && raw.followLinks;

        List<String> excludeFilePatterns = mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns);
        List<String> excludeDirectoryPatterns = mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns);

        String appendageMessage = raw.appendageMessage == null ? "" : raw.appendageMessage;
        int statusId = raw.statusId == null ? EMPTY_STATUS_ID : raw.statusId;

        Optional<Path> reportDirectory = Optional.ofNullable(raw.reportDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }
        if (s3SyncEnabled && reportDirectory.isEmpty()) {
            throw new IllegalArgumentException("reportDirectory is required when s3SyncEnabled is true.");
        }

        return new TransferConfig(
                threadCount,
                retryPolicy,
                unitTimeout,
                transientStatusCodes,
                awaitOnline,
                onlineTimeout,
                pollInterval,
                framePattern,
                minSequenceLength,
                sequenceExtensions,
                sequenceFps,
                followLinks,
                excludeFilePatterns,
                excludeDirectoryPatterns,
                appendageMessage,
                statusId,
                reportDirectory,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private static Set<Integer> defaultTransientStatusCodes() {
        Set<Integer> codes = new TreeSet<>(List.of(408, 429));
        for (int status = 500; status < 600; status++) {
            codes.add(status);
        }
        // 507 means the storage quota is exhausted, which retrying cannot fix.
        codes.remove(507);
        return Set.copyOf(codes);
    }

    private void validateFramePattern(String framePattern) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(framePattern);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("framePattern is not a valid regular expression: " + framePattern, ex);
        }
        if (compiled.matcher("").groupCount() != 3) {
            throw new IllegalArgumentException("framePattern needs exactly 3 groups (prefix, frame, extension).");
        }
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private int positive(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private long positive(Long value, long fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private long nonNegative(Long value, long fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    static class RawConfig {
        public Integer threadCount;
        public Integer maxAttempts;
        public Long initialBackoffMillis;
        public Long maxBackoffMillis;
        public Double backoffMultiplier;
        public Long unitTimeoutMillis;
        public List<Integer> transientStatusCodes;
        public Boolean awaitOnline;
        public Long onlineTimeoutMillis;
        public Long pollIntervalMillis;
        public String framePattern;
        public Integer minSequenceLength;
        public List<String> sequenceExtensions;
        public Double sequenceFps;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public String appendageMessage;
        public Integer statusId;
        public String reportDirectory;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
