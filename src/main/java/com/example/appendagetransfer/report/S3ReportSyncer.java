package com.example.appendagetransfer.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Copies job reports to an S3 bucket from a background thread, keyed by their path
 * relative to the report directory. Upload failures are logged and do not affect the job.
 */
public final class S3ReportSyncer implements ReportSyncer {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ReportSyncer.class);
    private static final Path POISON = Path.of("");

    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final S3Client s3Client;
    private final Thread worker;
    private final Path reportDirectory;
    private final String bucket;
    private final String prefix;
    private volatile boolean closed;

    public S3ReportSyncer(Path reportDirectory, String bucket, String prefix, Optional<String> region) {
        this(reportDirectory, bucket, prefix, region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()));
    }

    S3ReportSyncer(Path reportDirectory, String bucket, String prefix, S3Client s3Client) {
        this.reportDirectory = reportDirectory.toAbsolutePath().normalize();
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("/+$", "");
        this.s3Client = s3Client;
        this.worker = new Thread(this::drain, "report-s3-sync");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void enqueue(Path report) {
        if (closed) {
            LOGGER.warn("Not syncing {} to S3, the syncer is closed.", report);
            return;
        }
        queue.offer(report);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(POISON);
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for pending report uploads.", ex);
        } finally {
            s3Client.close();
        }
    }

    String keyFor(Path report) {
        String relative = reportDirectory.relativize(report.toAbsolutePath().normalize()).toString().replace("\\", "/");
        return prefix.isEmpty() ? relative : prefix + "/" + relative;
    }

    private void drain() {
        try {
            while (true) {
                Path report = queue.take();
                if (report == POISON) {
                    return;
                }
                upload(report);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Report sync worker interrupted; pending reports stay local.", ex);
        }
    }

    private void upload(Path report) {
        String key = keyFor(report);
        try {
            s3Client.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(),
                    RequestBody.fromFile(report));
            LOGGER.info("Synced report {} to s3://{}/{}", report.getFileName(), bucket, key);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to sync report {} to S3", report, ex);
        }
    }
}
