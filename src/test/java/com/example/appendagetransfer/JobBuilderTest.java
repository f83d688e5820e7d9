package com.example.appendagetransfer;

import com.example.appendagetransfer.error.JobAbortedException;
import com.example.appendagetransfer.error.JobNotFoundException;
import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.NetworkException;
import com.example.appendagetransfer.error.RemoteRejectionException;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.ArchiveConstants;
import com.example.appendagetransfer.model.FileVersion;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.JobResult;
import com.example.appendagetransfer.model.TransferEvent;
import com.example.appendagetransfer.model.UnitResult;
import com.example.appendagetransfer.model.UnitStatus;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobBuilderTest {
    private static final JobRef JOB = JobRef.shotJob(10, 20, 30, 40);
    private static final byte[] PNG_HEADER = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 13, 'I', 'H', 'D', 'R'
    };

    private final InMemoryArchive archive = new InMemoryArchive().withJob(JOB);

    @Test
    void uploadedFolderDownloadsToTheSameTree() throws Exception {
        Path root = Files.createTempDirectory("builder-up").resolve("A");
        Files.createDirectories(root.resolve("B"));
        Files.createDirectories(root.resolve("empty"));
        Files.createDirectories(root.resolve("seq"));
        Files.writeString(root.resolve("B/file1.jpg"), "first file");
        Files.writeString(root.resolve("file2.png"), "second file");
        for (int frame = 1; frame <= 3; frame++) {
            Files.writeString(root.resolve(String.format("seq/plate.%04d.exr", frame)), "frame " + frame);
        }
        Path downloads = Files.createTempDirectory("builder-down");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult upload = builder.uploadFolder(JOB, root, false, null);
            assertTrue(upload.isComplete(), upload.units().toString());
            assertEquals(AppendageType.IMAGE_SEQUENCE, archive.appendage(archive.idOf("plate")).type());

            JobResult download = builder.downloadFolder(JOB, upload.root().getAppendageId(), downloads);
            assertTrue(download.isComplete(), download.units().toString());
        }

        assertEquals(snapshot(root), snapshot(downloads.resolve("A")));
    }

    @Test
    void repeatedFolderDownloadSkipsCompleteFiles() throws Exception {
        long folder = archive.seedFolder(ArchiveConstants.NO_PARENT, "delivery");
        archive.seedFile(folder, "a.txt", "alpha".getBytes(StandardCharsets.UTF_8), true);
        Path downloads = Files.createTempDirectory("builder-resume");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            builder.downloadFolder(JOB, folder, downloads);
            Files.writeString(downloads.resolve("delivery/a.txt"), "alp");
            JobResult repaired = builder.downloadFolder(JOB, folder, downloads);
            JobResult untouched = builder.downloadFolder(JOB, folder, downloads);

            assertEquals(UnitStatus.TRANSFERRED, repaired.units().get(1).getStatus());
            assertEquals(UnitStatus.SKIPPED, untouched.units().get(1).getStatus());
        }
        assertEquals("alpha", Files.readString(downloads.resolve("delivery/a.txt")));
    }

    @Test
    void explicitPreviewIsAttachedToTheUploadedFile() throws Exception {
        Path folder = Files.createTempDirectory("builder-preview");
        Path clip = Files.writeString(folder.resolve("clip.mov"), "movie");
        Path preview = Files.write(folder.resolve("clip_preview.png"), PNG_HEADER);

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult result = builder.uploadFile(JOB, clip, true, preview);

            assertTrue(result.isComplete());
            long id = result.root().getAppendageId();
            assertArrayEquals(PNG_HEADER, archive.preview(id));
            assertEquals("image/png", archive.previewType(id));
            assertArrayEquals("movie".getBytes(StandardCharsets.UTF_8), archive.content(id));
        }
    }

    @Test
    void framesUploadAsOneSequence() throws Exception {
        Path folder = Files.createTempDirectory("builder-seq");
        List<Path> frames = new ArrayList<>();
        for (int frame = 1; frame <= 4; frame++) {
            frames.add(Files.writeString(folder.resolve(String.format("comp_%03d.dpx", frame)), "f" + frame));
        }

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult result = builder.uploadImageSequence(JOB, frames, true, null);

            assertEquals(1, result.units().size());
            long id = result.root().getAppendageId();
            assertEquals(AppendageType.IMAGE_SEQUENCE, archive.appendage(id).type());
            assertEquals(List.of("comp_001.dpx", "comp_002.dpx", "comp_003.dpx", "comp_004.dpx"),
                    archive.listFrameNames(JOB, id));
            assertTrue(archive.appendage(id).hasPreviews());

            Path target = Files.createTempDirectory("builder-seq-down");
            JobResult download = builder.downloadImageSequence(JOB, id, target);
            assertTrue(download.isComplete());
            assertEquals("f3", Files.readString(target.resolve("comp_003.dpx")));
        }
    }

    @Test
    void previewCanBeReplacedLater() throws Exception {
        long id = archive.seedFile(ArchiveConstants.NO_PARENT, "still.tif", new byte[]{1, 2}, true);
        Path preview = Files.write(Files.createTempDirectory("builder-replace").resolve("p.png"), PNG_HEADER);

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            UnitResult result = builder.uploadPreview(JOB, id, preview);

            assertTrue(result.isSuccess());
            assertEquals(id, result.getAppendageId());
            assertArrayEquals(PNG_HEADER, archive.preview(id));
        }
    }

    @Test
    void downloadFileRefusesAnExistingDestination() throws Exception {
        long id = archive.seedFile(ArchiveConstants.NO_PARENT, "a.txt", new byte[]{1}, true);
        Path existing = Files.writeString(Files.createTempDirectory("builder-exists").resolve("a.txt"), "mine");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            assertThrows(LocalIoException.class, () -> builder.downloadFile(JOB, id, existing));
        }
        assertEquals("mine", Files.readString(existing));
        assertTrue(archive.log().stream().noneMatch(entry -> entry.startsWith("download:")));
    }

    @Test
    void downloadFileWritesTheOriginal() throws Exception {
        long id = archive.seedFile(ArchiveConstants.NO_PARENT, "a.txt", "payload".getBytes(StandardCharsets.UTF_8),
                true);
        Path target = Files.createTempDirectory("builder-file").resolve("nested/a.txt");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            UnitResult result = builder.downloadFile(JOB, id, target);

            assertEquals(UnitStatus.TRANSFERRED, result.getStatus());
        }
        assertEquals("payload", Files.readString(target));
    }

    @Test
    void previewOfAFolderDownloadsAsAFile() throws Exception {
        long folder = archive.seedFolder(ArchiveConstants.NO_PARENT, "plates");
        Path preview = Files.write(Files.createTempDirectory("builder-folder-preview").resolve("p.png"), PNG_HEADER);
        Path target = Files.createTempDirectory("builder-preview-dl").resolve("plates.png");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            builder.uploadPreview(JOB, folder, preview);
            UnitResult result = builder.downloadFile(JOB, folder, target, FileVersion.PREVIEW);

            assertEquals(UnitStatus.TRANSFERRED, result.getStatus());
        }
        assertArrayEquals(PNG_HEADER, Files.readAllBytes(target));
    }

    @Test
    void offlineOriginalCannotBeDownloaded() throws Exception {
        long id = archive.seedFile(ArchiveConstants.NO_PARENT, "raw.mov", new byte[]{1}, false);
        Path target = Files.createTempDirectory("builder-offline").resolve("raw.mov");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            RemoteRejectionException rejected = assertThrows(RemoteRejectionException.class,
                    () -> builder.downloadFile(JOB, id, target));
            assertEquals(RemoteRejectionException.Reason.CONFLICT, rejected.getReason());
        }
        assertFalse(Files.exists(target));
    }

    @Test
    void stillProcessingCountsAsSuccess() throws Exception {
        archive.pollsUntilOnline(1_000_000);
        Path file = Files.writeString(Files.createTempDirectory("builder-slow").resolve("big.exr"), "px");
        TransferConfig config = config().withOnlinePolling(true, Duration.ofMillis(50), Duration.ofMillis(5));

        try (JobBuilder builder = new JobBuilder(archive, config)) {
            JobResult result = builder.uploadFile(JOB, file, true, null);

            assertEquals(UnitStatus.STILL_PROCESSING, result.root().getStatus());
            assertTrue(result.isComplete());
            assertTrue(result.failures().isEmpty());
        }
    }

    @Test
    void awaitingOnlineReportsOnlineUnitsAsEvents() throws Exception {
        archive.pollsUntilOnline(2);
        Path file = Files.writeString(Files.createTempDirectory("builder-online").resolve("fast.jpg"), "px");
        TransferConfig config = config().withOnlinePolling(true, Duration.ofSeconds(5), Duration.ofMillis(5));

        try (JobBuilder builder = new JobBuilder(archive, config)) {
            TransferRun run = builder.startUploadFile(JOB, file, false, null);
            JobResult result = run.await();
            List<TransferEvent.Kind> kinds = run.events().map(TransferEvent::kind).toList();

            assertEquals(UnitStatus.ONLINE, result.root().getStatus());
            assertEquals(List.of(TransferEvent.Kind.STARTED, TransferEvent.Kind.TRANSFERRED,
                    TransferEvent.Kind.ONLINE, TransferEvent.Kind.FINISHED), kinds);
        }
    }

    @Test
    void unknownJobAbortsBeforeAnythingIsCreated() throws Exception {
        Path file = Files.writeString(Files.createTempDirectory("builder-nojob").resolve("x.txt"), "x");
        JobRef other = JobRef.assetJob(1, 1, 1);

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobAbortedException aborted = assertThrows(JobAbortedException.class,
                    () -> builder.uploadFile(other, file, false, null));
            assertTrue(aborted.getCause() instanceof JobNotFoundException);
            assertTrue(aborted.getPartialResult().units().isEmpty());
        }
        assertTrue(archive.log().stream().noneMatch(entry -> entry.startsWith("create:")));
    }

    @Test
    void missingLocalFileIsRejectedBeforeTheRunStarts() throws Exception {
        Path missing = Files.createTempDirectory("builder-missing").resolve("nothing.txt");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            assertThrows(LocalIoException.class, () -> builder.startUploadFile(JOB, missing, false, null));
        }
        assertTrue(archive.log().isEmpty());
    }

    @Test
    void finishedRunsAreWrittenAsReports() throws Exception {
        Path reports = Files.createTempDirectory("builder-reports");
        Path file = Files.writeString(Files.createTempDirectory("builder-report-src").resolve("r.txt"), "r");

        try (JobBuilder builder = new JobBuilder(archive, config().withReportDirectory(reports))) {
            builder.uploadFile(JOB, file, false, null);
        }
        assertTrue(Files.exists(reports.resolve("jobreport_000001.json")));
    }

    @Test
    void interruptedSequenceResumesItsUploadJob() throws Exception {
        Path folder = Files.createTempDirectory("builder-seq-retry");
        List<Path> frames = new ArrayList<>();
        for (int frame = 1; frame <= 3; frame++) {
            frames.add(Files.writeString(folder.resolve(String.format("bg_%02d.exr", frame)), "b" + frame));
        }
        archive.failNext("bg_02.exr", 1, () -> new NetworkException(503, "busy"));

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult result = builder.uploadImageSequence(JOB, frames, false, null);

            assertTrue(result.isComplete(), result.units().toString());
        }
        assertEquals(1, archive.uploadJobsOpened());
        assertEquals(1, archive.uploadAttempts("bg_01.exr"));
        assertEquals(2, archive.uploadAttempts("bg_02.exr"));
        assertEquals(1, archive.uploadAttempts("bg_03.exr"));
    }

    @Test
    void frameRequestOutsideTheSequenceFailsTheUnit() throws Exception {
        Path frame = Files.writeString(Files.createTempDirectory("builder-stray").resolve("fg_01.exr"), "f");
        archive.requestStrayFrame("secrets.txt");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult result = builder.uploadImageSequence(JOB, List.of(frame), false, null);

            assertFalse(result.root().isSuccess());
            assertEquals("RemoteRejectionException", result.root().getFailure().errorType());
        }
        assertFalse(archive.log().contains("upload:secrets.txt"));
    }

    @Test
    void remoteNamesCannotEscapeTheDownloadFolder() throws Exception {
        long folder = archive.seedFolder(ArchiveConstants.NO_PARENT, "delivery");
        archive.seedFile(folder, "../../escaped.txt", "x".getBytes(StandardCharsets.UTF_8), true);
        archive.seedFile(folder, "ok.txt", "fine".getBytes(StandardCharsets.UTF_8), true);
        Path downloads = Files.createTempDirectory("builder-escape").resolve("inner");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult result = builder.downloadFolder(JOB, folder, downloads);

            assertFalse(result.isComplete());
            assertEquals(1, result.diagnostics().size());
            assertEquals("delivery/../../escaped.txt", result.diagnostics().get(0).relativePath());
            assertTrue(result.diagnostics().get(0).error());
        }
        assertEquals("fine", Files.readString(downloads.resolve("delivery/ok.txt")));
        assertFalse(Files.exists(downloads.resolve("escaped.txt")));
        assertFalse(Files.exists(downloads.getParent().resolve("escaped.txt")));
        assertTrue(archive.log().stream().noneMatch(entry -> entry.contains("escaped")));
    }

    @Test
    void frameNamesCannotEscapeTheTargetFolder() throws Exception {
        Map<String, byte[]> frames = new LinkedHashMap<>();
        frames.put("p.1.exr", new byte[]{1});
        frames.put("../evil.exr", new byte[]{2});
        long id = archive.seedSequence(ArchiveConstants.NO_PARENT, "plate", frames);
        Path target = Files.createTempDirectory("builder-frame-escape").resolve("frames");

        try (JobBuilder builder = new JobBuilder(archive, config())) {
            JobResult result = builder.downloadImageSequence(JOB, id, target);

            assertFalse(result.isComplete());
            assertEquals("LocalIoException", result.root().getFailure().errorType());
        }
        assertFalse(Files.exists(target.resolveSibling("evil.exr")));
    }

    private static TransferConfig config() {
        return TransferConfig.defaults()
                .withThreadCount(4)
                .withRetryPolicy(new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2), 2.0));
    }

    private static Map<String, String> snapshot(Path root) throws IOException {
        Map<String, String> entries = new TreeMap<>();
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.toList()) {
                String relative = root.relativize(path).toString().replace('\\', '/');
                entries.put(relative, Files.isDirectory(path) ? "<dir>" : Files.readString(path));
            }
        }
        return entries;
    }
}
