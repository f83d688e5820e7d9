package com.example.appendagetransfer.report;

import com.example.appendagetransfer.model.JobResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes each finished {@link JobResult} to its own numbered JSON file
 * ({@code jobreport_000001.json}, ...) and hands the file to a {@link ReportSyncer}.
 * Numbering continues after the highest report already in the directory.
 */
public class JobReportWriter {
    private static final String PREFIX = "jobreport_";
    private static final Pattern REPORT_NAME = Pattern.compile(PREFIX + "(\\d+)\\.json");

    private final ObjectMapper mapper;
    private final Path reportDirectory;
    private final ReportSyncer syncer;
    private int nextSequence = -1;

    public JobReportWriter(ObjectMapper mapper, Path reportDirectory, ReportSyncer syncer) {
        this.mapper = mapper == null ? defaultMapper() : mapper;
        this.reportDirectory = reportDirectory;
        this.syncer = syncer == null ? ReportSyncer.noop() : syncer;
    }

    public synchronized Path write(JobResult result) throws IOException {
        Files.createDirectories(reportDirectory);
        if (nextSequence < 0) {
            nextSequence = highestExisting() + 1;
        }
        Path file = reportDirectory.resolve(String.format("%s%06d.json", PREFIX, nextSequence++));
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), result);
        syncer.enqueue(file);
        return file;
    }

    private int highestExisting() throws IOException {
        int highest = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(reportDirectory, PREFIX + "*.json")) {
            for (Path path : stream) {
                Matcher matcher = REPORT_NAME.matcher(path.getFileName().toString());
                if (matcher.matches()) {
                    highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
                }
            }
        }
        return highest;
    }

    private static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
