package com.example.appendagetransfer.remote;

import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.error.RemoteRejectionException;
import com.example.appendagetransfer.model.Appendage;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.ArchiveConstants;
import com.example.appendagetransfer.model.FileVersion;
import com.example.appendagetransfer.model.JobKind;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.MediaKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ArchiveApi} over the archive's REST surface. Paths are relative to the API root of
 * the session's selected project; bodies are JSON except for uploaded and downloaded bytes.
 */
public final class RestArchiveApi implements ArchiveApi {
    private static final Logger LOGGER = LoggerFactory.getLogger(RestArchiveApi.class);
    private static final String IMAGE_SEQUENCE_COMPLETE = "IMAGESEQ**TRANSFER**COMPLETE";

    private final ArchiveSession session;
    private final ResponseClassifier classifier;
    private final ObjectMapper mapper;
    private final String messageText;
    private final int statusId;

    public RestArchiveApi(ArchiveSession session, ResponseClassifier classifier, String messageText, int statusId) {
        this.session = session;
        this.classifier = classifier;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.messageText = messageText == null ? "" : messageText;
        this.statusId = statusId;
    }

    @Override
    public void checkJob(JobRef job) throws RemoteException {
        String path = jobPath(job, "object");
        call(lookup(job, path), true);
    }

    @Override
    public long createAppendage(JobRef job, long parentId, AppendageType type, String name) throws RemoteException {
        if (type == AppendageType.IMAGE_SEQUENCE) {
            throw new IllegalArgumentException("Image sequences are created with createImageSequence");
        }
        Map<String, Object> body = messageBody(job, parentId, name);
        body.put("appendageType", type.code());
        String path = jobPath(job, "addAppendage");
        return parseId(call(SessionRequest.json("PUT", path, toJson(body)), false), path);
    }

    @Override
    public long createImageSequence(JobRef job, long parentId, String name, double fps) throws RemoteException {
        Map<String, Object> body = messageBody(job, parentId, name);
        body.put("fps", fps);
        String path = jobPath(job, "addImageSeqAppendage");
        return parseId(call(SessionRequest.json("PUT", path, toJson(body)), false), path);
    }

    @Override
    public void uploadContent(JobRef job, long appendageId, Path source, boolean createPreview)
            throws RemoteException, LocalIoException {
        requireReadable(source);
        String path = jobPath(job, "appendage", appendageId, "uploadSP", createPreview);
        call(SessionRequest.file(path, source, ownerHeaders(job)), false);
    }

    @Override
    public String initImageSequenceUpload(JobRef job, long sequenceId, List<String> frameNames, boolean createPreview)
            throws RemoteException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fileNameList", frameNames);
        addOwner(job, body);
        String path = jobPath(job, "appendage", sequenceId, "initImageSeqUpload", createPreview);
        String uploadJobId = call(SessionRequest.json("POST", path, toJson(body)), false).trim();
        if (uploadJobId.isEmpty()) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                    "Expected an upload job id from " + path);
        }
        return uploadJobId;
    }

    @Override
    public Optional<String> nextPendingFrame(String uploadJobId) throws RemoteException {
        String path = path("processImageSeqUpload", "uploadJob", uploadJobId, "next");
        return nextFrame(call(SessionRequest.get(path), false));
    }

    @Override
    public Optional<String> uploadFrame(String uploadJobId, String frameName, Path source)
            throws RemoteException, LocalIoException {
        requireReadable(source);
        String path = path("processImageSeqUpload", "uploadJob", uploadJobId);
        return nextFrame(call(SessionRequest.file(path, source, Map.of("filename", frameName)), false));
    }

    @Override
    public void uploadPreview(JobRef job, long appendageId, Path preview, String contentType)
            throws RemoteException, LocalIoException {
        requireReadable(preview);
        String path = jobPath(job, "appendage", appendageId, "uplPrevSP");
        String type = contentType == null || contentType.isBlank() ? SessionRequest.OCTET_STREAM : contentType;
        call(SessionRequest.file(path, preview, ownerHeaders(job), type), false);
    }

    @Override
    public Appendage fetchAppendage(JobRef job, long appendageId) throws RemoteException {
        String path = jobPath(job, "appendage", appendageId, "status");
        String body = call(lookup(job, path), false);
        try {
            return toAppendage(mapper.readValue(body, RawAppendage.class), path);
        } catch (JsonProcessingException ex) {
            throw malformed(path, ex);
        }
    }

    @Override
    public List<Appendage> listChildren(JobRef job, long folderId) throws RemoteException {
        String path = jobPath(job, "appendage", folderId, "children");
        String body = call(lookup(job, path), false);
        try {
            RawChildList raw = mapper.readValue(body, RawChildList.class);
            List<Appendage> children = new ArrayList<>();
            for (RawAppendage item : raw.items) {
                children.add(toAppendage(item, path));
            }
            return children;
        } catch (JsonProcessingException ex) {
            throw malformed(path, ex);
        }
    }

    @Override
    public List<String> listFrameNames(JobRef job, long sequenceId) throws RemoteException {
        String path = jobPath(job, "appendage", sequenceId, "getImageNames");
        String body = call(lookup(job, path), false);
        try {
            return List.of(mapper.readValue(body, String[].class));
        } catch (JsonProcessingException ex) {
            throw malformed(path, ex);
        }
    }

    @Override
    public InputStream openContent(JobRef job, long appendageId, FileVersion version) throws RemoteException {
        String path = jobPath(job, "appendage", appendageId, "dl", version.code());
        return open(lookup(job, path));
    }

    @Override
    public InputStream openFrame(JobRef job, long sequenceId, String frameName) throws RemoteException {
        Map<String, Object> body = new LinkedHashMap<>();
        addOwner(job, body);
        body.put("filename", frameName);
        String path = jobPath(job, "appendage", sequenceId, "dl-imageseq");
        return open(SessionRequest.get(path, toJson(body)));
    }

    /**
     * Builds a path from segments, each followed by a slash, below the job's base path.
     * A job addressed by custom owner id uses the {@code shot_c} or {@code asset_c} form,
     * with the id itself travelling in the request.
     */
    static String jobPath(JobRef job, Object... segments) {
        List<Object> parts = new ArrayList<>();
        if (job.kind() == JobKind.SHOT) {
            if (job.customAddressed()) {
                parts.addAll(List.of("shotList", "stage", "shot_c"));
            } else {
                parts.addAll(List.of("shotList", job.ownerIds().get(0), "stage", job.ownerIds().get(1),
                        "shot", job.ownerIds().get(2)));
            }
        } else if (job.customAddressed()) {
            parts.addAll(List.of("assetList", "asset_c"));
        } else {
            parts.addAll(List.of("assetList", job.ownerIds().get(0), "asset", job.ownerIds().get(1)));
        }
        parts.add("job");
        parts.add(job.id());
        parts.add(job.definitionId());
        parts.addAll(List.of(segments));
        return path(parts.toArray());
    }

    static String path(Object... segments) {
        StringBuilder builder = new StringBuilder();
        for (Object segment : segments) {
            builder.append(segment).append('/');
        }
        return builder.toString();
    }

    private SessionRequest lookup(JobRef job, String path) {
        if (!job.customAddressed()) {
            return SessionRequest.get(path);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        addOwner(job, body);
        return SessionRequest.get(path, toJson(body));
    }

    private InputStream open(SessionRequest request) throws RemoteException {
        SessionResponse response = execute(request);
        if (ResponseClassifier.isSuccess(response.status())) {
            return response.body();
        }
        throw failure(response, request.path(), false);
    }

    private static Optional<String> nextFrame(String body) {
        String next = body.trim();
        return next.isEmpty() || next.equals(IMAGE_SEQUENCE_COMPLETE) ? Optional.empty() : Optional.of(next);
    }

    private String call(SessionRequest request, boolean jobLookup) throws RemoteException {
        SessionResponse response = execute(request);
        try {
            if (ResponseClassifier.isSuccess(response.status())) {
                return response.bodyAsString();
            }
            throw failure(response, request.path(), jobLookup);
        } catch (IOException ex) {
            throw classifier.connectionFailure(request.path(), ex);
        }
    }

    private SessionResponse execute(SessionRequest request) throws RemoteException {
        LOGGER.debug("{} {}", request.method(), request.path());
        try {
            return session.execute(request);
        } catch (IOException ex) {
            throw classifier.connectionFailure(request.path(), ex);
        }
    }

    private RemoteException failure(SessionResponse response, String path, boolean jobLookup) {
        String body;
        try {
            body = response.bodyAsString();
        } catch (IOException ex) {
            LOGGER.debug("Could not read error body for {}", path, ex);
            body = "";
        }
        return classifier.classify(response.status(), body, path, jobLookup);
    }

    private Map<String, Object> messageBody(JobRef job, long parentId, String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", messageText);
        body.put("statusId", statusId);
        body.put("fileName", name);
        if (parentId != ArchiveConstants.NO_PARENT) {
            body.put("parentId", parentId);
        }
        addOwner(job, body);
        return body;
    }

    private static void addOwner(JobRef job, Map<String, Object> body) {
        if (job.customAddressed()) {
            body.put("customId", job.customOwnerId());
        }
    }

    private static Map<String, String> ownerHeaders(JobRef job) {
        return job.customAddressed() ? Map.of("customId", job.customOwnerId()) : Map.of();
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize request body", ex);
        }
    }

    private long parseId(String body, String path) throws RemoteException {
        try {
            return Long.parseLong(body.trim());
        } catch (NumberFormatException ex) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                    "Expected an appendage id from " + path + " but got '" + body + "'");
        }
    }

    private RemoteRejectionException malformed(String path, JsonProcessingException ex) {
        return malformed(path, ex.getOriginalMessage());
    }

    private static RemoteRejectionException malformed(String path, String detail) {
        return new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                "Malformed response from " + path + ": " + detail);
    }

    private static Appendage toAppendage(RawAppendage raw, String path) throws RemoteRejectionException {
        AppendageType type;
        try {
            type = AppendageType.fromCode(raw.appendageType);
        } catch (IllegalArgumentException ex) {
            throw malformed(path, ex.getMessage());
        }
        if (raw.fileName == null) {
            throw malformed(path, "appendage " + raw.appendageId + " has no file name");
        }
        return new Appendage(
                raw.appendageId,
                raw.parentId == null ? ArchiveConstants.NO_PARENT : raw.parentId,
                raw.fileName,
                type,
                MediaKind.fromCode(raw.mediaType),
                raw.online,
                raw.hasPreviews,
                raw.size
        );
    }

    private void requireReadable(Path path) throws LocalIoException {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new LocalIoException(path, "File missing or unreadable");
        }
    }

    private static class RawChildList {
        public List<RawAppendage> items = new ArrayList<>();
    }

    private static class RawAppendage {
        public long appendageId;
        public Long parentId;
        public String fileName;
        public int appendageType;
        public int mediaType;
        @JsonProperty("isOnline")
        public boolean online;
        @JsonProperty("hasPreviews")
        public boolean hasPreviews;
        public long size;
    }
}
