package com.example.appendagetransfer;

import com.example.appendagetransfer.error.AuthFailureException;
import com.example.appendagetransfer.error.JobNotFoundException;
import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.error.RemoteRejectionException;
import com.example.appendagetransfer.model.Appendage;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.ArchiveConstants;
import com.example.appendagetransfer.model.FileVersion;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.MediaKind;
import com.example.appendagetransfer.remote.ArchiveApi;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Archive kept in memory. Records the order of create and upload calls, tracks how many
 * uploads run at once and can be told to fail chosen names.
 */
class InMemoryArchive implements ArchiveApi {
    private final Set<JobRef> jobs = new HashSet<>();
    private final Map<Long, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Failure> failures = new HashMap<>();
    private final Map<String, UploadJob> uploadJobs = new HashMap<>();
    private final List<String> log = new ArrayList<>();
    private final AtomicLong nextId = new AtomicLong(100);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile boolean rejectSession;
    private volatile long uploadDelayMillis;
    private volatile int pollsUntilOnline;
    private String strayFrame;

    InMemoryArchive withJob(JobRef job) {
        jobs.add(job);
        return this;
    }

    void rejectSession() {
        rejectSession = true;
    }

    void uploadDelay(long millis) {
        uploadDelayMillis = millis;
    }

    /**
     * Appendages come online on this status fetch after their content arrived; 0 means at once.
     */
    void pollsUntilOnline(int polls) {
        pollsUntilOnline = polls;
    }

    /**
     * Makes the next {@code times} create or upload calls for {@code name} fail.
     */
    synchronized void failNext(String name, int times, Supplier<RemoteException> error) {
        failures.put(name, new Failure(times, error));
    }

    synchronized void failAlways(String name, Supplier<RemoteException> error) {
        failNext(name, Integer.MAX_VALUE, error);
    }

    /**
     * The next pending-frame lookup answers with {@code frameName} instead of a real frame.
     */
    synchronized void requestStrayFrame(String frameName) {
        strayFrame = frameName;
    }

    synchronized int uploadJobsOpened() {
        return uploadJobs.size();
    }

    synchronized String previewType(long id) throws RemoteRejectionException {
        return node(id).previewType;
    }

    synchronized List<String> log() {
        return List.copyOf(log);
    }

    int maxConcurrentUploads() {
        return maxInFlight.get();
    }

    synchronized int uploadAttempts(String name) {
        return (int) log.stream().filter(entry -> entry.equals("upload:" + name)).count();
    }

    synchronized byte[] content(long id) throws RemoteRejectionException {
        return node(id).content.get(null);
    }

    synchronized byte[] preview(long id) throws RemoteRejectionException {
        return node(id).preview;
    }

    synchronized long idOf(String fileName) {
        return nodes.values().stream()
                .filter(node -> node.name.equals(fileName))
                .mapToLong(node -> node.id)
                .findFirst()
                .orElseThrow();
    }

    synchronized Appendage appendage(long id) throws RemoteRejectionException {
        return node(id).toAppendage();
    }

    synchronized long seedFile(long parentId, String name, byte[] bytes, boolean online) {
        Node node = newNode(parentId, name, AppendageType.FILE);
        node.content.put(null, bytes);
        node.online = online;
        return node.id;
    }

    synchronized long seedFolder(long parentId, String name) {
        return newNode(parentId, name, AppendageType.FOLDER).id;
    }

    synchronized long seedSequence(long parentId, String name, Map<String, byte[]> frames) {
        Node node = newNode(parentId, name, AppendageType.IMAGE_SEQUENCE);
        node.frameNames.addAll(frames.keySet());
        node.content.putAll(frames);
        node.online = true;
        return node.id;
    }

    @Override
    public void checkJob(JobRef job) throws RemoteException {
        synchronized (this) {
            log.add("check:" + job);
        }
        if (rejectSession) {
            throw new AuthFailureException("Session rejected");
        }
        if (!jobs.contains(job)) {
            throw new JobNotFoundException(job);
        }
    }

    @Override
    public long createAppendage(JobRef job, long parentId, AppendageType type, String name) throws RemoteException {
        synchronized (this) {
            log.add("create:" + name);
            failIfScheduled(name);
            requireParent(parentId);
            Node node = newNode(parentId, name, type);
            if (type == AppendageType.FOLDER) {
                node.online = true;
            }
            return node.id;
        }
    }

    @Override
    public long createImageSequence(JobRef job, long parentId, String name, double fps) throws RemoteException {
        synchronized (this) {
            log.add("create:" + name);
            failIfScheduled(name);
            requireParent(parentId);
            return newNode(parentId, name, AppendageType.IMAGE_SEQUENCE).id;
        }
    }

    @Override
    public void uploadContent(JobRef job, long appendageId, Path source, boolean createPreview)
            throws RemoteException, LocalIoException {
        synchronized (this) {
            Node node = node(appendageId);
            log.add("upload:" + node.name);
            failIfScheduled(node.name);
        }
        byte[] bytes = receive(source);
        synchronized (this) {
            Node node = node(appendageId);
            node.content.put(null, bytes);
            node.serverPreview |= createPreview;
            arrived(node);
        }
    }

    @Override
    public synchronized String initImageSequenceUpload(JobRef job, long sequenceId, List<String> frameNames,
                                                       boolean createPreview) throws RemoteException {
        Node node = node(sequenceId);
        log.add("init:" + node.name);
        failIfScheduled("init:" + node.name);
        node.frameNames.clear();
        node.frameNames.addAll(frameNames);
        node.serverPreview |= createPreview;
        String uploadJobId = "uj-" + nextId.getAndIncrement();
        uploadJobs.put(uploadJobId, new UploadJob(sequenceId, frameNames));
        return uploadJobId;
    }

    @Override
    public synchronized Optional<String> nextPendingFrame(String uploadJobId) throws RemoteException {
        UploadJob uploadJob = uploadJob(uploadJobId);
        if (strayFrame != null) {
            String requested = strayFrame;
            strayFrame = null;
            return Optional.of(requested);
        }
        return uploadJob.pending.stream().findFirst();
    }

    @Override
    public Optional<String> uploadFrame(String uploadJobId, String frameName, Path source)
            throws RemoteException, LocalIoException {
        synchronized (this) {
            UploadJob uploadJob = uploadJob(uploadJobId);
            log.add("upload:" + frameName);
            if (!uploadJob.pending.contains(frameName)) {
                throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                        frameName + " is not pending in " + uploadJobId);
            }
            failIfScheduled(frameName);
        }
        byte[] bytes = receive(source);
        synchronized (this) {
            UploadJob uploadJob = uploadJob(uploadJobId);
            Node node = node(uploadJob.sequenceId);
            node.content.put(frameName, bytes);
            uploadJob.pending.remove(frameName);
            if (uploadJob.pending.isEmpty()) {
                arrived(node);
            }
            return uploadJob.pending.stream().findFirst();
        }
    }

    @Override
    public synchronized void uploadPreview(JobRef job, long appendageId, Path preview, String contentType)
            throws RemoteException, LocalIoException {
        Node node = node(appendageId);
        log.add("preview:" + node.name);
        failIfScheduled("preview:" + node.name);
        try {
            node.preview = Files.readAllBytes(preview);
            node.previewType = contentType;
        } catch (IOException ex) {
            throw new LocalIoException(preview, ex);
        }
    }

    @Override
    public synchronized Appendage fetchAppendage(JobRef job, long appendageId) throws RemoteException {
        Node node = node(appendageId);
        if (!node.online && node.pollsLeft > 0) {
            node.pollsLeft--;
            node.online = node.pollsLeft == 0;
        }
        return node.toAppendage();
    }

    @Override
    public synchronized List<Appendage> listChildren(JobRef job, long folderId) throws RemoteException {
        node(folderId);
        return nodes.values().stream()
                .filter(node -> node.parentId == folderId)
                .sorted(Comparator.comparing(node -> node.name))
                .map(Node::toAppendage)
                .toList();
    }

    @Override
    public synchronized List<String> listFrameNames(JobRef job, long sequenceId) throws RemoteException {
        return List.copyOf(node(sequenceId).frameNames);
    }

    @Override
    public synchronized InputStream openContent(JobRef job, long appendageId, FileVersion version)
            throws RemoteException {
        Node node = node(appendageId);
        log.add("download:" + node.name);
        byte[] bytes = version == FileVersion.ORIGINAL ? node.content.get(null) : node.preview;
        if (bytes == null) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.NOT_FOUND,
                    "No " + version + " content for " + node.name);
        }
        return new ByteArrayInputStream(bytes);
    }

    @Override
    public synchronized InputStream openFrame(JobRef job, long sequenceId, String frameName) throws RemoteException {
        Node node = node(sequenceId);
        log.add("download:" + frameName);
        byte[] bytes = node.content.get(frameName);
        if (bytes == null) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.NOT_FOUND,
                    "No frame " + frameName + " in " + node.name);
        }
        return new ByteArrayInputStream(bytes);
    }

    private byte[] receive(Path source) throws RemoteException, LocalIoException {
        int running = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(running, Math::max);
        try {
            byte[] bytes = Files.readAllBytes(source);
            if (uploadDelayMillis > 0) {
                Thread.sleep(uploadDelayMillis);
            }
            return bytes;
        } catch (IOException ex) {
            throw new LocalIoException(source, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION, "upload interrupted");
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void arrived(Node node) {
        node.pollsLeft = pollsUntilOnline;
        node.online = pollsUntilOnline == 0;
    }

    private UploadJob uploadJob(String uploadJobId) throws RemoteRejectionException {
        UploadJob uploadJob = uploadJobs.get(uploadJobId);
        if (uploadJob == null) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.NOT_FOUND,
                    "No upload job " + uploadJobId);
        }
        return uploadJob;
    }

    private void failIfScheduled(String name) throws RemoteException {
        Failure failure = failures.get(name);
        if (failure != null && failure.remaining > 0) {
            failure.remaining--;
            throw failure.error.get();
        }
    }

    private void requireParent(long parentId) throws RemoteException {
        if (parentId != ArchiveConstants.NO_PARENT) {
            Node parent = node(parentId);
            if (parent.type != AppendageType.FOLDER) {
                throw new RemoteRejectionException(RemoteRejectionException.Reason.VALIDATION,
                        parent.name + " is not a folder");
            }
        }
    }

    private Node node(long id) throws RemoteRejectionException {
        Node node = nodes.get(id);
        if (node == null) {
            throw new RemoteRejectionException(RemoteRejectionException.Reason.NOT_FOUND, "No appendage " + id);
        }
        return node;
    }

    private Node newNode(long parentId, String name, AppendageType type) {
        Node node = new Node(nextId.getAndIncrement(), parentId, name, type);
        nodes.put(node.id, node);
        return node;
    }

    private static final class Failure {
        private int remaining;
        private final Supplier<RemoteException> error;

        private Failure(int remaining, Supplier<RemoteException> error) {
            this.remaining = remaining;
            this.error = error;
        }
    }

    private static final class UploadJob {
        private final long sequenceId;
        private final Set<String> pending;

        private UploadJob(long sequenceId, List<String> frameNames) {
            this.sequenceId = sequenceId;
            this.pending = new LinkedHashSet<>(frameNames);
        }
    }

    private static final class Node {
        private final long id;
        private final long parentId;
        private final String name;
        private final AppendageType type;
        private final List<String> frameNames = new ArrayList<>();
        private final Map<String, byte[]> content = new HashMap<>();
        private byte[] preview;
        private String previewType;
        private boolean serverPreview;
        private boolean online;
        private int pollsLeft;

        private Node(long id, long parentId, String name, AppendageType type) {
            this.id = id;
            this.parentId = parentId;
            this.name = name;
            this.type = type;
        }

        private Appendage toAppendage() {
            long size = content.values().stream().mapToLong(bytes -> bytes.length).sum();
            return new Appendage(id, parentId, name, type, MediaKind.UNKNOWN, online,
                    preview != null || serverPreview, size);
        }
    }
}
