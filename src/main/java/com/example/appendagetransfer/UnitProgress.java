package com.example.appendagetransfer;

import com.example.appendagetransfer.model.TransferUnit;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Steps of one unit that already succeeded, kept across retry attempts.
 */
final class UnitProgress {
    private volatile long remoteId = TransferUnit.NO_REMOTE_ID;
    private volatile boolean contentDone;
    private volatile boolean previewDone;
    private volatile String uploadJobId;
    private final Set<String> completedMembers = ConcurrentHashMap.newKeySet();

    boolean hasRemoteId() {
        return remoteId != TransferUnit.NO_REMOTE_ID;
    }

    long remoteId() {
        return remoteId;
    }

    void remoteId(long id) {
        this.remoteId = id;
    }

    boolean contentDone() {
        return contentDone;
    }

    void markContentDone() {
        contentDone = true;
    }

    boolean previewDone() {
        return previewDone;
    }

    void markPreviewDone() {
        previewDone = true;
    }

    /**
     * Server-side upload job of an image sequence, null until its frames were announced.
     */
    String uploadJobId() {
        return uploadJobId;
    }

    void uploadJobId(String id) {
        this.uploadJobId = id;
    }

    boolean memberDone(String member) {
        return completedMembers.contains(member);
    }

    void markMemberDone(String member) {
        completedMembers.add(member);
    }
}
