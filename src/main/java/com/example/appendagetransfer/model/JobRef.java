package com.example.appendagetransfer.model;

import java.util.List;
import java.util.Locale;

/**
 * Identity of a remote shot job or asset job. The owner path holds the ids of the
 * shot (shot list, stage, shot) or asset (asset list, asset) the job belongs to.
 * A job is addressed either by its own id or by the id of its job definition.
 * <p>
 * Shots and assets may instead be addressed by the custom id the studio assigned to them,
 * in which case {@code customOwnerId} is set and {@code ownerIds} is empty.
 */
public record JobRef(
        JobKind kind,
        List<Long> ownerIds,
        String customOwnerId,
        long id,
        boolean definitionId
) {
    public JobRef {
        ownerIds = List.copyOf(ownerIds);
        if (customOwnerId != null) {
            if (customOwnerId.isBlank()) {
                throw new IllegalArgumentException("Custom " + kind + " id must not be blank");
            }
            if (!ownerIds.isEmpty()) {
                throw new IllegalArgumentException("Custom " + kind + " id replaces the owner ids, got " + ownerIds);
            }
        } else {
            int expected = kind == JobKind.SHOT ? 3 : 2;
            if (ownerIds.size() != expected) {
                throw new IllegalArgumentException(kind + " job needs " + expected + " owner ids, got " + ownerIds);
            }
        }
    }

    public static JobRef shotJob(long shotListId, long stageId, long shotId, long jobId) {
        return new JobRef(JobKind.SHOT, List.of(shotListId, stageId, shotId), null, jobId, false);
    }

    public static JobRef shotJobByDefinition(long shotListId, long stageId, long shotId, long jobDefinitionId) {
        return new JobRef(JobKind.SHOT, List.of(shotListId, stageId, shotId), null, jobDefinitionId, true);
    }

    public static JobRef assetJob(long assetListId, long assetId, long jobId) {
        return new JobRef(JobKind.ASSET, List.of(assetListId, assetId), null, jobId, false);
    }

    public static JobRef assetJobByDefinition(long assetListId, long assetId, long jobDefinitionId) {
        return new JobRef(JobKind.ASSET, List.of(assetListId, assetId), null, jobDefinitionId, true);
    }

    public static JobRef shotJobByCustomId(String customShotId, long jobId) {
        return new JobRef(JobKind.SHOT, List.of(), customShotId, jobId, false);
    }

    public static JobRef shotJobDefinitionByCustomId(String customShotId, long jobDefinitionId) {
        return new JobRef(JobKind.SHOT, List.of(), customShotId, jobDefinitionId, true);
    }

    public static JobRef assetJobByCustomId(String customAssetId, long jobId) {
        return new JobRef(JobKind.ASSET, List.of(), customAssetId, jobId, false);
    }

    public static JobRef assetJobDefinitionByCustomId(String customAssetId, long jobDefinitionId) {
        return new JobRef(JobKind.ASSET, List.of(), customAssetId, jobDefinitionId, true);
    }

    public boolean customAddressed() {
        return customOwnerId != null;
    }

    @Override
    public String toString() {
        String owner = customAddressed() ? "[" + customOwnerId + "]" : ownerIds.toString();
        return kind.name().toLowerCase(Locale.ROOT) + "job" + owner + (definitionId ? "/def:" : "/") + id;
    }
}
