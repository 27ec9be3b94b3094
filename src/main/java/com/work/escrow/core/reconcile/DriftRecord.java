package com.work.escrow.core.reconcile;

import java.time.Instant;

/**
 * 一条漂移记录，同时保留链上与镜像两侧快照供人工排查。
 */
public final class DriftRecord {

    private final String jobId;
    /**
     * 1-based；job 级别的漂移为 null。
     */
    private final Integer stageNumber;
    private final DriftKind kind;
    private final String chainSnapshot;
    private final String mirrorSnapshot;
    private final Instant detectedAt;

    public DriftRecord(String jobId, Integer stageNumber, DriftKind kind, String chainSnapshot, String mirrorSnapshot) {
        this.jobId = jobId;
        this.stageNumber = stageNumber;
        this.kind = kind;
        this.chainSnapshot = chainSnapshot;
        this.mirrorSnapshot = mirrorSnapshot;
        this.detectedAt = Instant.now();
    }

    public String getJobId() {
        return jobId;
    }

    public Integer getStageNumber() {
        return stageNumber;
    }

    public DriftKind getKind() {
        return kind;
    }

    public String getChainSnapshot() {
        return chainSnapshot;
    }

    public String getMirrorSnapshot() {
        return mirrorSnapshot;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    @Override
    public String toString() {
        return "DriftRecord{jobId=" + jobId + ", stage=" + stageNumber + ", kind=" + kind
                + ", chain=" + chainSnapshot + ", mirror=" + mirrorSnapshot + '}';
    }
}
