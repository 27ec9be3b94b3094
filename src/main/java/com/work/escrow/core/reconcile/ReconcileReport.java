package com.work.escrow.core.reconcile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ReconcileReport {

    private final String jobId;
    private final List<Correction> corrections;
    private final List<DriftRecord> drifts;

    public ReconcileReport(String jobId, List<Correction> corrections, List<DriftRecord> drifts) {
        this.jobId = jobId;
        this.corrections = corrections == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(corrections));
        this.drifts = drifts == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(drifts));
    }

    public String getJobId() {
        return jobId;
    }

    public List<Correction> getCorrections() {
        return corrections;
    }

    public List<DriftRecord> getDrifts() {
        return drifts;
    }

    public boolean hasDrift() {
        return !drifts.isEmpty();
    }

    public SyncStatus getStatus() {
        if (!drifts.isEmpty()) {
            return SyncStatus.DRIFT;
        }
        return corrections.isEmpty() ? SyncStatus.SYNCED : SyncStatus.OUTDATED;
    }
}
