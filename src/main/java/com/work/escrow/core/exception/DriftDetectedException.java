package com.work.escrow.core.exception;

import com.work.escrow.core.reconcile.DriftRecord;

import java.util.Collections;
import java.util.List;

/**
 * 镜像声称的支付状态强于链上。不会向下自动修正，需要人工介入。
 */
public class DriftDetectedException extends EscrowException {

    private final String jobId;
    private final List<DriftRecord> drifts;

    public DriftDetectedException(String jobId, List<DriftRecord> drifts) {
        super("drift detected for job " + jobId + ": " + drifts);
        this.jobId = jobId;
        this.drifts = drifts == null ? Collections.emptyList() : Collections.unmodifiableList(drifts);
    }

    public String getJobId() {
        return jobId;
    }

    public List<DriftRecord> getDrifts() {
        return drifts;
    }
}
