package com.work.escrow.core.exception;

public class GuardViolationException extends EscrowException {

    private final GuardViolation reason;
    private final String jobId;
    private final Integer stageIndex;

    public GuardViolationException(GuardViolation reason, String jobId, Integer stageIndex, String message) {
        super(message);
        this.reason = reason;
        this.jobId = jobId;
        this.stageIndex = stageIndex;
    }

    public GuardViolation getReason() {
        return reason;
    }

    public String getJobId() {
        return jobId;
    }

    public Integer getStageIndex() {
        return stageIndex;
    }
}
