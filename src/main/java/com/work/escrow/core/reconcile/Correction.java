package com.work.escrow.core.reconcile;

/**
 * 对账时按链上事实修正镜像的一次写入。
 */
public final class Correction {

    private final String jobId;
    private final Integer stageNumber;
    private final String field;
    private final String from;
    private final String to;

    public Correction(String jobId, Integer stageNumber, String field, Object from, Object to) {
        this.jobId = jobId;
        this.stageNumber = stageNumber;
        this.field = field;
        this.from = String.valueOf(from);
        this.to = String.valueOf(to);
    }

    public String getJobId() {
        return jobId;
    }

    public Integer getStageNumber() {
        return stageNumber;
    }

    public String getField() {
        return field;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    @Override
    public String toString() {
        return (stageNumber == null ? "job" : "stage" + stageNumber) + "." + field + ": " + from + " -> " + to;
    }
}
