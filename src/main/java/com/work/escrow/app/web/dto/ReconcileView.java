package com.work.escrow.app.web.dto;

import java.util.List;

/**
 * 对账结果：SYNCED / OUTDATED / DRIFT，附带链上阶段快照。
 */
public class ReconcileView {

    private String jobId;
    private String syncStatus;
    private long stakedBalance;
    private List<String> corrections;
    private List<String> drifts;
    private List<StageView> stages;

    public static class StageView {

        private int stageNumber;
        private long amount;
        private boolean approved;
        private boolean claimed;

        public StageView() {
        }

        public StageView(int stageNumber, long amount, boolean approved, boolean claimed) {
            this.stageNumber = stageNumber;
            this.amount = amount;
            this.approved = approved;
            this.claimed = claimed;
        }

        public int getStageNumber() {
            return stageNumber;
        }

        public long getAmount() {
            return amount;
        }

        public boolean isApproved() {
            return approved;
        }

        public boolean isClaimed() {
            return claimed;
        }
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getSyncStatus() {
        return syncStatus;
    }

    public void setSyncStatus(String syncStatus) {
        this.syncStatus = syncStatus;
    }

    public long getStakedBalance() {
        return stakedBalance;
    }

    public void setStakedBalance(long stakedBalance) {
        this.stakedBalance = stakedBalance;
    }

    public List<String> getCorrections() {
        return corrections;
    }

    public void setCorrections(List<String> corrections) {
        this.corrections = corrections;
    }

    public List<String> getDrifts() {
        return drifts;
    }

    public void setDrifts(List<String> drifts) {
        this.drifts = drifts;
    }

    public List<StageView> getStages() {
        return stages;
    }

    public void setStages(List<StageView> stages) {
        this.stages = stages;
    }
}
