package com.work.escrow.app.web.dto;

/**
 * 批准/领取结果。APPLIED 与 CONVERGED 都是成功。
 */
public class OperationView {

    private String jobId;
    private int stageNumber;
    private String outcome;
    private String reason;
    private String signature;
    private boolean mirrorLagging;
    /**
     * 变更之后的链上余额与可领取金额；重新读链失败时为 null。
     */
    private Long stakedBalance;
    private Long claimableAmount;

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public int getStageNumber() {
        return stageNumber;
    }

    public void setStageNumber(int stageNumber) {
        this.stageNumber = stageNumber;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public boolean isMirrorLagging() {
        return mirrorLagging;
    }

    public void setMirrorLagging(boolean mirrorLagging) {
        this.mirrorLagging = mirrorLagging;
    }

    public Long getStakedBalance() {
        return stakedBalance;
    }

    public void setStakedBalance(Long stakedBalance) {
        this.stakedBalance = stakedBalance;
    }

    public Long getClaimableAmount() {
        return claimableAmount;
    }

    public void setClaimableAmount(Long claimableAmount) {
        this.claimableAmount = claimableAmount;
    }
}
