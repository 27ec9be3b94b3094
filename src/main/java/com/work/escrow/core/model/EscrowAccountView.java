package com.work.escrow.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 某个 job 的链上 escrow 账户只读快照（权威状态）。
 *
 * 只由 EscrowClient 实现构造；每次变更决策前必须重新读取，不允许跨调用缓存。
 */
public final class EscrowAccountView {

    private final String jobId;
    private final String escrowAddress;
    private final long stakedBalance;
    private final String recruiterWallet;
    private final String freelancerWallet;
    private final List<OnChainMilestone> milestones;
    private final Instant readAt;

    public EscrowAccountView(String jobId,
                             String escrowAddress,
                             long stakedBalance,
                             String recruiterWallet,
                             String freelancerWallet,
                             List<OnChainMilestone> milestones,
                             Instant readAt) {
        this.jobId = jobId;
        this.escrowAddress = escrowAddress;
        this.stakedBalance = stakedBalance;
        this.recruiterWallet = recruiterWallet;
        this.freelancerWallet = freelancerWallet;
        this.milestones = milestones == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(milestones));
        this.readAt = readAt == null ? Instant.now() : readAt;
    }

    public String getJobId() {
        return jobId;
    }

    public String getEscrowAddress() {
        return escrowAddress;
    }

    public long getStakedBalance() {
        return stakedBalance;
    }

    public String getRecruiterWallet() {
        return recruiterWallet;
    }

    public String getFreelancerWallet() {
        return freelancerWallet;
    }

    public List<OnChainMilestone> getMilestones() {
        return milestones;
    }

    public Instant getReadAt() {
        return readAt;
    }

    public int stageCount() {
        return milestones.size();
    }

    public boolean hasStage(int stageIndex) {
        return stageIndex >= 0 && stageIndex < milestones.size();
    }

    public OnChainMilestone stage(int stageIndex) {
        if (!hasStage(stageIndex)) {
            throw new IndexOutOfBoundsException("stageIndex " + stageIndex + " out of range, stages=" + milestones.size());
        }
        return milestones.get(stageIndex);
    }

    /**
     * 所有小于 stageIndex 的阶段是否都已在链上批准。
     */
    public boolean priorStagesApproved(int stageIndex) {
        for (int j = 0; j < stageIndex && j < milestones.size(); j++) {
            if (!milestones.get(j).isApproved()) {
                return false;
            }
        }
        return true;
    }

    public boolean anyApproved() {
        for (OnChainMilestone m : milestones) {
            if (m.isApproved()) {
                return true;
            }
        }
        return false;
    }

    public boolean allClaimed() {
        if (milestones.isEmpty()) {
            return false;
        }
        for (OnChainMilestone m : milestones) {
            if (!m.isClaimed()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 已批准但尚未领取的金额。
     */
    public long claimableAmount() {
        long sum = 0L;
        for (OnChainMilestone m : milestones) {
            if (m.isApproved() && !m.isClaimed()) {
                sum += m.getAmount();
            }
        }
        return sum;
    }

    /**
     * 尚未领取的金额（取消时应退还 recruiter 的部分）。
     */
    public long remainingAmount() {
        long sum = 0L;
        for (OnChainMilestone m : milestones) {
            if (!m.isClaimed()) {
                sum += m.getAmount();
            }
        }
        return sum;
    }

    public long claimedAmount() {
        long sum = 0L;
        for (OnChainMilestone m : milestones) {
            if (m.isClaimed()) {
                sum += m.getAmount();
            }
        }
        return sum;
    }

    public long totalAmount() {
        long sum = 0L;
        for (OnChainMilestone m : milestones) {
            sum += m.getAmount();
        }
        return sum;
    }

    @Override
    public String toString() {
        return "EscrowAccountView{jobId=" + jobId
                + ", escrow=" + escrowAddress
                + ", stakedBalance=" + stakedBalance
                + ", recruiter=" + recruiterWallet
                + ", freelancer=" + freelancerWallet
                + ", milestones=" + milestones
                + ", readAt=" + readAt + "}";
    }
}
