package com.work.escrow.core.model;

/**
 * 链上单个 milestone 的只读投影。
 */
public final class OnChainMilestone {

    private final int stageIndex;
    private final long amount;
    private final boolean approved;
    private final boolean claimed;

    public OnChainMilestone(int stageIndex, long amount, boolean approved, boolean claimed) {
        this.stageIndex = stageIndex;
        this.amount = amount;
        this.approved = approved;
        this.claimed = claimed;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public int getStageNumber() {
        return stageIndex + 1;
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

    @Override
    public String toString() {
        return "{stage=" + getStageNumber() + ", amount=" + amount + ", approved=" + approved + ", claimed=" + claimed + "}";
    }
}
