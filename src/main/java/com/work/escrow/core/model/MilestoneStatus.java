package com.work.escrow.core.model;

/**
 * 链下 milestone 状态（镜像）。APPROVED/CLAIMED 是链上状态的派生缓存，其余为纯链下流程状态。
 */
public enum MilestoneStatus {
    PENDING,
    IN_PROGRESS,
    SUBMITTED,
    APPROVED,
    REVISION_REQUESTED,
    CLAIMED;

    /**
     * 镜像是否声称该 milestone 已在链上被批准（CLAIMED 隐含 APPROVED）。
     */
    public boolean impliesApproved() {
        return this == APPROVED || this == CLAIMED;
    }
}
