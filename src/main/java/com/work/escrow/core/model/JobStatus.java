package com.work.escrow.core.model;

/**
 * 链下 job 生命周期。ACTIVE 由链上质押驱动，COMPLETED/CANCELLED 为终态。
 */
public enum JobStatus {
    DRAFT,
    OPEN,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
