package com.work.escrow.core.exception;

import com.work.escrow.core.model.MilestoneStatus;

/**
 * 非法的 milestone 状态迁移。状态机从不静默忽略非法迁移。
 */
public class StateViolationException extends EscrowException {

    private final MilestoneStatus current;
    private final MilestoneStatus attempted;

    public StateViolationException(MilestoneStatus current, MilestoneStatus attempted, String detail) {
        super("illegal milestone transition " + current + " -> " + attempted + (detail == null ? "" : ": " + detail));
        this.current = current;
        this.attempted = attempted;
    }

    public MilestoneStatus getCurrent() {
        return current;
    }

    public MilestoneStatus getAttempted() {
        return attempted;
    }
}
