package com.work.escrow.core.statemachine;

import com.work.escrow.core.exception.StateViolationException;
import com.work.escrow.core.model.MilestoneStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * milestone 状态机（纯逻辑，无 I/O）。
 *
 * <pre>
 * PENDING -> IN_PROGRESS -> SUBMITTED -> APPROVED -> CLAIMED
 *       \________________/      |   ^
 *                               v   |
 *                      REVISION_REQUESTED
 * </pre>
 *
 * 非法迁移抛 {@link StateViolationException}，不会静默忽略。
 */
public class MilestoneStateMachine {

    private static final Map<MilestoneStatus, Set<MilestoneStatus>> ALLOWED;

    static {
        Map<MilestoneStatus, Set<MilestoneStatus>> m = new EnumMap<>(MilestoneStatus.class);
        m.put(MilestoneStatus.PENDING, EnumSet.of(MilestoneStatus.IN_PROGRESS, MilestoneStatus.SUBMITTED));
        m.put(MilestoneStatus.IN_PROGRESS, EnumSet.of(MilestoneStatus.SUBMITTED));
        m.put(MilestoneStatus.SUBMITTED, EnumSet.of(MilestoneStatus.APPROVED, MilestoneStatus.REVISION_REQUESTED));
        m.put(MilestoneStatus.REVISION_REQUESTED, EnumSet.of(MilestoneStatus.SUBMITTED));
        m.put(MilestoneStatus.APPROVED, EnumSet.of(MilestoneStatus.CLAIMED));
        m.put(MilestoneStatus.CLAIMED, EnumSet.noneOf(MilestoneStatus.class));
        ALLOWED = Collections.unmodifiableMap(m);
    }

    public boolean canTransition(MilestoneStatus current, MilestoneStatus target) {
        if (current == null || target == null) {
            return false;
        }
        return ALLOWED.get(current).contains(target);
    }

    /**
     * 校验并返回目标状态。
     */
    public MilestoneStatus transition(MilestoneStatus current, MilestoneStatus target, TransitionContext ctx) {
        requireNonNull(current, "current");
        requireNonNull(target, "target");
        requireNonNull(ctx, "ctx");

        if (!canTransition(current, target)) {
            throw new StateViolationException(current, target, null);
        }

        if (target == MilestoneStatus.APPROVED) {
            if (ctx.isPaymentReleased()) {
                throw new StateViolationException(current, target, "payment already released");
            }
            if (!ctx.isPriorStagesApproved()) {
                throw new StateViolationException(current, target, "earlier stages not approved");
            }
        } else if (target == MilestoneStatus.CLAIMED) {
            String caller = ctx.getCallerWallet();
            if (caller == null || !caller.equals(ctx.getChainFreelancerWallet())) {
                throw new StateViolationException(current, target, "caller is not the on-chain freelancer");
            }
            if (ctx.isChainClaimed()) {
                throw new StateViolationException(current, target, "already claimed on chain");
            }
        }
        return target;
    }

    /**
     * 当前状态下是否还等待 freelancer 提交（或重新提交）交付物。
     */
    public boolean acceptsSubmission(MilestoneStatus current) {
        return canTransition(current, MilestoneStatus.SUBMITTED);
    }
}
