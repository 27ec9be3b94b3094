package com.work.escrow.core.statemachine;

import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.OnChainMilestone;

/**
 * 状态迁移的附加约束输入。链相关字段一律取自最新链上视图，而不是镜像。
 */
public final class TransitionContext {

    private static final TransitionContext OFF_CHAIN = new TransitionContext(false, true, false, null, null);

    private final boolean paymentReleased;
    private final boolean priorStagesApproved;
    private final boolean chainClaimed;
    private final String callerWallet;
    private final String chainFreelancerWallet;

    private TransitionContext(boolean paymentReleased,
                              boolean priorStagesApproved,
                              boolean chainClaimed,
                              String callerWallet,
                              String chainFreelancerWallet) {
        this.paymentReleased = paymentReleased;
        this.priorStagesApproved = priorStagesApproved;
        this.chainClaimed = chainClaimed;
        this.callerWallet = callerWallet;
        this.chainFreelancerWallet = chainFreelancerWallet;
    }

    /**
     * 纯链下迁移（开始/提交/请求修改）不涉及链上约束。
     */
    public static TransitionContext offChain() {
        return OFF_CHAIN;
    }

    public static TransitionContext forApproval(EscrowAccountView view, int stageIndex) {
        OnChainMilestone m = view.stage(stageIndex);
        return new TransitionContext(m.isClaimed(), view.priorStagesApproved(stageIndex), m.isClaimed(), null,
                view.getFreelancerWallet());
    }

    public static TransitionContext forClaim(EscrowAccountView view, int stageIndex, String callerWallet) {
        OnChainMilestone m = view.stage(stageIndex);
        return new TransitionContext(m.isClaimed(), view.priorStagesApproved(stageIndex), m.isClaimed(), callerWallet,
                view.getFreelancerWallet());
    }

    public boolean isPaymentReleased() {
        return paymentReleased;
    }

    public boolean isPriorStagesApproved() {
        return priorStagesApproved;
    }

    public boolean isChainClaimed() {
        return chainClaimed;
    }

    public String getCallerWallet() {
        return callerWallet;
    }

    public String getChainFreelancerWallet() {
        return chainFreelancerWallet;
    }
}
