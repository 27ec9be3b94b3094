package com.work.escrow.core.result;

import com.work.escrow.core.model.EscrowAccountView;

/**
 * 批准/领取操作的成功结果。失败一律通过异常表达。
 *
 * 调用方无需区分“我执行了”还是“已经是这个状态”：两者都是成功。
 */
public final class OperationResult {

    private final Outcome outcome;
    private final String jobId;
    private final int stageIndex;
    /**
     * CONVERGED 时的原因（例如 ALREADY_APPROVED）。
     */
    private final String reason;
    /**
     * 链上签名；CONVERGED 且本次未提交时为 null。
     */
    private final String signature;
    /**
     * 链上已成功但镜像写入失败，已排队后台重新对账。
     */
    private final boolean mirrorLagging;
    /**
     * APPLIED 时为提交之后重新读到的链上视图（读失败为 null）；CONVERGED 时为收敛所用的视图。
     */
    private final EscrowAccountView view;

    private OperationResult(Outcome outcome, String jobId, int stageIndex, String reason, String signature,
                            boolean mirrorLagging, EscrowAccountView view) {
        this.outcome = outcome;
        this.jobId = jobId;
        this.stageIndex = stageIndex;
        this.reason = reason;
        this.signature = signature;
        this.mirrorLagging = mirrorLagging;
        this.view = view;
    }

    public static OperationResult applied(String jobId, int stageIndex, String signature, boolean mirrorLagging,
                                          EscrowAccountView view) {
        return new OperationResult(Outcome.APPLIED, jobId, stageIndex, null, signature, mirrorLagging, view);
    }

    public static OperationResult converged(String jobId, int stageIndex, String reason, EscrowAccountView view) {
        return new OperationResult(Outcome.CONVERGED, jobId, stageIndex, reason, null, false, view);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public String getJobId() {
        return jobId;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getReason() {
        return reason;
    }

    public String getSignature() {
        return signature;
    }

    public boolean isMirrorLagging() {
        return mirrorLagging;
    }

    public EscrowAccountView getView() {
        return view;
    }

    @Override
    public String toString() {
        return "OperationResult{outcome=" + outcome + ", jobId=" + jobId + ", stageIndex=" + stageIndex
                + ", reason=" + reason + ", signature=" + signature + ", mirrorLagging=" + mirrorLagging + '}';
    }
}
