package com.work.escrow.core.cancel;

import com.work.escrow.core.result.Outcome;

/**
 * 取消/退款请求的执行结果。
 */
public final class CancellationResult {

    public enum Status {
        CANCELLED,
        RECLAIM_REQUESTED,
        /**
         * 投递失败不改变决策，调用方可以稍后重试投递。
         */
        RECLAIM_REQUEST_FAILED,
        /**
         * 读取之后有阶段被批准，合约拒绝取消；需要重新评估。
         */
        REEVALUATE_REQUIRED
    }

    private final String jobId;
    private final CancellationDecision decision;
    private final Status status;
    private final Outcome outcome;
    private final String signature;
    private final long refundAmount;
    private final String inquiryId;
    private final boolean mirrorLagging;
    private final String message;

    private CancellationResult(String jobId, CancellationDecision decision, Status status, Outcome outcome,
                               String signature, long refundAmount, String inquiryId, boolean mirrorLagging,
                               String message) {
        this.jobId = jobId;
        this.decision = decision;
        this.status = status;
        this.outcome = outcome;
        this.signature = signature;
        this.refundAmount = refundAmount;
        this.inquiryId = inquiryId;
        this.mirrorLagging = mirrorLagging;
        this.message = message;
    }

    public static CancellationResult cancelled(String jobId, String signature, long refundAmount, boolean mirrorLagging) {
        return new CancellationResult(jobId, CancellationDecision.CANCELLABLE, Status.CANCELLED, Outcome.APPLIED,
                signature, refundAmount, null, mirrorLagging, null);
    }

    public static CancellationResult cancelledByConvergence(String jobId, String message) {
        return new CancellationResult(jobId, CancellationDecision.CANCELLABLE, Status.CANCELLED, Outcome.CONVERGED,
                null, 0L, null, false, message);
    }

    public static CancellationResult reclaimRequested(String jobId, String inquiryId) {
        return new CancellationResult(jobId, CancellationDecision.RECLAIM_ONLY, Status.RECLAIM_REQUESTED, null,
                null, 0L, inquiryId, false, null);
    }

    public static CancellationResult reclaimRequestFailed(String jobId, String inquiryId, String message) {
        return new CancellationResult(jobId, CancellationDecision.RECLAIM_ONLY, Status.RECLAIM_REQUEST_FAILED, null,
                null, 0L, inquiryId, false, message);
    }

    public static CancellationResult reevaluateRequired(String jobId, String message) {
        return new CancellationResult(jobId, CancellationDecision.CANCELLABLE, Status.REEVALUATE_REQUIRED, null,
                null, 0L, null, false, message);
    }

    public String getJobId() {
        return jobId;
    }

    public CancellationDecision getDecision() {
        return decision;
    }

    public Status getStatus() {
        return status;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getSignature() {
        return signature;
    }

    public long getRefundAmount() {
        return refundAmount;
    }

    public String getInquiryId() {
        return inquiryId;
    }

    public boolean isMirrorLagging() {
        return mirrorLagging;
    }

    public String getMessage() {
        return message;
    }
}
