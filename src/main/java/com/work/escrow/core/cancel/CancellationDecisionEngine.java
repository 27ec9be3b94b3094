package com.work.escrow.core.cancel;

import com.work.escrow.core.chain.ChainErrorKind;
import com.work.escrow.core.chain.ChainSubmissionException;
import com.work.escrow.core.chain.ChainTimeoutException;
import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.chain.WalletSigner;
import com.work.escrow.core.exception.ChainRejectionException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.TransientFailureException;
import com.work.escrow.core.inquiry.InquirySink;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.OnChainMilestone;
import com.work.escrow.core.model.ReclaimInquiry;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;
import com.work.escrow.core.reconcile.ReconcileOutcome;
import com.work.escrow.core.reconcile.ReconciliationEngine;
import com.work.escrow.core.resync.LaggingMirrorWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requireValidJobId;

/**
 * 取消决策：任何阶段一旦批准，资金就可能已离开信任边界，只能走人工退款请求；否则可直接链上取消并全额退款。
 */
public class CancellationDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(CancellationDecisionEngine.class);

    private final ReconciliationEngine reconciliationEngine;
    private final EscrowClient escrowClient;
    private final LedgerStore ledgerStore;
    private final InquirySink inquirySink;
    private final LaggingMirrorWriter mirrorWriter;
    private final EscrowMetrics metrics;

    public CancellationDecisionEngine(ReconciliationEngine reconciliationEngine,
                                      EscrowClient escrowClient,
                                      LedgerStore ledgerStore,
                                      InquirySink inquirySink,
                                      LaggingMirrorWriter mirrorWriter,
                                      EscrowMetrics metrics) {
        this.reconciliationEngine = requireNonNull(reconciliationEngine, "reconciliationEngine");
        this.escrowClient = requireNonNull(escrowClient, "escrowClient");
        this.ledgerStore = requireNonNull(ledgerStore, "ledgerStore");
        this.inquirySink = requireNonNull(inquirySink, "inquirySink");
        this.mirrorWriter = requireNonNull(mirrorWriter, "mirrorWriter");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 只看链上批准标记。
     */
    public static CancellationDecision decide(List<OnChainMilestone> milestones) {
        for (OnChainMilestone m : milestones) {
            if (m.isApproved()) {
                return CancellationDecision.RECLAIM_ONLY;
            }
        }
        return CancellationDecision.CANCELLABLE;
    }

    public CancellationDecision evaluate(String jobId) {
        requireValidJobId(jobId);
        EscrowAccountView view = reconciliationEngine.reconcile(jobId).getView();
        return decide(view.getMilestones());
    }

    public CancellationResult cancel(String jobId, WalletSigner signer, String contact, String note) {
        requireValidJobId(jobId);
        requireNonNull(signer, "signer");

        ReconcileOutcome outcome;
        try {
            outcome = reconciliationEngine.reconcile(jobId);
        } catch (GuardViolationException e) {
            if (e.getReason() == GuardViolation.ESCROW_NOT_FOUND && reconciliationEngine.settleClosedAccount(jobId)) {
                metrics.cancellation("converged");
                return CancellationResult.cancelledByConvergence(jobId, "escrow already closed");
            }
            throw e;
        }
        reconciliationEngine.requireNoDrift(outcome);
        EscrowAccountView view = outcome.getView();

        if (!signer.getWalletAddress().equals(view.getRecruiterWallet())) {
            throw new GuardViolationException(GuardViolation.NOT_RECRUITER, jobId, null,
                    "signer is not the on-chain recruiter");
        }

        if (decide(view.getMilestones()) == CancellationDecision.RECLAIM_ONLY) {
            return requestReclaim(view, signer.getWalletAddress(), contact, note);
        }

        String signature;
        try {
            signature = escrowClient.submitCancel(jobId, signer);
        } catch (ChainSubmissionException e) {
            if (e.getKind() == ChainErrorKind.CANNOT_CANCEL_AFTER_APPROVAL) {
                log.warn("cancel rejected, a milestone was approved after the read jobId={}", jobId);
                metrics.cancellation("reevaluate");
                return CancellationResult.reevaluateRequired(jobId, e.getMessage());
            }
            metrics.cancellation("rejected");
            throw new ChainRejectionException(e.getKind(), e.getMessage(), e);
        } catch (ChainTimeoutException e) {
            log.warn("cancel outcome unknown, re-reading chain jobId={} err={}", jobId, e.toString());
            if (reconciliationEngine.settleClosedAccount(jobId)) {
                metrics.cancellation("converged");
                return CancellationResult.cancelledByConvergence(jobId, "escrow closed, confirmed after timeout");
            }
            metrics.cancellation("timeout");
            throw new TransientFailureException("cancel not confirmed on chain, retry later jobId=" + jobId, e);
        }

        long refund = view.remainingAmount();
        log.info("job cancelled on chain jobId={} refund={} sig={}", jobId, refund, signature);
        TransactionRecord refundRecord = TransactionRecord.confirmed(jobId, null, view.getEscrowAddress(),
                view.getRecruiterWallet(), refund, TransactionType.REFUND, signature);
        boolean written = mirrorWriter.write(jobId, "cancel", refundRecord, () -> applyCancel(jobId, refundRecord));
        metrics.cancellation("applied");
        return CancellationResult.cancelled(jobId, signature, refund, !written);
    }

    private CancellationResult requestReclaim(EscrowAccountView view, String requester, String contact, String note) {
        ReclaimInquiry inquiry = new ReclaimInquiry(UUID.randomUUID(), view.getJobId(), requester, contact, note,
                view.totalAmount(), view.getMilestones(), Instant.now());
        String inquiryId = inquiry.getId().toString();
        try {
            inquirySink.submit(inquiry);
        } catch (RuntimeException e) {
            log.warn("reclaim inquiry delivery failed jobId={} inquiryId={} err={}", view.getJobId(), inquiryId, e.toString());
            metrics.cancellation("reclaim_failed");
            return CancellationResult.reclaimRequestFailed(view.getJobId(), inquiryId, e.getMessage());
        }
        log.info("reclaim inquiry submitted jobId={} inquiryId={}", view.getJobId(), inquiryId);
        metrics.cancellation("reclaim_requested");
        return CancellationResult.reclaimRequested(view.getJobId(), inquiryId);
    }

    private void applyCancel(String jobId, TransactionRecord refundRecord) {
        if (!ledgerStore.findTransactionBySignature(refundRecord.getSignature()).isPresent()) {
            ledgerStore.appendTransaction(refundRecord);
        }
        Job job = ledgerStore.findJob(jobId)
                .orElseThrow(() -> new IllegalStateException("job vanished jobId=" + jobId));
        job.setStatus(JobStatus.CANCELLED);
        job.setUpdatedAt(Instant.now());
        ledgerStore.saveJob(job);
    }
}
