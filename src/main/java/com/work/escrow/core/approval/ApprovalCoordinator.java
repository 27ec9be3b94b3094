package com.work.escrow.core.approval;

import com.work.escrow.core.chain.ChainErrorKind;
import com.work.escrow.core.chain.ChainSubmissionException;
import com.work.escrow.core.chain.ChainTimeoutException;
import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.chain.WalletSigner;
import com.work.escrow.core.exception.ChainRejectionException;
import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.StaleChainViewException;
import com.work.escrow.core.exception.TransientFailureException;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.OnChainMilestone;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;
import com.work.escrow.core.reconcile.ReconcileOutcome;
import com.work.escrow.core.reconcile.ReconciliationEngine;
import com.work.escrow.core.result.OperationResult;
import com.work.escrow.core.resync.LaggingMirrorWriter;
import com.work.escrow.core.statemachine.MilestoneStateMachine;
import com.work.escrow.core.statemachine.TransitionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requireValidJobId;

/**
 * 批准 milestone。
 *
 * 批准的语义是“达到已批准状态”，而不是“由我批准”：链上已经批准（无论是读到的还是提交时撞上的）都按成功返回。
 * 所有前置条件都基于本次对账拿到的链上视图，镜像只用于工作流校验（必须已提交）。
 */
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    static final String REASON_ALREADY_APPROVED = "ALREADY_APPROVED";

    private final ReconciliationEngine reconciliationEngine;
    private final EscrowClient escrowClient;
    private final LedgerStore ledgerStore;
    private final MilestoneStateMachine stateMachine;
    private final LaggingMirrorWriter mirrorWriter;
    private final EscrowMetrics metrics;

    public ApprovalCoordinator(ReconciliationEngine reconciliationEngine,
                               EscrowClient escrowClient,
                               LedgerStore ledgerStore,
                               MilestoneStateMachine stateMachine,
                               LaggingMirrorWriter mirrorWriter,
                               EscrowMetrics metrics) {
        this.reconciliationEngine = requireNonNull(reconciliationEngine, "reconciliationEngine");
        this.escrowClient = requireNonNull(escrowClient, "escrowClient");
        this.ledgerStore = requireNonNull(ledgerStore, "ledgerStore");
        this.stateMachine = requireNonNull(stateMachine, "stateMachine");
        this.mirrorWriter = requireNonNull(mirrorWriter, "mirrorWriter");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * @param stageIndex 0-based 阶段下标
     */
    public OperationResult approve(String jobId, int stageIndex, String comments, WalletSigner signer) {
        requireValidJobId(jobId);
        requireNonNull(signer, "signer");

        ReconcileOutcome outcome = reconciliationEngine.reconcile(jobId);
        reconciliationEngine.requireNoDrift(outcome);
        EscrowAccountView view = outcome.getView();

        if (!view.hasStage(stageIndex)) {
            throw new GuardViolationException(GuardViolation.STAGE_OUT_OF_RANGE, jobId, stageIndex,
                    "stage " + stageIndex + " out of range, escrow has " + view.stageCount() + " stages");
        }
        if (!signer.getWalletAddress().equals(view.getRecruiterWallet())) {
            throw new GuardViolationException(GuardViolation.NOT_RECRUITER, jobId, stageIndex,
                    "signer is not the on-chain recruiter");
        }
        OnChainMilestone stage = view.stage(stageIndex);
        if (stage.isClaimed()) {
            throw new GuardViolationException(GuardViolation.ALREADY_CLAIMED, jobId, stageIndex,
                    "milestone already claimed");
        }
        if (stage.isApproved()) {
            log.info("approve converged without submission jobId={} stage={}", jobId, stageIndex);
            metrics.approval("converged");
            return OperationResult.converged(jobId, stageIndex, REASON_ALREADY_APPROVED, view);
        }
        if (!view.priorStagesApproved(stageIndex)) {
            throw new GuardViolationException(GuardViolation.OUT_OF_SEQUENCE, jobId, stageIndex,
                    "earlier stages must be approved first");
        }

        Milestone mirror = ledgerStore.findMilestone(jobId, stage.getStageNumber())
                .orElseThrow(() -> new GuardViolationException(GuardViolation.MILESTONE_NOT_FOUND, jobId, stageIndex,
                        "milestone not found in ledger"));
        if (mirror.getStatus().impliesApproved()) {
            // 读链之后镜像被并发的批准写入
            log.info("mirror already approved by a concurrent caller, re-reading chain jobId={} stage={}", jobId, stageIndex);
            return convergeAfterRace(jobId, stageIndex, null);
        }
        stateMachine.transition(mirror.getStatus(), MilestoneStatus.APPROVED,
                TransitionContext.forApproval(view, stageIndex));

        String signature;
        try {
            signature = escrowClient.submitApprove(jobId, stageIndex, signer);
        } catch (ChainSubmissionException e) {
            if (e.getKind() == ChainErrorKind.ALREADY_APPROVED) {
                log.warn("approve raced with another approval jobId={} stage={}", jobId, stageIndex);
                return convergeAfterRace(jobId, stageIndex, e);
            }
            metrics.approval("rejected");
            throw new ChainRejectionException(e.getKind(), e.getMessage(), e);
        } catch (ChainTimeoutException e) {
            return resolveAfterTimeout(jobId, stageIndex, e);
        }

        log.info("milestone approved on chain jobId={} stage={} sig={}", jobId, stageIndex, signature);
        // 批准本身不转移资金，金额为 0
        TransactionRecord marker = TransactionRecord.confirmed(jobId, mirror.getId(), view.getRecruiterWallet(),
                view.getEscrowAddress(), 0L, TransactionType.APPROVAL_MARKER, signature);
        boolean written = mirrorWriter.write(jobId, "approve", marker,
                () -> applyApproval(jobId, stage.getStageNumber(), comments, marker));
        metrics.approval("applied");
        return OperationResult.applied(jobId, stageIndex, signature, !written, readAfterSubmit(jobId));
    }

    private void applyApproval(String jobId, int stageNumber, String comments, TransactionRecord marker) {
        Milestone m = ledgerStore.findMilestone(jobId, stageNumber)
                .orElseThrow(() -> new IllegalStateException("milestone vanished jobId=" + jobId + " stage=" + stageNumber));
        if (!ledgerStore.findTransactionBySignature(marker.getSignature()).isPresent()) {
            ledgerStore.appendTransaction(marker);
        }
        Instant now = Instant.now();
        if (m.getStatus() != MilestoneStatus.CLAIMED) {
            m.setStatus(MilestoneStatus.APPROVED);
        }
        if (comments != null && !comments.trim().isEmpty()) {
            m.setReviewerComments(comments);
        }
        m.setReviewedAt(now);
        m.setUpdatedAt(now);
        ledgerStore.saveMilestone(m);
    }

    /**
     * 提交成功后重新读链，结果里带的是变更之后的视图；读失败时不带视图。
     */
    private EscrowAccountView readAfterSubmit(String jobId) {
        try {
            return escrowClient.readAccount(jobId).orElse(null);
        } catch (EscrowException e) {
            log.warn("re-read after approve failed jobId={} err={}", jobId, e.toString());
            return null;
        }
    }

    private OperationResult convergeAfterRace(String jobId, int stageIndex, ChainSubmissionException cause) {
        ReconcileOutcome outcome = reconciliationEngine.reconcile(jobId);
        reconciliationEngine.requireNoDrift(outcome);
        EscrowAccountView view = outcome.getView();
        if (!view.stage(stageIndex).isApproved()) {
            metrics.approval("stale");
            throw new StaleChainViewException("stage not approved on re-read, chain view is stale jobId="
                    + jobId + " stage=" + stageIndex, cause);
        }
        metrics.approval("converged");
        return OperationResult.converged(jobId, stageIndex, REASON_ALREADY_APPROVED, view);
    }

    private OperationResult resolveAfterTimeout(String jobId, int stageIndex, ChainTimeoutException cause) {
        log.warn("approve outcome unknown, re-reading chain jobId={} stage={} err={}", jobId, stageIndex, cause.toString());
        EscrowAccountView view = reconciliationEngine.reconcile(jobId).getView();
        if (view.stage(stageIndex).isApproved()) {
            metrics.approval("converged");
            return OperationResult.converged(jobId, stageIndex, "CONFIRMED_AFTER_TIMEOUT", view);
        }
        metrics.approval("timeout");
        throw new TransientFailureException("approve not confirmed on chain, retry later jobId=" + jobId
                + " stage=" + stageIndex, cause);
    }
}
