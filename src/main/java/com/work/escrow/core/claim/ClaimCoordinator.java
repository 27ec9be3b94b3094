package com.work.escrow.core.claim;

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
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
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
 * 领取 milestone 款项。
 *
 * 身份校验以链上记录的 freelancer 钱包为准（镜像里的钱包可能已过期）。
 * 链上返回 NOT_APPROVED 说明调用方视图过期，不自动重试，只记录日志供漂移排查。
 */
public class ClaimCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ClaimCoordinator.class);

    static final String REASON_ALREADY_CLAIMED = "ALREADY_CLAIMED";

    private final ReconciliationEngine reconciliationEngine;
    private final EscrowClient escrowClient;
    private final LedgerStore ledgerStore;
    private final MilestoneStateMachine stateMachine;
    private final LaggingMirrorWriter mirrorWriter;
    private final EscrowMetrics metrics;

    public ClaimCoordinator(ReconciliationEngine reconciliationEngine,
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
    public OperationResult claim(String jobId, int stageIndex, WalletSigner signer) {
        requireValidJobId(jobId);
        requireNonNull(signer, "signer");

        ReconcileOutcome outcome = reconciliationEngine.reconcile(jobId);
        reconciliationEngine.requireNoDrift(outcome);
        EscrowAccountView view = outcome.getView();

        if (!view.hasStage(stageIndex)) {
            throw new GuardViolationException(GuardViolation.STAGE_OUT_OF_RANGE, jobId, stageIndex,
                    "stage " + stageIndex + " out of range, escrow has " + view.stageCount() + " stages");
        }
        if (!signer.getWalletAddress().equals(view.getFreelancerWallet())) {
            throw new GuardViolationException(GuardViolation.NOT_FREELANCER, jobId, stageIndex,
                    "claimant is not the on-chain freelancer");
        }
        OnChainMilestone stage = view.stage(stageIndex);
        if (stage.isClaimed()) {
            log.info("claim converged without submission jobId={} stage={}", jobId, stageIndex);
            metrics.claim("converged");
            return OperationResult.converged(jobId, stageIndex, REASON_ALREADY_CLAIMED, view);
        }
        if (view.getStakedBalance() <= 0) {
            throw new GuardViolationException(GuardViolation.ESCROW_NOT_FUNDED, jobId, stageIndex,
                    "escrow balance is empty");
        }
        if (!stage.isApproved()) {
            throw new GuardViolationException(GuardViolation.NOT_APPROVED, jobId, stageIndex,
                    "milestone has not been approved yet");
        }

        Milestone mirror = ledgerStore.findMilestone(jobId, stage.getStageNumber())
                .orElseThrow(() -> new GuardViolationException(GuardViolation.MILESTONE_NOT_FOUND, jobId, stageIndex,
                        "milestone not found in ledger"));
        if (mirror.getStatus() == MilestoneStatus.CLAIMED) {
            log.info("mirror already claimed by a concurrent caller, re-reading chain jobId={} stage={}", jobId, stageIndex);
            return convergeAfterRace(jobId, stageIndex, null);
        }
        stateMachine.transition(mirror.getStatus(), MilestoneStatus.CLAIMED,
                TransitionContext.forClaim(view, stageIndex, signer.getWalletAddress()));

        String signature;
        try {
            signature = escrowClient.submitClaim(jobId, stageIndex, signer);
        } catch (ChainSubmissionException e) {
            if (e.getKind() == ChainErrorKind.ALREADY_CLAIMED) {
                log.warn("claim raced with another claim jobId={} stage={}", jobId, stageIndex);
                return convergeAfterRace(jobId, stageIndex, e);
            }
            if (e.getKind() == ChainErrorKind.NOT_APPROVED) {
                log.warn("chain rejected claim as not approved, view was stale jobId={} stage={} view={}",
                        jobId, stageIndex, view);
                metrics.claim("stale");
                throw new StaleChainViewException("chain reports milestone not approved, re-fetch state jobId="
                        + jobId + " stage=" + stageIndex, e);
            }
            metrics.claim("rejected");
            throw new ChainRejectionException(e.getKind(), e.getMessage(), e);
        } catch (ChainTimeoutException e) {
            return resolveAfterTimeout(jobId, stageIndex, e);
        }

        log.info("milestone claimed on chain jobId={} stage={} amount={} sig={}",
                jobId, stageIndex, stage.getAmount(), signature);
        TransactionRecord payment = TransactionRecord.confirmed(jobId, mirror.getId(), view.getEscrowAddress(),
                view.getFreelancerWallet(), stage.getAmount(), TransactionType.PAYMENT, signature);
        boolean written = mirrorWriter.write(jobId, "claim", payment,
                () -> applyClaim(jobId, stage, payment, view));
        metrics.claim("applied");
        return OperationResult.applied(jobId, stageIndex, signature, !written, readAfterSubmit(jobId));
    }

    private void applyClaim(String jobId, OnChainMilestone stage, TransactionRecord payment, EscrowAccountView view) {
        Milestone m = ledgerStore.findMilestone(jobId, stage.getStageNumber())
                .orElseThrow(() -> new IllegalStateException("milestone vanished jobId=" + jobId
                        + " stage=" + stage.getStageNumber()));
        if (!ledgerStore.findTransaction(m.getId(), TransactionType.PAYMENT).isPresent()) {
            ledgerStore.appendTransaction(payment);
        }
        Instant now = Instant.now();
        m.setStatus(MilestoneStatus.CLAIMED);
        m.setPaymentReleased(true);
        m.setUpdatedAt(now);
        ledgerStore.saveMilestone(m);

        if (othersClaimed(view, stage.getStageIndex())) {
            Job job = ledgerStore.findJob(jobId)
                    .orElseThrow(() -> new IllegalStateException("job vanished jobId=" + jobId));
            if (job.getStatus() != JobStatus.COMPLETED) {
                job.setStatus(JobStatus.COMPLETED);
                job.setUpdatedAt(now);
                ledgerStore.saveJob(job);
                log.info("all milestones claimed, job completed jobId={}", jobId);
            }
        }
    }

    private static boolean othersClaimed(EscrowAccountView view, int stageIndex) {
        for (OnChainMilestone m : view.getMilestones()) {
            if (m.getStageIndex() != stageIndex && !m.isClaimed()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 提交成功后重新读链，结果里带的是变更之后的视图；读失败时不带视图。
     */
    private EscrowAccountView readAfterSubmit(String jobId) {
        try {
            return escrowClient.readAccount(jobId).orElse(null);
        } catch (EscrowException e) {
            log.warn("re-read after claim failed jobId={} err={}", jobId, e.toString());
            return null;
        }
    }

    private OperationResult convergeAfterRace(String jobId, int stageIndex, ChainSubmissionException cause) {
        ReconcileOutcome outcome = reconciliationEngine.reconcile(jobId);
        reconciliationEngine.requireNoDrift(outcome);
        EscrowAccountView view = outcome.getView();
        if (!view.stage(stageIndex).isClaimed()) {
            metrics.claim("stale");
            throw new StaleChainViewException("stage not claimed on re-read, chain view is stale jobId="
                    + jobId + " stage=" + stageIndex, cause);
        }
        metrics.claim("converged");
        return OperationResult.converged(jobId, stageIndex, REASON_ALREADY_CLAIMED, view);
    }

    private OperationResult resolveAfterTimeout(String jobId, int stageIndex, ChainTimeoutException cause) {
        log.warn("claim outcome unknown, re-reading chain jobId={} stage={} err={}", jobId, stageIndex, cause.toString());
        EscrowAccountView view = reconciliationEngine.reconcile(jobId).getView();
        if (view.stage(stageIndex).isClaimed()) {
            metrics.claim("converged");
            return OperationResult.converged(jobId, stageIndex, "CONFIRMED_AFTER_TIMEOUT", view);
        }
        metrics.claim("timeout");
        throw new TransientFailureException("claim not confirmed on chain, retry later jobId=" + jobId
                + " stage=" + stageIndex, cause);
    }
}
