package com.work.escrow.core.reconcile;

import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.exception.DriftDetectedException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
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
import com.work.escrow.core.resync.PendingResyncQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requireValidJobId;

/**
 * 对账引擎：每次都实时读链，把镜像修正到链上事实。
 *
 * 每个阶段的修正按优先级执行：
 * 1. 链上 claimed 而镜像未 paymentReleased：镜像置 CLAIMED，缺失时补一条合成 PAYMENT 记录
 * 2. 链上 approved 而镜像不在 {APPROVED, CLAIMED}：镜像置 APPROVED
 * 3. 镜像强于链上：记为漂移，不向下修正
 *
 * 修正直接写状态，不经过 {@link com.work.escrow.core.statemachine.MilestoneStateMachine}（链上已经发生的事实无需再校验）。
 * milestone 只回写链上派生字段（status / paymentReleased / amount），不覆盖并发写入的链下字段。
 * 镜像写入失败时排队的已确认记录，在补合成记录之前按原签名补写。
 * 没有链上变化时重复执行，镜像结果保持不变。
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    static final String SYNTHETIC_SIGNATURE_PREFIX = "reconciled:";

    private final EscrowClient escrowClient;
    private final LedgerStore ledgerStore;
    private final PendingResyncQueue pendingResyncQueue;
    private final EscrowMetrics metrics;

    public ReconciliationEngine(EscrowClient escrowClient,
                                LedgerStore ledgerStore,
                                PendingResyncQueue pendingResyncQueue,
                                EscrowMetrics metrics) {
        this.escrowClient = requireNonNull(escrowClient, "escrowClient");
        this.ledgerStore = requireNonNull(ledgerStore, "ledgerStore");
        this.pendingResyncQueue = requireNonNull(pendingResyncQueue, "pendingResyncQueue");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public ReconcileOutcome reconcile(String jobId) {
        requireValidJobId(jobId);

        // 先读镜像再读链：镜像只在链上成功之后写入，这样读到的镜像不会领先于本次链上视图
        Job job = ledgerStore.findJob(jobId)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.JOB_NOT_FOUND, jobId, null,
                        "job not found in ledger: " + jobId));
        Map<Integer, Milestone> byStage = new HashMap<>();
        for (Milestone m : ledgerStore.listMilestones(jobId)) {
            byStage.put(m.getStageNumber(), m);
        }
        EscrowAccountView view = escrowClient.readAccount(jobId)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.ESCROW_NOT_FOUND, jobId, null,
                        "no escrow account on chain for job " + jobId));

        List<Correction> corrections = new ArrayList<>();
        List<DriftRecord> drifts = new ArrayList<>();

        replayPendingRecords(jobId, corrections);
        checkChainInvariants(job, view, drifts);

        for (OnChainMilestone chainStage : view.getMilestones()) {
            Milestone mirror = byStage.get(chainStage.getStageNumber());
            if (mirror == null) {
                drifts.add(new DriftRecord(jobId, chainStage.getStageNumber(), DriftKind.MIRROR_MISSING_MILESTONE,
                        chainStage.toString(), "absent"));
                continue;
            }
            reconcileStage(view, chainStage, mirror, corrections, drifts);
        }

        reconcileJob(job, view, corrections, drifts);

        ReconcileReport report = new ReconcileReport(jobId, corrections, drifts);
        for (DriftRecord d : drifts) {
            log.error("drift detected jobId={} stage={} kind={} chain={} mirror={}",
                    jobId, d.getStageNumber(), d.getKind(), d.getChainSnapshot(), d.getMirrorSnapshot());
            metrics.drift(d.getKind().name());
        }
        if (!corrections.isEmpty()) {
            log.info("mirror corrected jobId={} corrections={}", jobId, corrections);
        }
        metrics.reconcile(report.getStatus().name());
        return new ReconcileOutcome(view, report);
    }

    /**
     * 存在漂移时拒绝任何变更操作。
     */
    public void requireNoDrift(ReconcileOutcome outcome) {
        ReconcileReport report = outcome.getReport();
        if (report.hasDrift()) {
            throw new DriftDetectedException(report.getJobId(), report.getDrifts());
        }
    }

    /**
     * 链上账户已关闭（合约只有取消会关闭账户）时，把镜像收敛为 CANCELLED 并补记一条退款记录。
     *
     * @return true 表示账户确已关闭且镜像已收敛；false 表示账户仍存在或从未注资
     */
    public boolean settleClosedAccount(String jobId) {
        requireValidJobId(jobId);
        if (escrowClient.readAccount(jobId).isPresent()) {
            return false;
        }
        Job job = ledgerStore.findJob(jobId)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.JOB_NOT_FOUND, jobId, null,
                        "job not found in ledger: " + jobId));
        if (job.getEscrowAddress() == null && !ledgerStore.findJobTransaction(jobId, TransactionType.STAKE).isPresent()) {
            return false;
        }

        replayPendingRecords(jobId, new ArrayList<>());
        if (!ledgerStore.findJobTransaction(jobId, TransactionType.REFUND).isPresent()) {
            long refund = 0L;
            for (Milestone m : ledgerStore.listMilestones(jobId)) {
                if (!m.isPaymentReleased()) {
                    refund += m.getAmount();
                }
            }
            ledgerStore.appendTransaction(TransactionRecord.synthetic(jobId, null, job.getEscrowAddress(),
                    job.getRecruiterWallet(), refund, TransactionType.REFUND,
                    SYNTHETIC_SIGNATURE_PREFIX + jobId + ":refund"));
        }
        if (job.getStatus() != JobStatus.CANCELLED) {
            log.info("escrow closed on chain, mirror job cancelled jobId={} previous={}", jobId, job.getStatus());
            job.setStatus(JobStatus.CANCELLED);
            job.setUpdatedAt(Instant.now());
            ledgerStore.saveJob(job);
        }
        metrics.reconcile("closed");
        return true;
    }

    private void checkChainInvariants(Job job, EscrowAccountView view, List<DriftRecord> drifts) {
        for (OnChainMilestone m : view.getMilestones()) {
            if (m.isApproved() && !view.priorStagesApproved(m.getStageIndex())) {
                drifts.add(new DriftRecord(job.getId(), m.getStageNumber(), DriftKind.NON_SEQUENTIAL_CHAIN_APPROVAL,
                        view.toString(), "n/a"));
            }
        }
        long claimed = view.claimedAmount();
        long stake = job.getTotalPayment() > 0 ? job.getTotalPayment() : view.totalAmount();
        if (claimed > stake) {
            drifts.add(new DriftRecord(job.getId(), null, DriftKind.CLAIMED_EXCEEDS_STAKE,
                    "claimed=" + claimed, "totalPayment=" + job.getTotalPayment()));
        }
    }

    private void reconcileStage(EscrowAccountView view,
                                OnChainMilestone chainStage,
                                Milestone mirror,
                                List<Correction> corrections,
                                List<DriftRecord> drifts) {
        Milestone before = mirror.copy();
        Integer stage = chainStage.getStageNumber();
        String jobId = mirror.getJobId();

        if (chainStage.isClaimed()) {
            if (!mirror.isPaymentReleased() || mirror.getStatus() != MilestoneStatus.CLAIMED) {
                // 先补记录再写状态：中途失败时下次对账仍会看到 paymentReleased=false 并重试
                ensurePaymentRecord(view, chainStage, mirror, corrections);
                mirror.setStatus(MilestoneStatus.CLAIMED);
                mirror.setPaymentReleased(true);
            }
        } else if (chainStage.isApproved()) {
            if (mirror.isPaymentReleased() || mirror.getStatus() == MilestoneStatus.CLAIMED) {
                drifts.add(new DriftRecord(jobId, stage, DriftKind.MIRROR_AHEAD_OF_CHAIN,
                        chainStage.toString(), describe(mirror)));
            } else if (mirror.getStatus() != MilestoneStatus.APPROVED) {
                mirror.setStatus(MilestoneStatus.APPROVED);
            }
        } else if (mirror.isPaymentReleased() || mirror.getStatus().impliesApproved()) {
            drifts.add(new DriftRecord(jobId, stage, DriftKind.MIRROR_AHEAD_OF_CHAIN,
                    chainStage.toString(), describe(mirror)));
        }

        if (mirror.getAmount() != chainStage.getAmount()) {
            mirror.setAmount(chainStage.getAmount());
        }

        if (!mirror.sameStateAs(before)) {
            if (before.getStatus() != mirror.getStatus()) {
                corrections.add(new Correction(jobId, stage, "status", before.getStatus(), mirror.getStatus()));
            }
            if (before.isPaymentReleased() != mirror.isPaymentReleased()) {
                corrections.add(new Correction(jobId, stage, "paymentReleased",
                        before.isPaymentReleased(), mirror.isPaymentReleased()));
            }
            if (before.getAmount() != mirror.getAmount()) {
                corrections.add(new Correction(jobId, stage, "amount", before.getAmount(), mirror.getAmount()));
            }
            ledgerStore.updateMilestoneChainState(jobId, stage, mirror.getStatus(), mirror.isPaymentReleased(),
                    mirror.getAmount(), Instant.now());
        }
    }

    private void replayPendingRecords(String jobId, List<Correction> corrections) {
        for (TransactionRecord record : pendingResyncQueue.pendingRecords(jobId)) {
            if (alreadyRecorded(record)) {
                continue;
            }
            ledgerStore.appendTransaction(record);
            log.info("pending confirmed record written jobId={} type={} sig={}", jobId, record.getType(), record.getSignature());
            corrections.add(new Correction(jobId, null, "pendingRecord", "absent", record.getSignature()));
        }
    }

    private boolean alreadyRecorded(TransactionRecord record) {
        if (ledgerStore.findTransactionBySignature(record.getSignature()).isPresent()) {
            return true;
        }
        switch (record.getType()) {
            case PAYMENT:
                return ledgerStore.findTransaction(record.getMilestoneId(), TransactionType.PAYMENT).isPresent();
            case REFUND:
            case STAKE:
                return ledgerStore.findJobTransaction(record.getJobId(), record.getType()).isPresent();
            default:
                return false;
        }
    }

    private void ensurePaymentRecord(EscrowAccountView view,
                                     OnChainMilestone chainStage,
                                     Milestone mirror,
                                     List<Correction> corrections) {
        if (ledgerStore.findTransaction(mirror.getId(), TransactionType.PAYMENT).isPresent()) {
            return;
        }
        String signature = SYNTHETIC_SIGNATURE_PREFIX + mirror.getJobId() + ":" + chainStage.getStageIndex();
        if (ledgerStore.findTransactionBySignature(signature).isPresent()) {
            return;
        }
        ledgerStore.appendTransaction(TransactionRecord.synthetic(mirror.getJobId(), mirror.getId(),
                view.getEscrowAddress(), view.getFreelancerWallet(), chainStage.getAmount(),
                TransactionType.PAYMENT, signature));
        corrections.add(new Correction(mirror.getJobId(), chainStage.getStageNumber(), "paymentRecord",
                "absent", signature));
    }

    private void reconcileJob(Job job, EscrowAccountView view, List<Correction> corrections, List<DriftRecord> drifts) {
        Job before = job.copy();
        String jobId = job.getId();

        if (!Objects.equals(job.getRecruiterWallet(), view.getRecruiterWallet())) {
            job.setRecruiterWallet(view.getRecruiterWallet());
            corrections.add(new Correction(jobId, null, "recruiterWallet",
                    before.getRecruiterWallet(), view.getRecruiterWallet()));
        }
        if (!Objects.equals(job.getFreelancerWallet(), view.getFreelancerWallet())) {
            job.setFreelancerWallet(view.getFreelancerWallet());
            corrections.add(new Correction(jobId, null, "freelancerWallet",
                    before.getFreelancerWallet(), view.getFreelancerWallet()));
        }
        if (!Objects.equals(job.getEscrowAddress(), view.getEscrowAddress())) {
            job.setEscrowAddress(view.getEscrowAddress());
            corrections.add(new Correction(jobId, null, "escrowAddress",
                    before.getEscrowAddress(), view.getEscrowAddress()));
        }

        JobStatus status = job.getStatus();
        if (status == JobStatus.CANCELLED) {
            // 账户仍存在说明链上并未取消
            drifts.add(new DriftRecord(jobId, null, DriftKind.MIRROR_AHEAD_OF_CHAIN, view.toString(), "status=CANCELLED"));
        } else if (status == JobStatus.COMPLETED && !view.allClaimed()) {
            drifts.add(new DriftRecord(jobId, null, DriftKind.MIRROR_AHEAD_OF_CHAIN, view.toString(), "status=COMPLETED"));
        } else if (view.allClaimed() && status != JobStatus.COMPLETED) {
            job.setStatus(JobStatus.COMPLETED);
        } else if (status == JobStatus.DRAFT || status == JobStatus.OPEN) {
            job.setStatus(JobStatus.ACTIVE);
        }
        if (job.getStatus() != before.getStatus()) {
            corrections.add(new Correction(jobId, null, "status", before.getStatus(), job.getStatus()));
        }

        if (job.getStatus() != before.getStatus()
                || !Objects.equals(job.getRecruiterWallet(), before.getRecruiterWallet())
                || !Objects.equals(job.getFreelancerWallet(), before.getFreelancerWallet())
                || !Objects.equals(job.getEscrowAddress(), before.getEscrowAddress())) {
            job.setUpdatedAt(Instant.now());
            ledgerStore.saveJob(job);
        }
    }

    private static String describe(Milestone m) {
        return "Milestone{stage=" + m.getStageNumber() + ", status=" + m.getStatus()
                + ", paymentReleased=" + m.isPaymentReleased() + ", amount=" + m.getAmount() + '}';
    }
}
