package com.work.escrow.core.funding;

import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requireValidJobId;

/**
 * 核验 job 的 escrow 是否已按约定金额注资；核验通过后激活镜像 job 并记录一次 STAKE。
 *
 * 只读链，不提交任何指令。
 */
public class FundingVerifier {

    private static final Logger log = LoggerFactory.getLogger(FundingVerifier.class);

    private final EscrowClient escrowClient;
    private final LedgerStore ledgerStore;

    public FundingVerifier(EscrowClient escrowClient, LedgerStore ledgerStore) {
        this.escrowClient = requireNonNull(escrowClient, "escrowClient");
        this.ledgerStore = requireNonNull(ledgerStore, "ledgerStore");
    }

    /**
     * @param expectedTotal      约定的总金额（base units）
     * @param fundingSignature   注资交易签名，未知时传 null
     */
    public FundingVerification verifyFunding(String jobId, long expectedTotal, String fundingSignature) {
        requireValidJobId(jobId);
        if (expectedTotal <= 0) {
            throw new IllegalArgumentException("expectedTotal 必须大于0");
        }
        Job job = ledgerStore.findJob(jobId)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.JOB_NOT_FOUND, jobId, null,
                        "job not found in ledger: " + jobId));

        Optional<EscrowAccountView> read = escrowClient.readAccount(jobId);
        if (!read.isPresent()) {
            return new FundingVerification(jobId, false, 0L, 0L, expectedTotal, "escrow account not found");
        }
        EscrowAccountView view = read.get();
        long remaining = view.remainingAmount();
        if (view.getStakedBalance() < remaining) {
            return new FundingVerification(jobId, false, view.getStakedBalance(), remaining, expectedTotal,
                    "escrow balance below unclaimed milestone total");
        }
        if (view.totalAmount() < expectedTotal) {
            return new FundingVerification(jobId, false, view.getStakedBalance(), remaining, expectedTotal,
                    "escrow milestone total below expected amount");
        }

        activate(job, view, fundingSignature);
        return new FundingVerification(jobId, true, view.getStakedBalance(), remaining, expectedTotal, null);
    }

    private void activate(Job job, EscrowAccountView view, String fundingSignature) {
        String jobId = job.getId();
        if (!ledgerStore.findJobTransaction(jobId, TransactionType.STAKE).isPresent()) {
            boolean known = fundingSignature != null && !fundingSignature.trim().isEmpty();
            String signature = known ? fundingSignature : "reconciled:" + jobId + ":stake";
            TransactionRecord stake = known
                    ? TransactionRecord.confirmed(jobId, null, view.getRecruiterWallet(), view.getEscrowAddress(),
                    view.totalAmount(), TransactionType.STAKE, signature)
                    : TransactionRecord.synthetic(jobId, null, view.getRecruiterWallet(), view.getEscrowAddress(),
                    view.totalAmount(), TransactionType.STAKE, signature);
            ledgerStore.appendTransaction(stake);
        }
        boolean changed = false;
        if (job.getStatus() == JobStatus.DRAFT || job.getStatus() == JobStatus.OPEN) {
            job.setStatus(JobStatus.ACTIVE);
            changed = true;
        }
        if (job.getEscrowAddress() == null) {
            job.setEscrowAddress(view.getEscrowAddress());
            changed = true;
        }
        if (job.getFreelancerWallet() == null) {
            job.setFreelancerWallet(view.getFreelancerWallet());
            changed = true;
        }
        if (changed) {
            job.setUpdatedAt(Instant.now());
            ledgerStore.saveJob(job);
            log.info("escrow funding verified, job activated jobId={} escrow={} staked={}",
                    jobId, view.getEscrowAddress(), view.getStakedBalance());
        }
    }
}
