package com.work.escrow.core.chain;

import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.OnChainMilestone;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Demo 级 escrow 合约：内存中模拟合约规则，仅用于本地运行与测试，真实项目请替换为链上实现。
 *
 * 规则与合约一致：
 * - approve 只允许 recruiter，同一阶段只能批准一次（不校验顺序，顺序由组件校验）
 * - claim 只允许 freelancer，必须已批准且未领取，资金从 escrow 转出
 * - cancel 只允许 recruiter，且任何阶段已批准则拒绝；退还未领取余额并关闭账户
 */
public class MockEscrowClient implements EscrowClient {

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final AtomicLong signatureSeq = new AtomicLong(1);

    private final AtomicInteger approveSubmissions = new AtomicInteger();
    private final AtomicInteger claimSubmissions = new AtomicInteger();
    private final AtomicInteger cancelSubmissions = new AtomicInteger();
    private final AtomicInteger appliedApprovals = new AtomicInteger();
    private final AtomicInteger appliedClaims = new AtomicInteger();

    private static class Account {
        final String escrowAddress;
        final String recruiter;
        final String freelancer;
        final long[] amounts;
        final boolean[] approved;
        final boolean[] claimed;
        long balance;

        Account(String escrowAddress, String recruiter, String freelancer, long[] amounts) {
            this.escrowAddress = escrowAddress;
            this.recruiter = recruiter;
            this.freelancer = freelancer;
            this.amounts = amounts.clone();
            this.approved = new boolean[amounts.length];
            this.claimed = new boolean[amounts.length];
            long total = 0L;
            for (long a : amounts) {
                total += a;
            }
            this.balance = total;
        }
    }

    /**
     * 创建 escrow 并一次性锁定全部金额（对应合约的 create_job_escrow）。
     */
    public String fund(String jobId, String recruiter, String freelancer, long... milestoneAmounts) {
        if (milestoneAmounts == null || milestoneAmounts.length == 0) {
            throw new ChainSubmissionException(ChainErrorKind.UNKNOWN, "InvalidMilestoneAmount: no milestones");
        }
        for (long a : milestoneAmounts) {
            if (a <= 0) {
                throw new ChainSubmissionException(ChainErrorKind.UNKNOWN,
                        "InvalidMilestoneAmount: All milestone amounts must be greater than 0");
            }
        }
        String address = "escrow_" + recruiter + "_" + jobId;
        Account prev = accounts.putIfAbsent(jobId, new Account(address, recruiter, freelancer, milestoneAmounts));
        if (prev != null) {
            throw new ChainSubmissionException(ChainErrorKind.UNKNOWN, "escrow account already in use: " + address);
        }
        return nextSignature("fund", jobId, -1);
    }

    @Override
    public Optional<EscrowAccountView> readAccount(String jobId) {
        Account a = accounts.get(jobId);
        if (a == null) {
            return Optional.empty();
        }
        synchronized (a) {
            List<OnChainMilestone> ms = new ArrayList<>(a.amounts.length);
            for (int i = 0; i < a.amounts.length; i++) {
                ms.add(new OnChainMilestone(i, a.amounts[i], a.approved[i], a.claimed[i]));
            }
            return Optional.of(new EscrowAccountView(jobId, a.escrowAddress, a.balance, a.recruiter, a.freelancer,
                    ms, Instant.now()));
        }
    }

    @Override
    public String submitApprove(String jobId, int stageIndex, WalletSigner signer) {
        approveSubmissions.incrementAndGet();
        Account a = requireAccount(jobId);
        synchronized (a) {
            requireSigner(a.recruiter, signer);
            requireIndex(a, stageIndex);
            if (a.approved[stageIndex]) {
                throw new ChainSubmissionException(ChainErrorKind.ALREADY_APPROVED,
                        "MilestoneAlreadyApproved: Milestone has already been approved");
            }
            a.approved[stageIndex] = true;
            appliedApprovals.incrementAndGet();
        }
        return nextSignature("approve", jobId, stageIndex);
    }

    @Override
    public String submitClaim(String jobId, int stageIndex, WalletSigner signer) {
        claimSubmissions.incrementAndGet();
        Account a = requireAccount(jobId);
        synchronized (a) {
            requireSigner(a.freelancer, signer);
            requireIndex(a, stageIndex);
            if (!a.approved[stageIndex]) {
                throw new ChainSubmissionException(ChainErrorKind.NOT_APPROVED,
                        "MilestoneNotApproved: Milestone has not been approved yet");
            }
            if (a.claimed[stageIndex]) {
                throw new ChainSubmissionException(ChainErrorKind.ALREADY_CLAIMED,
                        "MilestoneAlreadyClaimed: Milestone has already been claimed");
            }
            if (a.balance < a.amounts[stageIndex]) {
                throw new ChainSubmissionException(ChainErrorKind.INSUFFICIENT_FUNDS,
                        "InsufficientEscrowBalance: Insufficient balance in escrow");
            }
            a.balance -= a.amounts[stageIndex];
            a.claimed[stageIndex] = true;
            appliedClaims.incrementAndGet();
        }
        return nextSignature("claim", jobId, stageIndex);
    }

    @Override
    public String submitCancel(String jobId, WalletSigner signer) {
        cancelSubmissions.incrementAndGet();
        Account a = requireAccount(jobId);
        synchronized (a) {
            requireSigner(a.recruiter, signer);
            for (boolean approved : a.approved) {
                if (approved) {
                    throw new ChainSubmissionException(ChainErrorKind.CANNOT_CANCEL_AFTER_APPROVAL,
                            "CannotCancelAfterApproval: Cannot cancel job after milestone approval");
                }
            }
            // close = recruiter：账户关闭，剩余余额全部退还
            a.balance = 0L;
            accounts.remove(jobId, a);
        }
        return nextSignature("cancel", jobId, -1);
    }

    /**
     * 模拟另一个参与方（另一个浏览器会话/后台任务）绕过本组件直接批准。
     */
    public void approveOutOfBand(String jobId, int stageIndex) {
        Account a = requireAccount(jobId);
        synchronized (a) {
            a.approved[stageIndex] = true;
        }
    }

    /**
     * 模拟另一个参与方直接完成领取。
     */
    public void claimOutOfBand(String jobId, int stageIndex) {
        Account a = requireAccount(jobId);
        synchronized (a) {
            a.approved[stageIndex] = true;
            if (!a.claimed[stageIndex]) {
                a.claimed[stageIndex] = true;
                a.balance -= a.amounts[stageIndex];
            }
        }
    }

    public int getApproveSubmissions() {
        return approveSubmissions.get();
    }

    public int getClaimSubmissions() {
        return claimSubmissions.get();
    }

    public int getCancelSubmissions() {
        return cancelSubmissions.get();
    }

    public int getAppliedApprovals() {
        return appliedApprovals.get();
    }

    public int getAppliedClaims() {
        return appliedClaims.get();
    }

    public int totalSubmissions() {
        return approveSubmissions.get() + claimSubmissions.get() + cancelSubmissions.get();
    }

    private Account requireAccount(String jobId) {
        Account a = accounts.get(jobId);
        if (a == null) {
            throw new ChainSubmissionException(ChainErrorKind.UNKNOWN, "AccountNotInitialized: escrow for job " + jobId);
        }
        return a;
    }

    private void requireSigner(String expected, WalletSigner signer) {
        if (signer == null || expected == null || !expected.equals(signer.getWalletAddress())) {
            throw new ChainSubmissionException(ChainErrorKind.UNKNOWN,
                    "ConstraintHasOne: A has one constraint was violated");
        }
    }

    private void requireIndex(Account a, int stageIndex) {
        if (stageIndex < 0 || stageIndex >= a.amounts.length) {
            throw new ChainSubmissionException(ChainErrorKind.UNKNOWN,
                    "InvalidMilestoneIndex: Invalid milestone index " + stageIndex);
        }
    }

    private String nextSignature(String op, String jobId, int stageIndex) {
        // 真实链上签名唯一，这里用自增序号作为简化的唯一后缀
        return "sig_" + op + "_" + jobId + (stageIndex >= 0 ? "_" + stageIndex : "") + "_" + signatureSeq.getAndIncrement();
    }
}
