package com.work.escrow.core.review;

import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.MilestoneSubmission;
import com.work.escrow.core.statemachine.MilestoneStateMachine;
import com.work.escrow.core.statemachine.TransitionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requireValidJobId;

/**
 * 链下审阅流程：开始、提交交付物、请求修改。只写镜像，不涉及链上资金。
 *
 * 身份校验基于镜像中的钱包；涉及资金的操作（批准/领取）走协调器，以链上钱包为准。
 */
public class MilestoneReviewService {

    private static final Logger log = LoggerFactory.getLogger(MilestoneReviewService.class);

    private final LedgerStore ledgerStore;
    private final MilestoneStateMachine stateMachine;

    public MilestoneReviewService(LedgerStore ledgerStore, MilestoneStateMachine stateMachine) {
        this.ledgerStore = requireNonNull(ledgerStore, "ledgerStore");
        this.stateMachine = requireNonNull(stateMachine, "stateMachine");
    }

    public Milestone start(String jobId, int stageNumber, String freelancerWallet) {
        Job job = requireActiveJob(jobId);
        requireFreelancer(job, freelancerWallet, stageNumber);
        Milestone m = requireMilestone(jobId, stageNumber);
        m.setStatus(stateMachine.transition(m.getStatus(), MilestoneStatus.IN_PROGRESS, TransitionContext.offChain()));
        m.setUpdatedAt(Instant.now());
        ledgerStore.saveMilestone(m);
        return m;
    }

    public Milestone submit(String jobId, int stageNumber, String freelancerWallet, MilestoneSubmission submission) {
        requireNonNull(submission, "submission");
        requireNonEmpty(submission.getDescription(), "description");
        Job job = requireActiveJob(jobId);
        requireFreelancer(job, freelancerWallet, stageNumber);
        Milestone m = requireMilestone(jobId, stageNumber);
        m.setStatus(stateMachine.transition(m.getStatus(), MilestoneStatus.SUBMITTED, TransitionContext.offChain()));
        Instant now = Instant.now();
        m.setSubmission(submission);
        m.setSubmittedAt(now);
        m.setUpdatedAt(now);
        ledgerStore.saveMilestone(m);
        log.info("milestone submitted jobId={} stage={}", jobId, stageNumber);
        return m;
    }

    public Milestone requestRevision(String jobId, int stageNumber, String recruiterWallet, String comments) {
        requireNonEmpty(comments, "comments");
        Job job = requireActiveJob(jobId);
        if (recruiterWallet == null || !recruiterWallet.equals(job.getRecruiterWallet())) {
            throw new GuardViolationException(GuardViolation.NOT_RECRUITER, jobId, stageNumber - 1,
                    "only the recruiter can request a revision");
        }
        Milestone m = requireMilestone(jobId, stageNumber);
        m.setStatus(stateMachine.transition(m.getStatus(), MilestoneStatus.REVISION_REQUESTED,
                TransitionContext.offChain()));
        Instant now = Instant.now();
        m.setReviewerComments(comments);
        m.setReviewedAt(now);
        m.setUpdatedAt(now);
        ledgerStore.saveMilestone(m);
        log.info("revision requested jobId={} stage={}", jobId, stageNumber);
        return m;
    }

    private Job requireActiveJob(String jobId) {
        requireValidJobId(jobId);
        Job job = ledgerStore.findJob(jobId)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.JOB_NOT_FOUND, jobId, null,
                        "job not found in ledger: " + jobId));
        if (job.getStatus().isTerminal()) {
            throw new GuardViolationException(GuardViolation.JOB_NOT_ACTIVE, jobId, null,
                    "job is " + job.getStatus());
        }
        return job;
    }

    private static void requireFreelancer(Job job, String wallet, int stageNumber) {
        if (wallet == null || !wallet.equals(job.getFreelancerWallet())) {
            throw new GuardViolationException(GuardViolation.NOT_FREELANCER, job.getId(), stageNumber - 1,
                    "only the assigned freelancer can work on milestones");
        }
    }

    private Milestone requireMilestone(String jobId, int stageNumber) {
        return ledgerStore.findMilestone(jobId, stageNumber)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.MILESTONE_NOT_FOUND, jobId,
                        stageNumber - 1, "milestone " + stageNumber + " not found"));
    }
}
