package com.work.escrow.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 链下 milestone 镜像记录。
 *
 * 注意：
 * 1. status/paymentReleased 可能滞后于链上，但不得声称比链上更强的状态（由对账检测）
 * 2. stageNumber 从 1 开始且在 job 内连续；链上 stageIndex = stageNumber - 1
 */
public class Milestone {

    private String id;
    private String jobId;
    private int stageNumber;
    private long amount;
    private MilestoneStatus status;
    private boolean paymentReleased;
    private MilestoneSubmission submission;
    private String reviewerComments;
    private Instant submittedAt;
    private Instant reviewedAt;
    private Instant updatedAt;

    public Milestone() {
    }

    public Milestone(String id, String jobId, int stageNumber, long amount, MilestoneStatus status) {
        this.id = id;
        this.jobId = jobId;
        this.stageNumber = stageNumber;
        this.amount = amount;
        this.status = status;
        this.updatedAt = Instant.now();
    }

    public int getStageIndex() {
        return stageNumber - 1;
    }

    public Milestone copy() {
        Milestone c = new Milestone();
        c.id = id;
        c.jobId = jobId;
        c.stageNumber = stageNumber;
        c.amount = amount;
        c.status = status;
        c.paymentReleased = paymentReleased;
        c.submission = submission;
        c.reviewerComments = reviewerComments;
        c.submittedAt = submittedAt;
        c.reviewedAt = reviewedAt;
        c.updatedAt = updatedAt;
        return c;
    }

    /**
     * 只比较与链上状态相关以及链下审阅相关的字段，忽略 updatedAt（用于对账幂等判断）。
     */
    public boolean sameStateAs(Milestone other) {
        if (other == null) return false;
        return stageNumber == other.stageNumber
                && amount == other.amount
                && status == other.status
                && paymentReleased == other.paymentReleased
                && Objects.equals(id, other.id)
                && Objects.equals(submission, other.submission)
                && Objects.equals(reviewerComments, other.reviewerComments);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public int getStageNumber() {
        return stageNumber;
    }

    public void setStageNumber(int stageNumber) {
        this.stageNumber = stageNumber;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public MilestoneStatus getStatus() {
        return status;
    }

    public void setStatus(MilestoneStatus status) {
        this.status = status;
    }

    public boolean isPaymentReleased() {
        return paymentReleased;
    }

    public void setPaymentReleased(boolean paymentReleased) {
        this.paymentReleased = paymentReleased;
    }

    public MilestoneSubmission getSubmission() {
        return submission;
    }

    public void setSubmission(MilestoneSubmission submission) {
        this.submission = submission;
    }

    public String getReviewerComments() {
        return reviewerComments;
    }

    public void setReviewerComments(String reviewerComments) {
        this.reviewerComments = reviewerComments;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(Instant submittedAt) {
        this.submittedAt = submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public void setReviewedAt(Instant reviewedAt) {
        this.reviewedAt = reviewedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
