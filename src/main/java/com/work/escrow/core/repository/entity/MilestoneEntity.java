package com.work.escrow.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * milestone 镜像表实体类（提交内容的 links/files 以 JSON 文本存储）
 */
@TableName("escrow_milestone")
public class MilestoneEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    private String jobId;

    private Integer stageNumber;

    private Long amount;

    private String status;

    private Boolean paymentReleased;

    private String submissionDescription;

    private String submissionLinks;

    private String submissionFiles;

    private String reviewerComments;

    private Instant submittedAt;

    private Instant reviewedAt;

    private Instant updatedAt;

    public MilestoneEntity() {
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

    public Integer getStageNumber() {
        return stageNumber;
    }

    public void setStageNumber(Integer stageNumber) {
        this.stageNumber = stageNumber;
    }

    public Long getAmount() {
        return amount;
    }

    public void setAmount(Long amount) {
        this.amount = amount;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Boolean getPaymentReleased() {
        return paymentReleased;
    }

    public void setPaymentReleased(Boolean paymentReleased) {
        this.paymentReleased = paymentReleased;
    }

    public String getSubmissionDescription() {
        return submissionDescription;
    }

    public void setSubmissionDescription(String submissionDescription) {
        this.submissionDescription = submissionDescription;
    }

    public String getSubmissionLinks() {
        return submissionLinks;
    }

    public void setSubmissionLinks(String submissionLinks) {
        this.submissionLinks = submissionLinks;
    }

    public String getSubmissionFiles() {
        return submissionFiles;
    }

    public void setSubmissionFiles(String submissionFiles) {
        this.submissionFiles = submissionFiles;
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
