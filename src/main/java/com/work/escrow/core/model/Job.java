package com.work.escrow.core.model;

import java.time.Instant;

/**
 * 链下 job 记录（镜像的一部分）。钱包字段是链上记录的缓存，身份校验一律以链上视图为准。
 */
public class Job {

    private String id;
    /**
     * 总金额（基础单位，定点）。
     */
    private long totalPayment;
    private JobStatus status;
    private String recruiterWallet;
    private String freelancerWallet;
    private String escrowAddress;
    private Instant createdAt;
    private Instant updatedAt;

    public Job() {
    }

    public Job(String id, long totalPayment, JobStatus status, String recruiterWallet, String freelancerWallet) {
        this.id = id;
        this.totalPayment = totalPayment;
        this.status = status;
        this.recruiterWallet = recruiterWallet;
        this.freelancerWallet = freelancerWallet;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public Job copy() {
        Job c = new Job();
        c.id = id;
        c.totalPayment = totalPayment;
        c.status = status;
        c.recruiterWallet = recruiterWallet;
        c.freelancerWallet = freelancerWallet;
        c.escrowAddress = escrowAddress;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getTotalPayment() {
        return totalPayment;
    }

    public void setTotalPayment(long totalPayment) {
        this.totalPayment = totalPayment;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getRecruiterWallet() {
        return recruiterWallet;
    }

    public void setRecruiterWallet(String recruiterWallet) {
        this.recruiterWallet = recruiterWallet;
    }

    public String getFreelancerWallet() {
        return freelancerWallet;
    }

    public void setFreelancerWallet(String freelancerWallet) {
        this.freelancerWallet = freelancerWallet;
    }

    public String getEscrowAddress() {
        return escrowAddress;
    }

    public void setEscrowAddress(String escrowAddress) {
        this.escrowAddress = escrowAddress;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
