package com.work.escrow.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * job 镜像表实体类
 */
@TableName("escrow_job")
public class JobEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    private Long totalPayment;

    private String status;

    private String recruiterWallet;

    private String freelancerWallet;

    private String escrowAddress;

    private Instant createdAt;

    private Instant updatedAt;

    public JobEntity() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Long getTotalPayment() {
        return totalPayment;
    }

    public void setTotalPayment(Long totalPayment) {
        this.totalPayment = totalPayment;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
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
