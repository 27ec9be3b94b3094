package com.work.escrow.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;
import java.util.UUID;

/**
 * 人工退款请求表实体类
 */
@TableName("reclaim_inquiry")
public class ReclaimInquiryEntity {

    @TableId(type = IdType.INPUT)
    private UUID id;

    private String jobId;

    private String requesterWallet;

    private String requesterContact;

    private String note;

    private Long totalStaked;

    private String milestoneSnapshot;

    private Instant createdAt;

    public ReclaimInquiryEntity() {
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getRequesterWallet() {
        return requesterWallet;
    }

    public void setRequesterWallet(String requesterWallet) {
        this.requesterWallet = requesterWallet;
    }

    public String getRequesterContact() {
        return requesterContact;
    }

    public void setRequesterContact(String requesterContact) {
        this.requesterContact = requesterContact;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }

    public Long getTotalStaked() {
        return totalStaked;
    }

    public void setTotalStaked(Long totalStaked) {
        this.totalStaked = totalStaked;
    }

    public String getMilestoneSnapshot() {
        return milestoneSnapshot;
    }

    public void setMilestoneSnapshot(String milestoneSnapshot) {
        this.milestoneSnapshot = milestoneSnapshot;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
