package com.work.escrow.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 资金回收工单：存在已批准的 milestone 时 recruiter 不能单方面取消，只能提交人工处理请求。
 * 附带完整的逐阶段链上快照用于审计。
 */
public final class ReclaimInquiry {

    private final UUID id;
    private final String jobId;
    private final String requesterWallet;
    private final String requesterContact;
    private final String note;
    private final long totalStaked;
    private final List<OnChainMilestone> milestoneSnapshots;
    private final Instant createdAt;

    public ReclaimInquiry(UUID id,
                          String jobId,
                          String requesterWallet,
                          String requesterContact,
                          String note,
                          long totalStaked,
                          List<OnChainMilestone> milestoneSnapshots,
                          Instant createdAt) {
        this.id = id == null ? UUID.randomUUID() : id;
        this.jobId = jobId;
        this.requesterWallet = requesterWallet;
        this.requesterContact = requesterContact;
        this.note = note;
        this.totalStaked = totalStaked;
        this.milestoneSnapshots = milestoneSnapshots == null ? Collections.emptyList()
                : Collections.unmodifiableList(milestoneSnapshots);
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getJobId() {
        return jobId;
    }

    public String getRequesterWallet() {
        return requesterWallet;
    }

    public String getRequesterContact() {
        return requesterContact;
    }

    public String getNote() {
        return note;
    }

    public long getTotalStaked() {
        return totalStaked;
    }

    public List<OnChainMilestone> getMilestoneSnapshots() {
        return milestoneSnapshots;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
