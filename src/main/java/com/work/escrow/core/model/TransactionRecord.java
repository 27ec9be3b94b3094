package com.work.escrow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 追加式审计记录：只在链上操作确认后写入，写入后不可变。
 */
public final class TransactionRecord {

    private final UUID id;
    private final String jobId;
    private final String milestoneId;
    private final String fromWallet;
    private final String toWallet;
    private final long amount;
    private final TransactionType type;
    private final String signature;
    private final TransactionStatus status;
    /**
     * true 表示由对账补录（链上已发生但本地未记录）。
     */
    private final boolean synthetic;
    private final Instant createdAt;

    public TransactionRecord(UUID id,
                             String jobId,
                             String milestoneId,
                             String fromWallet,
                             String toWallet,
                             long amount,
                             TransactionType type,
                             String signature,
                             TransactionStatus status,
                             boolean synthetic,
                             Instant createdAt) {
        if (id == null) {
            throw new IllegalArgumentException("id 不能为null");
        }
        if (jobId == null || jobId.trim().isEmpty()) {
            throw new IllegalArgumentException("jobId 不能为空");
        }
        if (type == null) {
            throw new IllegalArgumentException("type 不能为null");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("amount 不能为负数");
        }
        this.id = id;
        this.jobId = jobId;
        this.milestoneId = milestoneId;
        this.fromWallet = fromWallet;
        this.toWallet = toWallet;
        this.amount = amount;
        this.type = type;
        this.signature = signature;
        this.status = status == null ? TransactionStatus.CONFIRMED : status;
        this.synthetic = synthetic;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static TransactionRecord confirmed(String jobId, String milestoneId, String fromWallet, String toWallet,
                                              long amount, TransactionType type, String signature) {
        return new TransactionRecord(UUID.randomUUID(), jobId, milestoneId, fromWallet, toWallet, amount, type,
                signature, TransactionStatus.CONFIRMED, false, Instant.now());
    }

    public static TransactionRecord synthetic(String jobId, String milestoneId, String fromWallet, String toWallet,
                                              long amount, TransactionType type, String signature) {
        return new TransactionRecord(UUID.randomUUID(), jobId, milestoneId, fromWallet, toWallet, amount, type,
                signature, TransactionStatus.CONFIRMED, true, Instant.now());
    }

    public UUID getId() {
        return id;
    }

    public String getJobId() {
        return jobId;
    }

    public String getMilestoneId() {
        return milestoneId;
    }

    public String getFromWallet() {
        return fromWallet;
    }

    public String getToWallet() {
        return toWallet;
    }

    public long getAmount() {
        return amount;
    }

    public TransactionType getType() {
        return type;
    }

    public String getSignature() {
        return signature;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
