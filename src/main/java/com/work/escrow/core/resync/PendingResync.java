package com.work.escrow.core.resync;

import com.work.escrow.core.model.TransactionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一条待重新对账的 job，附带链上已确认但未写入镜像的交易记录。
 */
public final class PendingResync {

    private final String jobId;
    private final String reason;
    private final int attempts;
    private final Instant nextAttemptAt;
    private final Instant enqueuedAt;
    private final List<TransactionRecord> records;

    public PendingResync(String jobId, String reason, int attempts, Instant nextAttemptAt, Instant enqueuedAt,
                         List<TransactionRecord> records) {
        this.jobId = jobId;
        this.reason = reason;
        this.attempts = attempts;
        this.nextAttemptAt = nextAttemptAt;
        this.enqueuedAt = enqueuedAt;
        this.records = records == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(records));
    }

    PendingResync retryAt(Instant next, String lastError) {
        return new PendingResync(jobId, lastError == null ? reason : lastError, attempts + 1, next, enqueuedAt, records);
    }

    /**
     * 合并新的待补记录，签名相同的只保留一条；重试计数不变。
     */
    PendingResync withRecord(TransactionRecord record) {
        if (record == null) {
            return this;
        }
        for (TransactionRecord r : records) {
            if (Objects.equals(r.getSignature(), record.getSignature())) {
                return this;
            }
        }
        List<TransactionRecord> merged = new ArrayList<>(records);
        merged.add(record);
        return new PendingResync(jobId, reason, attempts, nextAttemptAt, enqueuedAt, merged);
    }

    public String getJobId() {
        return jobId;
    }

    public String getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public List<TransactionRecord> getRecords() {
        return records;
    }

    public boolean isDue(Instant now) {
        return !nextAttemptAt.isAfter(now);
    }
}
