package com.work.escrow.core.resync;

import com.work.escrow.core.model.TransactionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;

/**
 * 镜像写入失败后待补偿的 job（进程内，按 jobId 去重）。
 *
 * 条目里保存链上已确认的交易记录，对账时按原签名补写。
 * 丢失队列不影响正确性：任何后续变更操作都会先对账，缺失的记录以合成记录补齐。
 */
public class PendingResyncQueue {

    private final ConcurrentMap<String, PendingResync> pending = new ConcurrentHashMap<>();

    /**
     * 已在队列中的 job 保留原有的重试计数。
     */
    public void enqueue(String jobId, String reason) {
        enqueue(jobId, reason, null);
    }

    /**
     * @param record 链上已确认、待写入镜像的记录；可为 null
     */
    public void enqueue(String jobId, String reason, TransactionRecord record) {
        requireNonEmpty(jobId, "jobId");
        Instant now = Instant.now();
        pending.compute(jobId, (key, existing) -> existing == null
                ? new PendingResync(jobId, reason, 0, now, now,
                record == null ? null : Collections.singletonList(record))
                : existing.withRecord(record));
    }

    /**
     * 该 job 待补写的已确认记录。
     */
    public List<TransactionRecord> pendingRecords(String jobId) {
        PendingResync p = pending.get(jobId);
        return p == null ? Collections.emptyList() : p.getRecords();
    }

    public List<PendingResync> due(Instant now, int limit) {
        List<PendingResync> out = new ArrayList<>();
        for (PendingResync p : pending.values()) {
            if (out.size() >= limit) {
                break;
            }
            if (p.isDue(now)) {
                out.add(p);
            }
        }
        return out;
    }

    public void remove(String jobId) {
        pending.remove(jobId);
    }

    /**
     * 记录一次失败并推迟到 nextAttemptAt，返回更新后的条目。
     */
    public PendingResync reschedule(PendingResync item, Instant nextAttemptAt, String lastError) {
        PendingResync updated = item.retryAt(nextAttemptAt, lastError);
        pending.replace(item.getJobId(), updated);
        return updated;
    }

    public boolean contains(String jobId) {
        return pending.containsKey(jobId);
    }

    public int size() {
        return pending.size();
    }
}
