package com.work.escrow.core.resync;

import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 链上已确认之后的镜像写入：失败不影响操作结果，只标记滞后并排队后台对账。
 */
public class LaggingMirrorWriter {

    private static final Logger log = LoggerFactory.getLogger(LaggingMirrorWriter.class);

    private final PendingResyncQueue queue;
    private final EscrowMetrics metrics;

    public LaggingMirrorWriter(PendingResyncQueue queue, EscrowMetrics metrics) {
        this.queue = queue;
        this.metrics = metrics;
    }

    /**
     * @return true 表示写入成功；false 表示镜像滞后，已排队
     */
    public boolean write(String jobId, String operation, Runnable mirrorWrite) {
        return write(jobId, operation, null, mirrorWrite);
    }

    /**
     * @param confirmed 本次写入要落库的链上交易记录；写入失败时随条目入队，对账时按原签名补写
     * @return true 表示写入成功；false 表示镜像滞后，已排队
     */
    public boolean write(String jobId, String operation, TransactionRecord confirmed, Runnable mirrorWrite) {
        try {
            mirrorWrite.run();
            return true;
        } catch (RuntimeException e) {
            log.warn("mirror write failed after chain success jobId={} op={} sig={} err={}", jobId, operation,
                    confirmed == null ? null : confirmed.getSignature(), e.toString());
            metrics.mirrorWriteFailed(operation);
            queue.enqueue(jobId, operation + ": " + e.getMessage(), confirmed);
            return false;
        }
    }
}
