package com.work.escrow.app.service;

import com.work.escrow.app.config.EscrowProperties;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.reconcile.ReconciliationEngine;
import com.work.escrow.core.resync.PendingResync;
import com.work.escrow.core.resync.PendingResyncQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 后台补偿对账：链上已成功但镜像写入失败的 job 在这里按退避重试对账。
 *
 * 单条失败不影响其他条目；超过最大次数后放弃并打 ERROR，等待人工处理或下一次用户操作触发的对账。
 */
@Component
@ConditionalOnProperty(prefix = "escrow", name = "resync-enabled", havingValue = "true", matchIfMissing = true)
public class ResyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResyncScheduler.class);

    private final EscrowProperties properties;
    private final PendingResyncQueue queue;
    private final ReconciliationEngine reconciliationEngine;
    private final EscrowMetrics metrics;

    public ResyncScheduler(EscrowProperties properties,
                           PendingResyncQueue queue,
                           ReconciliationEngine reconciliationEngine,
                           EscrowMetrics metrics) {
        this.properties = properties;
        this.queue = queue;
        this.reconciliationEngine = reconciliationEngine;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${escrow.resync-scan-interval-ms:5000}")
    public void runOnce() {
        Instant now = Instant.now();
        List<PendingResync> due = queue.due(now, Math.max(1, properties.getResyncBatchSize()));
        for (PendingResync item : due) {
            try {
                resync(item.getJobId());
                queue.remove(item.getJobId());
                metrics.resync("success");
                log.info("mirror resynced jobId={} attempts={}", item.getJobId(), item.getAttempts() + 1);
            } catch (Exception e) {
                handleFailure(item, now, e);
            }
        }
    }

    private void resync(String jobId) {
        try {
            reconciliationEngine.reconcile(jobId);
        } catch (GuardViolationException e) {
            // 取消会关闭链上账户，此时按关闭账户收敛镜像
            if (e.getReason() != GuardViolation.ESCROW_NOT_FOUND || !reconciliationEngine.settleClosedAccount(jobId)) {
                throw e;
            }
        }
    }

    private void handleFailure(PendingResync item, Instant now, Exception e) {
        int attempts = item.getAttempts() + 1;
        int max = Math.max(1, properties.getResyncMaxAttempts());
        if (attempts >= max) {
            queue.remove(item.getJobId());
            metrics.resync("exhausted");
            log.error("mirror resync exhausted jobId={} attempts={} reason={} err={}",
                    item.getJobId(), attempts, item.getReason(), e.toString());
            return;
        }
        Instant next = now.plus(backoff(attempts));
        queue.reschedule(item, next, e.toString());
        metrics.resync("error");
        log.warn("mirror resync failed jobId={} attempts={} next={} err={}", item.getJobId(), attempts, next, e.toString());
    }

    Duration backoff(int attempt) {
        long base = Math.max(1L, properties.getResyncBackoff().toMillis());
        long max = Math.max(base, properties.getResyncMaxBackoff().toMillis());
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.min(max, base * pow));
    }
}
