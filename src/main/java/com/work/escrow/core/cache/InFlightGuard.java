package com.work.escrow.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.time.Instant;

import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 同一 (jobId, stage, operation) 的在途请求去重，只用于改善交互体验。
 *
 * 正确性不依赖这里：即使条目过期或进程重启，协调器仍以链上状态收敛。
 */
public class InFlightGuard {

    private final Cache<String, Instant> inFlight;

    public InFlightGuard(Duration ttl, long maximumSize) {
        requirePositive(ttl, "ttl");
        this.inFlight = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
    }

    /**
     * @return false 表示已有同 key 的请求在途
     */
    public boolean tryAcquire(String jobId, Integer stageIndex, String operation) {
        return inFlight.asMap().putIfAbsent(key(jobId, stageIndex, operation), Instant.now()) == null;
    }

    public void release(String jobId, Integer stageIndex, String operation) {
        inFlight.invalidate(key(jobId, stageIndex, operation));
    }

    public boolean isInFlight(String jobId, Integer stageIndex, String operation) {
        return inFlight.getIfPresent(key(jobId, stageIndex, operation)) != null;
    }

    private static String key(String jobId, Integer stageIndex, String operation) {
        return jobId + "|" + (stageIndex == null ? "-" : stageIndex) + "|" + operation;
    }
}
