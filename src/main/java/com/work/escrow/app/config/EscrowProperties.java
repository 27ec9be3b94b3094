package com.work.escrow.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于宿主包，用于从 application.yml 读取配置。
 */
@ConfigurationProperties(prefix = "escrow")
public class EscrowProperties {

    /**
     * 单次链上读取的超时
     */
    private Duration chainReadTimeout = Duration.ofSeconds(5);

    /**
     * 单次链上提交（含等待回执）的超时；超时后结果未知，按灰区处理
     */
    private Duration chainSubmitTimeout = Duration.ofSeconds(60);

    /**
     * 执行链调用的线程数
     */
    private int chainCallThreads = 8;

    /**
     * REST 层在途请求去重的过期时间
     */
    private Duration inFlightTtl = Duration.ofMinutes(2);

    private long inFlightMaxSize = 10_000L;

    private boolean resyncEnabled = true;

    /**
     * 后台补偿对账的扫描间隔（毫秒）
     */
    private long resyncScanIntervalMs = 5000L;

    /**
     * 补偿对账最多尝试次数，超过后放弃并告警
     */
    private int resyncMaxAttempts = 10;

    /**
     * 补偿对账的初始退避，按 2 的幂增长，不超过 resyncMaxBackoff
     */
    private Duration resyncBackoff = Duration.ofSeconds(2);

    private Duration resyncMaxBackoff = Duration.ofMinutes(5);

    private int resyncBatchSize = 100;

    /**
     * memory 或 postgres
     */
    private String ledgerMode = "memory";

    public Duration getChainReadTimeout() {
        return chainReadTimeout;
    }

    public void setChainReadTimeout(Duration chainReadTimeout) {
        this.chainReadTimeout = chainReadTimeout;
    }

    public Duration getChainSubmitTimeout() {
        return chainSubmitTimeout;
    }

    public void setChainSubmitTimeout(Duration chainSubmitTimeout) {
        this.chainSubmitTimeout = chainSubmitTimeout;
    }

    public int getChainCallThreads() {
        return chainCallThreads;
    }

    public void setChainCallThreads(int chainCallThreads) {
        this.chainCallThreads = chainCallThreads;
    }

    public Duration getInFlightTtl() {
        return inFlightTtl;
    }

    public void setInFlightTtl(Duration inFlightTtl) {
        this.inFlightTtl = inFlightTtl;
    }

    public long getInFlightMaxSize() {
        return inFlightMaxSize;
    }

    public void setInFlightMaxSize(long inFlightMaxSize) {
        this.inFlightMaxSize = inFlightMaxSize;
    }

    public boolean isResyncEnabled() {
        return resyncEnabled;
    }

    public void setResyncEnabled(boolean resyncEnabled) {
        this.resyncEnabled = resyncEnabled;
    }

    public long getResyncScanIntervalMs() {
        return resyncScanIntervalMs;
    }

    public void setResyncScanIntervalMs(long resyncScanIntervalMs) {
        this.resyncScanIntervalMs = resyncScanIntervalMs;
    }

    public int getResyncMaxAttempts() {
        return resyncMaxAttempts;
    }

    public void setResyncMaxAttempts(int resyncMaxAttempts) {
        this.resyncMaxAttempts = resyncMaxAttempts;
    }

    public Duration getResyncBackoff() {
        return resyncBackoff;
    }

    public void setResyncBackoff(Duration resyncBackoff) {
        this.resyncBackoff = resyncBackoff;
    }

    public Duration getResyncMaxBackoff() {
        return resyncMaxBackoff;
    }

    public void setResyncMaxBackoff(Duration resyncMaxBackoff) {
        this.resyncMaxBackoff = resyncMaxBackoff;
    }

    public int getResyncBatchSize() {
        return resyncBatchSize;
    }

    public void setResyncBatchSize(int resyncBatchSize) {
        this.resyncBatchSize = resyncBatchSize;
    }

    public String getLedgerMode() {
        return ledgerMode;
    }

    public void setLedgerMode(String ledgerMode) {
        this.ledgerMode = ledgerMode;
    }
}
