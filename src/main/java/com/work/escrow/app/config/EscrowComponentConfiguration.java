package com.work.escrow.app.config;

import com.work.escrow.core.approval.ApprovalCoordinator;
import com.work.escrow.core.cache.InFlightGuard;
import com.work.escrow.core.cancel.CancellationDecisionEngine;
import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.chain.MockEscrowClient;
import com.work.escrow.core.chain.TimeLimitedEscrowClient;
import com.work.escrow.core.claim.ClaimCoordinator;
import com.work.escrow.core.funding.FundingVerifier;
import com.work.escrow.core.inquiry.InMemoryInquirySink;
import com.work.escrow.core.inquiry.InquirySink;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.metrics.NoopEscrowMetrics;
import com.work.escrow.core.reconcile.ReconciliationEngine;
import com.work.escrow.core.resync.LaggingMirrorWriter;
import com.work.escrow.core.resync.PendingResyncQueue;
import com.work.escrow.core.review.MilestoneReviewService;
import com.work.escrow.core.statemachine.MilestoneStateMachine;
import com.work.escrow.core.support.InMemoryLedgerStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 将核心组件装配为 Spring Bean。
 *
 * 链客户端：默认内存合约；chain.mode=web3j 时由 {@link Web3jConfiguration} 提供 chainEscrowClient。
 * 镜像存储：默认内存；escrow.ledger-mode=postgres 时由 {@link MybatisPersistenceConfiguration} 提供。
 */
@Configuration
@EnableConfigurationProperties({EscrowProperties.class, ChainProperties.class})
public class EscrowComponentConfiguration {

    @Bean(name = "chainEscrowClient")
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public MockEscrowClient mockEscrowClient() {
        return new MockEscrowClient();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService escrowChainExecutor(EscrowProperties properties) {
        AtomicInteger seq = new AtomicInteger(1);
        return Executors.newFixedThreadPool(Math.max(1, properties.getChainCallThreads()), r -> {
            Thread t = new Thread(r, "escrow-chain-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 组件内部统一使用带超时边界的客户端。
     */
    @Bean
    @Primary
    public EscrowClient escrowClient(@Qualifier("chainEscrowClient") EscrowClient delegate,
                                     ExecutorService escrowChainExecutor,
                                     EscrowProperties properties) {
        return new TimeLimitedEscrowClient(delegate, escrowChainExecutor,
                properties.getChainReadTimeout(), properties.getChainSubmitTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "escrow", name = "ledger-mode", havingValue = "memory", matchIfMissing = true)
    public LedgerStore inMemoryLedgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "escrow", name = "ledger-mode", havingValue = "memory", matchIfMissing = true)
    public InquirySink inMemoryInquirySink() {
        return new InMemoryInquirySink();
    }

    /**
     * 默认使用 Noop 实现，避免强依赖具体监控系统；平台可自定义 EscrowMetrics Bean 覆盖。
     */
    @Bean
    @ConditionalOnMissingBean(EscrowMetrics.class)
    public EscrowMetrics escrowMetrics() {
        return new NoopEscrowMetrics();
    }

    @Bean
    public MilestoneStateMachine milestoneStateMachine() {
        return new MilestoneStateMachine();
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(EscrowClient escrowClient, LedgerStore ledgerStore,
                                                     PendingResyncQueue queue, EscrowMetrics metrics) {
        return new ReconciliationEngine(escrowClient, ledgerStore, queue, metrics);
    }

    @Bean
    public PendingResyncQueue pendingResyncQueue() {
        return new PendingResyncQueue();
    }

    @Bean
    public LaggingMirrorWriter laggingMirrorWriter(PendingResyncQueue queue, EscrowMetrics metrics) {
        return new LaggingMirrorWriter(queue, metrics);
    }

    @Bean
    public ApprovalCoordinator approvalCoordinator(ReconciliationEngine engine, EscrowClient escrowClient,
                                                   LedgerStore ledgerStore, MilestoneStateMachine stateMachine,
                                                   LaggingMirrorWriter mirrorWriter, EscrowMetrics metrics) {
        return new ApprovalCoordinator(engine, escrowClient, ledgerStore, stateMachine, mirrorWriter, metrics);
    }

    @Bean
    public ClaimCoordinator claimCoordinator(ReconciliationEngine engine, EscrowClient escrowClient,
                                             LedgerStore ledgerStore, MilestoneStateMachine stateMachine,
                                             LaggingMirrorWriter mirrorWriter, EscrowMetrics metrics) {
        return new ClaimCoordinator(engine, escrowClient, ledgerStore, stateMachine, mirrorWriter, metrics);
    }

    @Bean
    public CancellationDecisionEngine cancellationDecisionEngine(ReconciliationEngine engine, EscrowClient escrowClient,
                                                                 LedgerStore ledgerStore, InquirySink inquirySink,
                                                                 LaggingMirrorWriter mirrorWriter,
                                                                 EscrowMetrics metrics) {
        return new CancellationDecisionEngine(engine, escrowClient, ledgerStore, inquirySink, mirrorWriter, metrics);
    }

    @Bean
    public FundingVerifier fundingVerifier(EscrowClient escrowClient, LedgerStore ledgerStore) {
        return new FundingVerifier(escrowClient, ledgerStore);
    }

    @Bean
    public MilestoneReviewService milestoneReviewService(LedgerStore ledgerStore, MilestoneStateMachine stateMachine) {
        return new MilestoneReviewService(ledgerStore, stateMachine);
    }

    @Bean
    public InFlightGuard inFlightGuard(EscrowProperties properties) {
        return new InFlightGuard(properties.getInFlightTtl(), properties.getInFlightMaxSize());
    }
}
