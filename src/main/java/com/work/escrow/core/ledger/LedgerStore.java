package com.work.escrow.core.ledger;

import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 链下镜像存储。
 *
 * 注意：
 * 1. 不假设跨记录事务，组件的不变量在部分写入下也必须成立
 * 2. 同一字段的并发写入以后写为准（对账与协调器的写入都来自链上事实）；对账只写链上派生字段
 * 3. 交易记录只追加，不更新
 */
public interface LedgerStore {

    Optional<Job> findJob(String jobId);

    void saveJob(Job job);

    /**
     * 仅在 job 不存在时插入。
     *
     * @return false 表示已存在，未写入
     */
    boolean insertJob(Job job);

    /**
     * 按 stageNumber 升序返回。
     */
    List<Milestone> listMilestones(String jobId);

    Optional<Milestone> findMilestone(String jobId, int stageNumber);

    void saveMilestone(Milestone milestone);

    /**
     * 只更新链上派生字段，评审意见、提交内容等链下字段保持库里的当前值。
     *
     * @throws IllegalStateException milestone 不存在
     */
    void updateMilestoneChainState(String jobId, int stageNumber, MilestoneStatus status, boolean paymentReleased,
                                   long amount, Instant updatedAt);

    void appendTransaction(TransactionRecord record);

    Optional<TransactionRecord> findTransactionBySignature(String signature);

    Optional<TransactionRecord> findTransaction(String milestoneId, TransactionType type);

    /**
     * 没有 milestone 关联的记录（STAKE/REFUND）按 job 查找。
     */
    Optional<TransactionRecord> findJobTransaction(String jobId, TransactionType type);

    List<TransactionRecord> listTransactions(String jobId);
}
