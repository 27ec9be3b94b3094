package com.work.escrow.core.support;

import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示组件行为。
 * 注意：该实现仅用于 demo/测试，不具备跨进程一致性。读写都做防御性拷贝，模拟持久化存储的值语义。
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, Map<Integer, Milestone>> milestones = new ConcurrentHashMap<>();
    private final List<TransactionRecord> transactions = new CopyOnWriteArrayList<>();

    @Override
    public Optional<Job> findJob(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.copy());
    }

    @Override
    public void saveJob(Job job) {
        jobs.put(job.getId(), job.copy());
    }

    @Override
    public boolean insertJob(Job job) {
        return jobs.putIfAbsent(job.getId(), job.copy()) == null;
    }

    @Override
    public List<Milestone> listMilestones(String jobId) {
        Map<Integer, Milestone> byStage = milestones.get(jobId);
        if (byStage == null) {
            return new ArrayList<>();
        }
        return byStage.values().stream()
                .sorted(Comparator.comparingInt(Milestone::getStageNumber))
                .map(Milestone::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Milestone> findMilestone(String jobId, int stageNumber) {
        Map<Integer, Milestone> byStage = milestones.get(jobId);
        if (byStage == null) {
            return Optional.empty();
        }
        Milestone m = byStage.get(stageNumber);
        return m == null ? Optional.empty() : Optional.of(m.copy());
    }

    @Override
    public void saveMilestone(Milestone milestone) {
        milestones.computeIfAbsent(milestone.getJobId(), key -> new ConcurrentHashMap<>())
                .put(milestone.getStageNumber(), milestone.copy());
    }

    @Override
    public void updateMilestoneChainState(String jobId, int stageNumber, MilestoneStatus status,
                                          boolean paymentReleased, long amount, Instant updatedAt) {
        Map<Integer, Milestone> byStage = milestones.get(jobId);
        Milestone updated = byStage == null ? null : byStage.computeIfPresent(stageNumber, (key, current) -> {
            Milestone m = current.copy();
            m.setStatus(status);
            m.setPaymentReleased(paymentReleased);
            m.setAmount(amount);
            m.setUpdatedAt(updatedAt);
            return m;
        });
        if (updated == null) {
            throw new IllegalStateException("milestone not found jobId=" + jobId + " stage=" + stageNumber);
        }
    }

    @Override
    public synchronized void appendTransaction(TransactionRecord record) {
        if (record.getSignature() != null && findTransactionBySignature(record.getSignature()).isPresent()) {
            throw new IllegalStateException("transaction signature already recorded: " + record.getSignature());
        }
        transactions.add(record);
    }

    @Override
    public Optional<TransactionRecord> findTransactionBySignature(String signature) {
        if (signature == null) {
            return Optional.empty();
        }
        return transactions.stream().filter(t -> signature.equals(t.getSignature())).findFirst();
    }

    @Override
    public Optional<TransactionRecord> findTransaction(String milestoneId, TransactionType type) {
        if (milestoneId == null) {
            return Optional.empty();
        }
        return transactions.stream()
                .filter(t -> milestoneId.equals(t.getMilestoneId()) && t.getType() == type)
                .findFirst();
    }

    @Override
    public Optional<TransactionRecord> findJobTransaction(String jobId, TransactionType type) {
        return transactions.stream()
                .filter(t -> jobId.equals(t.getJobId()) && t.getType() == type)
                .findFirst();
    }

    @Override
    public List<TransactionRecord> listTransactions(String jobId) {
        return transactions.stream()
                .filter(t -> jobId.equals(t.getJobId()))
                .sorted(Comparator.comparing(TransactionRecord::getCreatedAt))
                .collect(Collectors.toList());
    }
}
