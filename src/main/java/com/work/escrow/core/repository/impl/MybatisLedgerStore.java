package com.work.escrow.core.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.MilestoneSubmission;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionStatus;
import com.work.escrow.core.model.TransactionType;
import com.work.escrow.core.repository.entity.JobEntity;
import com.work.escrow.core.repository.entity.MilestoneEntity;
import com.work.escrow.core.repository.entity.TransactionRecordEntity;
import com.work.escrow.core.repository.mapper.JobMapper;
import com.work.escrow.core.repository.mapper.MilestoneMapper;
import com.work.escrow.core.repository.mapper.TransactionRecordMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 LedgerStore 实现。
 *
 * 注意：
 * 1. 每个方法是一条独立语句，不提供跨记录事务；调用方的不变量不依赖事务
 * 2. job/milestone 以 upsert 写入，后写为准；对账走只更新链上派生列的窄 UPDATE
 * 3. 交易记录以 signature 唯一约束保证只追加一次
 */
public class MybatisLedgerStore implements LedgerStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {
    };

    private final JobMapper jobMapper;
    private final MilestoneMapper milestoneMapper;
    private final TransactionRecordMapper transactionMapper;
    private final ObjectMapper objectMapper;

    public MybatisLedgerStore(JobMapper jobMapper,
                              MilestoneMapper milestoneMapper,
                              TransactionRecordMapper transactionMapper,
                              ObjectMapper objectMapper) {
        this.jobMapper = jobMapper;
        this.milestoneMapper = milestoneMapper;
        this.transactionMapper = transactionMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        requireNonEmpty(jobId, "jobId");
        return Optional.ofNullable(jobMapper.findJob(jobId)).map(this::toJob);
    }

    @Override
    public void saveJob(Job job) {
        requireNonNull(job, "job");
        jobMapper.upsertJob(toEntity(job));
    }

    @Override
    public boolean insertJob(Job job) {
        requireNonNull(job, "job");
        return jobMapper.insertIfAbsent(toEntity(job)) == 1;
    }

    @Override
    public List<Milestone> listMilestones(String jobId) {
        requireNonEmpty(jobId, "jobId");
        List<MilestoneEntity> rows = milestoneMapper.listByJob(jobId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<Milestone> out = new ArrayList<>(rows.size());
        for (MilestoneEntity e : rows) {
            out.add(toMilestone(e));
        }
        return out;
    }

    @Override
    public Optional<Milestone> findMilestone(String jobId, int stageNumber) {
        requireNonEmpty(jobId, "jobId");
        return Optional.ofNullable(milestoneMapper.findByStage(jobId, stageNumber)).map(this::toMilestone);
    }

    @Override
    public void saveMilestone(Milestone milestone) {
        requireNonNull(milestone, "milestone");
        MilestoneEntity e = new MilestoneEntity();
        e.setId(milestone.getId());
        e.setJobId(milestone.getJobId());
        e.setStageNumber(milestone.getStageNumber());
        e.setAmount(milestone.getAmount());
        e.setStatus(milestone.getStatus().name());
        e.setPaymentReleased(milestone.isPaymentReleased());
        MilestoneSubmission s = milestone.getSubmission();
        if (s != null) {
            e.setSubmissionDescription(s.getDescription());
            e.setSubmissionLinks(toJson(s.getLinks()));
            e.setSubmissionFiles(toJson(s.getFileReferences()));
        }
        e.setReviewerComments(milestone.getReviewerComments());
        e.setSubmittedAt(milestone.getSubmittedAt());
        e.setReviewedAt(milestone.getReviewedAt());
        e.setUpdatedAt(milestone.getUpdatedAt() == null ? Instant.now() : milestone.getUpdatedAt());
        milestoneMapper.upsertMilestone(e);
    }

    @Override
    public void updateMilestoneChainState(String jobId, int stageNumber, MilestoneStatus status,
                                          boolean paymentReleased, long amount, Instant updatedAt) {
        requireNonEmpty(jobId, "jobId");
        requireNonNull(status, "status");
        int updated = milestoneMapper.updateChainState(jobId, stageNumber, status.name(), paymentReleased, amount,
                updatedAt == null ? Instant.now() : updatedAt);
        if (updated != 1) {
            throw new IllegalStateException("milestone not found jobId=" + jobId + " stage=" + stageNumber);
        }
    }

    @Override
    public void appendTransaction(TransactionRecord record) {
        requireNonNull(record, "record");
        TransactionRecordEntity e = new TransactionRecordEntity();
        e.setId(record.getId());
        e.setJobId(record.getJobId());
        e.setMilestoneId(record.getMilestoneId());
        e.setFromWallet(record.getFromWallet());
        e.setToWallet(record.getToWallet());
        e.setAmount(record.getAmount());
        e.setType(record.getType().name());
        e.setSignature(record.getSignature());
        e.setStatus(record.getStatus().name());
        e.setSynthetic(record.isSynthetic());
        e.setCreatedAt(record.getCreatedAt());
        int inserted = transactionMapper.insertIfAbsent(e);
        if (inserted != 1) {
            throw new IllegalStateException("transaction signature already recorded: " + record.getSignature());
        }
    }

    @Override
    public Optional<TransactionRecord> findTransactionBySignature(String signature) {
        if (signature == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(transactionMapper.findBySignature(signature)).map(MybatisLedgerStore::toRecord);
    }

    @Override
    public Optional<TransactionRecord> findTransaction(String milestoneId, TransactionType type) {
        if (milestoneId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(transactionMapper.findByMilestoneAndType(milestoneId, type.name()))
                .map(MybatisLedgerStore::toRecord);
    }

    @Override
    public Optional<TransactionRecord> findJobTransaction(String jobId, TransactionType type) {
        requireNonEmpty(jobId, "jobId");
        return Optional.ofNullable(transactionMapper.findJobLevel(jobId, type.name())).map(MybatisLedgerStore::toRecord);
    }

    @Override
    public List<TransactionRecord> listTransactions(String jobId) {
        requireNonEmpty(jobId, "jobId");
        List<TransactionRecordEntity> rows = transactionMapper.listByJob(jobId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<TransactionRecord> out = new ArrayList<>(rows.size());
        for (TransactionRecordEntity e : rows) {
            out.add(toRecord(e));
        }
        return out;
    }

    private static JobEntity toEntity(Job job) {
        Instant now = Instant.now();
        JobEntity e = new JobEntity();
        e.setId(job.getId());
        e.setTotalPayment(job.getTotalPayment());
        e.setStatus(job.getStatus().name());
        e.setRecruiterWallet(job.getRecruiterWallet());
        e.setFreelancerWallet(job.getFreelancerWallet());
        e.setEscrowAddress(job.getEscrowAddress());
        e.setCreatedAt(job.getCreatedAt() == null ? now : job.getCreatedAt());
        e.setUpdatedAt(job.getUpdatedAt() == null ? now : job.getUpdatedAt());
        return e;
    }

    private Job toJob(JobEntity e) {
        Job job = new Job(e.getId(), e.getTotalPayment() == null ? 0L : e.getTotalPayment(),
                JobStatus.valueOf(e.getStatus()), e.getRecruiterWallet(), e.getFreelancerWallet());
        job.setEscrowAddress(e.getEscrowAddress());
        job.setCreatedAt(e.getCreatedAt());
        job.setUpdatedAt(e.getUpdatedAt());
        return job;
    }

    private Milestone toMilestone(MilestoneEntity e) {
        Milestone m = new Milestone(e.getId(), e.getJobId(), e.getStageNumber(),
                e.getAmount() == null ? 0L : e.getAmount(), MilestoneStatus.valueOf(e.getStatus()));
        m.setPaymentReleased(Boolean.TRUE.equals(e.getPaymentReleased()));
        if (e.getSubmissionDescription() != null) {
            m.setSubmission(new MilestoneSubmission(e.getSubmissionDescription(),
                    fromJson(e.getSubmissionLinks()), fromJson(e.getSubmissionFiles())));
        }
        m.setReviewerComments(e.getReviewerComments());
        m.setSubmittedAt(e.getSubmittedAt());
        m.setReviewedAt(e.getReviewedAt());
        m.setUpdatedAt(e.getUpdatedAt());
        return m;
    }

    private static TransactionRecord toRecord(TransactionRecordEntity e) {
        return new TransactionRecord(e.getId(), e.getJobId(), e.getMilestoneId(), e.getFromWallet(), e.getToWallet(),
                e.getAmount() == null ? 0L : e.getAmount(), TransactionType.valueOf(e.getType()), e.getSignature(),
                TransactionStatus.valueOf(e.getStatus()), Boolean.TRUE.equals(e.getSynthetic()), e.getCreatedAt());
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? Collections.emptyList() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize submission list", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to parse submission list: " + json, e);
        }
    }
}
