package com.work.escrow.app.web.dto;

import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.TransactionRecord;

import java.util.List;

/**
 * 镜像视图（可能落后于链上，需要最新状态时先调用 reconcile）。
 */
public class JobLedgerView {

    private Job job;
    private List<Milestone> milestones;
    private List<TransactionRecord> transactions;

    public JobLedgerView(Job job, List<Milestone> milestones, List<TransactionRecord> transactions) {
        this.job = job;
        this.milestones = milestones;
        this.transactions = transactions;
    }

    public Job getJob() {
        return job;
    }

    public List<Milestone> getMilestones() {
        return milestones;
    }

    public List<TransactionRecord> getTransactions() {
        return transactions;
    }
}
