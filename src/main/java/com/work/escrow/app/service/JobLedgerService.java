package com.work.escrow.app.service;

import com.work.escrow.app.web.dto.JobLedgerView;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireValidJobId;

/**
 * job 镜像的登记与查询。登记只写链下数据；注资后通过 verify-funding 激活。
 */
@Service
public class JobLedgerService {

    private static final Logger log = LoggerFactory.getLogger(JobLedgerService.class);

    private final LedgerStore ledgerStore;

    public JobLedgerService(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    public JobLedgerView register(String jobId, String recruiterWallet, String freelancerWallet, List<Long> amounts) {
        requireValidJobId(jobId);
        requireNonEmpty(recruiterWallet, "recruiterWallet");
        if (amounts == null || amounts.isEmpty()) {
            throw new IllegalArgumentException("milestoneAmounts 不能为空");
        }
        long total = 0L;
        for (Long a : amounts) {
            if (a == null || a <= 0) {
                throw new IllegalArgumentException("milestone 金额必须大于0");
            }
            total = Math.addExact(total, a);
        }
        Instant now = Instant.now();
        Job job = new Job(jobId, total, JobStatus.OPEN, recruiterWallet, freelancerWallet);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        if (!ledgerStore.insertJob(job)) {
            throw new IllegalStateException("job already registered: " + jobId);
        }
        for (int i = 0; i < amounts.size(); i++) {
            int stageNumber = i + 1;
            Milestone m = new Milestone(jobId + "-m" + stageNumber, jobId, stageNumber, amounts.get(i),
                    MilestoneStatus.PENDING);
            m.setUpdatedAt(now);
            ledgerStore.saveMilestone(m);
        }
        log.info("job registered jobId={} stages={} total={}", jobId, amounts.size(), total);
        return view(jobId);
    }

    public JobLedgerView view(String jobId) {
        requireValidJobId(jobId);
        Job job = ledgerStore.findJob(jobId)
                .orElseThrow(() -> new GuardViolationException(GuardViolation.JOB_NOT_FOUND, jobId, null,
                        "job not found in ledger: " + jobId));
        return new JobLedgerView(job, ledgerStore.listMilestones(jobId), ledgerStore.listTransactions(jobId));
    }
}
