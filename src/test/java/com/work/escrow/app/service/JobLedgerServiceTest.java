package com.work.escrow.app.service;

import com.work.escrow.app.web.dto.JobLedgerView;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.support.InMemoryLedgerStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JobLedgerServiceTest {

    private final JobLedgerService service = new JobLedgerService(new InMemoryLedgerStore());

    @Test
    public void register_creates_open_job_with_pending_milestones() {
        JobLedgerView view = service.register("job1", "r", "f", Arrays.asList(1L, 2L, 3L));

        assertEquals(JobStatus.OPEN, view.getJob().getStatus());
        assertEquals(6L, view.getJob().getTotalPayment());
        assertEquals(3, view.getMilestones().size());
        assertEquals("job1-m2", view.getMilestones().get(1).getId());
        assertEquals(MilestoneStatus.PENDING, view.getMilestones().get(2).getStatus());
        assertTrue(view.getTransactions().isEmpty());
    }

    @Test
    public void register_rejects_bad_input_and_duplicates() {
        assertThrows(IllegalArgumentException.class, () -> service.register("job1", "r", "f", Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> service.register("job1", "r", "f", Arrays.asList(1L, 0L)));

        service.register("job1", "r", "f", Collections.singletonList(1L));
        assertThrows(IllegalStateException.class, () -> service.register("job1", "r", "f", Collections.singletonList(1L)));
    }

    @Test
    public void concurrent_registration_keeps_first_writer() throws Exception {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        JobLedgerService svc = new JobLedgerService(store);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String recruiter = "r" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        svc.register("job1", recruiter, "f", Collections.singletonList(1L));
                        return recruiter;
                    } catch (IllegalStateException e) {
                        return null;
                    }
                }));
            }
            start.countDown();
            List<String> winners = new ArrayList<>();
            for (Future<String> r : results) {
                String w = r.get(5, TimeUnit.SECONDS);
                if (w != null) {
                    winners.add(w);
                }
            }
            assertEquals(1, winners.size());
            assertEquals(winners.get(0), store.findJob("job1").get().getRecruiterWallet());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void unknown_job() {
        GuardViolationException e = assertThrows(GuardViolationException.class, () -> service.view("nope"));
        assertEquals(GuardViolation.JOB_NOT_FOUND, e.getReason());
    }
}
