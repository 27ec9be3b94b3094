package com.work.escrow.app.service;

import com.work.escrow.app.config.EscrowProperties;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.TransientFailureException;
import com.work.escrow.core.metrics.EscrowMetrics;
import com.work.escrow.core.reconcile.ReconciliationEngine;
import com.work.escrow.core.resync.PendingResync;
import com.work.escrow.core.resync.PendingResyncQueue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ResyncSchedulerTest {

    private final EscrowProperties props = new EscrowProperties();
    private final PendingResyncQueue queue = new PendingResyncQueue();
    private final ReconciliationEngine engine = mock(ReconciliationEngine.class);
    private final EscrowMetrics metrics = mock(EscrowMetrics.class);

    private ResyncScheduler scheduler() {
        return new ResyncScheduler(props, queue, engine, metrics);
    }

    @Test
    public void resync_success_removes_item() {
        queue.enqueue("job1", "claim: ledger unavailable");

        scheduler().runOnce();

        verify(engine, times(1)).reconcile("job1");
        assertFalse(queue.contains("job1"));
        verify(metrics).resync("success");
    }

    @Test
    public void resync_failure_reschedules_with_backoff() {
        props.setResyncBackoff(Duration.ofSeconds(30));
        queue.enqueue("job1", "approve: ledger unavailable");
        when(engine.reconcile("job1")).thenThrow(new TransientFailureException("rpc down"));

        scheduler().runOnce();

        assertTrue(queue.contains("job1"));
        verify(metrics).resync("error");
        assertTrue(queue.due(Instant.now(), 10).isEmpty());
        List<PendingResync> later = queue.due(Instant.now().plusSeconds(31), 10);
        assertEquals(1, later.size());
        assertEquals(1, later.get(0).getAttempts());
    }

    @Test
    public void resync_gives_up_after_max_attempts() {
        props.setResyncMaxAttempts(1);
        queue.enqueue("job1", "claim: ledger unavailable");
        when(engine.reconcile("job1")).thenThrow(new TransientFailureException("rpc down"));

        scheduler().runOnce();

        assertFalse(queue.contains("job1"));
        verify(metrics).resync("exhausted");
    }

    @Test
    public void closed_account_settles_cancellation() {
        queue.enqueue("job1", "cancel: ledger unavailable");
        when(engine.reconcile("job1")).thenThrow(
                new GuardViolationException(GuardViolation.ESCROW_NOT_FOUND, "job1", null, "no escrow"));
        when(engine.settleClosedAccount("job1")).thenReturn(true);

        scheduler().runOnce();

        verify(engine).settleClosedAccount("job1");
        assertFalse(queue.contains("job1"));
        verify(metrics).resync("success");
    }

    @Test
    public void other_guard_violations_are_failures() {
        queue.enqueue("job1", "claim: ledger unavailable");
        when(engine.reconcile("job1")).thenThrow(
                new GuardViolationException(GuardViolation.JOB_NOT_FOUND, "job1", null, "gone"));

        scheduler().runOnce();

        verify(engine, never()).settleClosedAccount(anyString());
        assertTrue(queue.contains("job1"));
        verify(metrics).resync("error");
    }

    @Test
    public void backoff_doubles_up_to_max() {
        props.setResyncBackoff(Duration.ofSeconds(2));
        props.setResyncMaxBackoff(Duration.ofSeconds(10));
        ResyncScheduler s = scheduler();

        assertEquals(Duration.ofSeconds(2), s.backoff(1));
        assertEquals(Duration.ofSeconds(4), s.backoff(2));
        assertEquals(Duration.ofSeconds(8), s.backoff(3));
        assertEquals(Duration.ofSeconds(10), s.backoff(4));
        assertEquals(Duration.ofSeconds(10), s.backoff(30));
    }
}
