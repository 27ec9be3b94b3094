package com.work.escrow.core.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class InFlightGuardTest {

    @Test
    public void second_acquire_rejected_until_release() {
        InFlightGuard guard = new InFlightGuard(Duration.ofMinutes(1), 100);

        assertTrue(guard.tryAcquire("job1", 0, "approve"));
        assertFalse(guard.tryAcquire("job1", 0, "approve"));
        assertTrue(guard.isInFlight("job1", 0, "approve"));

        guard.release("job1", 0, "approve");
        assertFalse(guard.isInFlight("job1", 0, "approve"));
        assertTrue(guard.tryAcquire("job1", 0, "approve"));
    }

    @Test
    public void keys_are_scoped_by_stage_and_operation() {
        InFlightGuard guard = new InFlightGuard(Duration.ofMinutes(1), 100);

        assertTrue(guard.tryAcquire("job1", 0, "approve"));
        assertTrue(guard.tryAcquire("job1", 1, "approve"));
        assertTrue(guard.tryAcquire("job1", 0, "claim"));
        assertTrue(guard.tryAcquire("job1", null, "cancel"));
        assertFalse(guard.tryAcquire("job1", null, "cancel"));
    }

    @Test
    public void entries_expire() throws Exception {
        InFlightGuard guard = new InFlightGuard(Duration.ofMillis(50), 100);

        assertTrue(guard.tryAcquire("job1", 0, "claim"));
        Thread.sleep(150);
        assertFalse(guard.isInFlight("job1", 0, "claim"));
        assertTrue(guard.tryAcquire("job1", 0, "claim"));
    }
}
