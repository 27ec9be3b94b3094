package com.work.escrow.app.web;

import com.work.escrow.app.web.dto.ErrorResponse;
import com.work.escrow.core.chain.ChainErrorKind;
import com.work.escrow.core.exception.AmountOutOfRangeException;
import com.work.escrow.core.exception.ChainRejectionException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.TransientFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    public void guard_violations_map_to_http_status() {
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusOf(GuardViolation.JOB_NOT_FOUND));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusOf(GuardViolation.NOT_FREELANCER));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusOf(GuardViolation.STAGE_OUT_OF_RANGE));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusOf(GuardViolation.OUT_OF_SEQUENCE));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusOf(GuardViolation.NOT_APPROVED));
    }

    @Test
    public void out_of_sequence_body_carries_reason_code() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/jobs/job1/milestones/3/approve");
        ResponseEntity<ErrorResponse> resp = handler.handleGuard(
                new GuardViolationException(GuardViolation.OUT_OF_SEQUENCE, "job1", 2, "earlier stages must be approved first"),
                req);

        assertEquals(HttpStatus.CONFLICT, resp.getStatusCode());
        assertEquals("OUT_OF_SEQUENCE", resp.getBody().getCode());
        assertFalse(resp.getBody().isRetryable());
    }

    @Test
    public void chain_rejection_and_transient_failure() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/jobs/job1/milestones/1/claim");

        ResponseEntity<ErrorResponse> rejected = handler.handleChainRejection(
                new ChainRejectionException(ChainErrorKind.INSUFFICIENT_FUNDS, "insufficient", null), req);
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, rejected.getStatusCode());
        assertEquals("CHAIN_INSUFFICIENT_FUNDS", rejected.getBody().getCode());

        ResponseEntity<ErrorResponse> transientFailure = handler.handleRetryable(
                new TransientFailureException("rpc down"), req);
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, transientFailure.getStatusCode());
        assertTrue(transientFailure.getBody().isRetryable());
    }

    @Test
    public void unrepresentable_chain_amount_is_not_retryable() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/jobs/job1/reconcile");

        ResponseEntity<ErrorResponse> resp = handler.handleAmount(
                new AmountOutOfRangeException("job1", "escrow balance out of range"), req);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, resp.getStatusCode());
        assertEquals("AMOUNT_OUT_OF_RANGE", resp.getBody().getCode());
        assertFalse(resp.getBody().isRetryable());
    }
}
