package com.work.escrow.app.web;

import com.work.escrow.app.web.dto.ErrorResponse;
import com.work.escrow.core.exception.AmountOutOfRangeException;
import com.work.escrow.core.exception.ChainRejectionException;
import com.work.escrow.core.exception.DriftDetectedException;
import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.StaleChainViewException;
import com.work.escrow.core.exception.StateViolationException;
import com.work.escrow.core.exception.TransientFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import javax.servlet.http.HttpServletRequest;

/**
 * 把核心异常映射为 HTTP 状态：
 * - guard：找不到 404，身份不符 403，其余 409
 * - 状态机违规 409，链上拒绝 422，漂移 409，链上金额无法换算 422
 * - 临时失败/视图过期 503（可重试）
 * - 参数校验 400
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GuardViolationException.class)
    public ResponseEntity<ErrorResponse> handleGuard(GuardViolationException ex, HttpServletRequest request) {
        return respond(statusOf(ex.getReason()), ex.getReason().name(), ex, request);
    }

    @ExceptionHandler(StateViolationException.class)
    public ResponseEntity<ErrorResponse> handleState(StateViolationException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "STATE_VIOLATION", ex, request);
    }

    @ExceptionHandler(ChainRejectionException.class)
    public ResponseEntity<ErrorResponse> handleChainRejection(ChainRejectionException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "CHAIN_" + ex.getKind().name(), ex, request);
    }

    @ExceptionHandler(AmountOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleAmount(AmountOutOfRangeException ex, HttpServletRequest request) {
        log.error("chain amount out of range path={} jobId={}", request.getRequestURI(), ex.getJobId());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "AMOUNT_OUT_OF_RANGE", ex, request);
    }

    @ExceptionHandler(DriftDetectedException.class)
    public ResponseEntity<ErrorResponse> handleDrift(DriftDetectedException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "DRIFT_DETECTED", ex, request);
    }

    @ExceptionHandler({TransientFailureException.class, StaleChainViewException.class})
    public ResponseEntity<ErrorResponse> handleRetryable(EscrowException ex, HttpServletRequest request) {
        String code = ex instanceof StaleChainViewException ? "STALE_CHAIN_VIEW" : "TRANSIENT_FAILURE";
        return respond(HttpStatus.SERVICE_UNAVAILABLE, code, ex, request);
    }

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<ErrorResponse> handleEscrow(EscrowException ex, HttpServletRequest request) {
        log.error("unclassified escrow error path={}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ESCROW_ERROR", ex, request);
    }

    @ExceptionHandler(InFlightConflictException.class)
    public ResponseEntity<ErrorResponse> handleInFlight(InFlightConflictException ex, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(HttpStatus.CONFLICT.value(), "IN_FLIGHT", ex.getMessage(), true,
                request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? ex.getMessage()
                : ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        ErrorResponse body = ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "VALIDATION", msg, false,
                request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "BAD_REQUEST", ex.getMessage(), false,
                request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    static HttpStatus statusOf(GuardViolation reason) {
        switch (reason) {
            case JOB_NOT_FOUND:
            case MILESTONE_NOT_FOUND:
            case ESCROW_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case NOT_RECRUITER:
            case NOT_FREELANCER:
                return HttpStatus.FORBIDDEN;
            case STAGE_OUT_OF_RANGE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.CONFLICT;
        }
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, EscrowException ex,
                                                  HttpServletRequest request) {
        if (status.is5xxServerError()) {
            log.warn("escrow request failed path={} code={} err={}", request.getRequestURI(), code, ex.getMessage());
        }
        ErrorResponse body = ErrorResponse.of(status.value(), code, ex.getMessage(), ex.isRetryable(),
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
