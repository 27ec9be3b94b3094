package com.work.escrow.app.web;

/**
 * 同一 (jobId, stage, operation) 已有请求在途。
 */
public class InFlightConflictException extends RuntimeException {

    public InFlightConflictException(String message) {
        super(message);
    }
}
