package com.work.escrow.app.web.dto;

import java.time.Instant;

public class ErrorResponse {

    private int status;
    /**
     * 机器可读的错误码，例如 OUT_OF_SEQUENCE、DRIFT_DETECTED
     */
    private String code;
    private String message;
    private boolean retryable;
    private String path;
    private Instant timestamp;

    public static ErrorResponse of(int status, String code, String message, boolean retryable, String path) {
        ErrorResponse r = new ErrorResponse();
        r.setStatus(status);
        r.setCode(code);
        r.setMessage(message);
        r.setRetryable(retryable);
        r.setPath(path);
        r.setTimestamp(Instant.now());
        return r;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
