package com.work.escrow.core.exception;

/**
 * 网络/超时类失败。重试“读”是安全的；重试“提交”前必须重新校验前置条件。
 */
public class TransientFailureException extends EscrowException {

    public TransientFailureException(String message) {
        super(message);
    }

    public TransientFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
