package com.work.escrow.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 */
public class EscrowException extends RuntimeException {

    public EscrowException(String message) {
        super(message);
    }

    public EscrowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试（重新读取链上状态后再发起）解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
