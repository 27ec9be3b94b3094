package com.work.escrow.core.exception;

/**
 * 调用方依据的链上视图已过期（读到已批准，提交时合约却报未批准）。
 * 可重试，但必须先重新拉取状态；组件本身不自动重试。
 */
public class StaleChainViewException extends EscrowException {

    public StaleChainViewException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
