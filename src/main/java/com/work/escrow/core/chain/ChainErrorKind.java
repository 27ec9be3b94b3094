package com.work.escrow.core.chain;

/**
 * 链上提交失败的分类。协调器只按分类分支，不做字符串匹配。
 */
public enum ChainErrorKind {
    ALREADY_APPROVED,
    ALREADY_CLAIMED,
    NOT_APPROVED,
    CANNOT_CANCEL_AFTER_APPROVAL,
    INSUFFICIENT_FUNDS,
    UNKNOWN
}
