package com.work.escrow.core.model;

public enum TransactionType {
    STAKE,
    PAYMENT,
    REFUND,
    /**
     * 审批本身不移动资金，仅作为审计轨迹中的标记（amount=0）。
     */
    APPROVAL_MARKER
}
