package com.work.escrow.core.chain;

import java.util.Locale;

/**
 * 链客户端前面的唯一分类层：把原始错误信息（合约错误名或错误消息）映射为 {@link ChainErrorKind}。
 *
 * 覆盖合约错误码名称（如 MilestoneAlreadyApproved）与其人类可读消息两种形式。
 */
public final class ChainErrorClassifier {

    private ChainErrorClassifier() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static ChainErrorKind classify(String rawMessage) {
        if (rawMessage == null || rawMessage.trim().isEmpty()) {
            return ChainErrorKind.UNKNOWN;
        }
        String m = rawMessage.toLowerCase(Locale.ROOT);
        if (m.contains("milestonealreadyapproved") || m.contains("already been approved")) {
            return ChainErrorKind.ALREADY_APPROVED;
        }
        if (m.contains("milestonealreadyclaimed") || m.contains("already been claimed")) {
            return ChainErrorKind.ALREADY_CLAIMED;
        }
        if (m.contains("milestonenotapproved") || m.contains("not been approved")) {
            return ChainErrorKind.NOT_APPROVED;
        }
        if (m.contains("cannotcancelafterapproval") || m.contains("cancel job after milestone approval")) {
            return ChainErrorKind.CANNOT_CANCEL_AFTER_APPROVAL;
        }
        if (m.contains("insufficientescrowbalance") || m.contains("insufficient funds")
                || m.contains("insufficient balance")) {
            return ChainErrorKind.INSUFFICIENT_FUNDS;
        }
        return ChainErrorKind.UNKNOWN;
    }

    /**
     * 沿 cause 链查找第一个可识别的分类。
     */
    public static ChainErrorKind classify(Throwable error) {
        Throwable cur = error;
        int depth = 0;
        while (cur != null && depth++ < 8) {
            if (cur instanceof ChainSubmissionException) {
                return ((ChainSubmissionException) cur).getKind();
            }
            ChainErrorKind kind = classify(cur.getMessage());
            if (kind != ChainErrorKind.UNKNOWN) {
                return kind;
            }
            cur = cur.getCause();
        }
        return ChainErrorKind.UNKNOWN;
    }
}
