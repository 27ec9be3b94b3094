package com.work.escrow.core.reconcile;

import com.work.escrow.core.model.EscrowAccountView;

/**
 * 对账结果：本次读取到的链上视图 + 修正/漂移报告。
 *
 * 调用方的安全检查必须基于 {@link #getView()}，而不是刚修正过的镜像。
 */
public final class ReconcileOutcome {

    private final EscrowAccountView view;
    private final ReconcileReport report;

    public ReconcileOutcome(EscrowAccountView view, ReconcileReport report) {
        this.view = view;
        this.report = report;
    }

    public EscrowAccountView getView() {
        return view;
    }

    public ReconcileReport getReport() {
        return report;
    }
}
