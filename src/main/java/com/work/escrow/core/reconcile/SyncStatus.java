package com.work.escrow.core.reconcile;

public enum SyncStatus {
    /**
     * 镜像与链上一致，无需修正。
     */
    SYNCED,
    /**
     * 镜像落后于链上，本次对账已修正。
     */
    OUTDATED,
    /**
     * 存在不可自动修正的漂移。
     */
    DRIFT
}
