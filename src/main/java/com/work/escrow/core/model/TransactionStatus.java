package com.work.escrow.core.model;

public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
