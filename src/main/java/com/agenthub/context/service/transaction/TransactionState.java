package com.agenthub.context.service.transaction;

public enum TransactionState {
    OPEN,
    COMMITTING,
    COMMITTED,
    FAILED,
    ROLLED_BACK
}
