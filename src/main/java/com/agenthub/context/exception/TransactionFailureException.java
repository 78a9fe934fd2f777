package com.agenthub.context.exception;

import java.util.List;

/**
 * 事务提交中途失败，已执行的操作不会自动回滚
 */
public class TransactionFailureException extends ContextStoreException {

    private final String transactionId;
    private final List<String> appliedOperations;
    private final String failedOperation;

    public TransactionFailureException(String transactionId, List<String> appliedOperations,
                                       String failedOperation, String reason, Throwable cause) {
        super("Transaction " + transactionId + " stopped at [" + failedOperation + "]: " + reason
            + ", already applied: " + appliedOperations, cause);
        this.transactionId = transactionId;
        this.appliedOperations = List.copyOf(appliedOperations);
        this.failedOperation = failedOperation;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public List<String> getAppliedOperations() {
        return appliedOperations;
    }

    public String getFailedOperation() {
        return failedOperation;
    }
}
