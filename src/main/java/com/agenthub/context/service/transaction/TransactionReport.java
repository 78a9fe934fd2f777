package com.agenthub.context.service.transaction;

import com.agenthub.context.exception.TransactionFailureException;

import java.util.List;
import java.util.Optional;

/**
 * 事务执行结果
 * 失败时 appliedOperations 列出已生效且不会回滚的操作
 */
public record TransactionReport(
    String transactionId,
    TransactionState state,
    List<String> appliedOperations,
    String failedOperation,
    TransactionFailureException failure
) {

    public TransactionReport {
        appliedOperations = List.copyOf(appliedOperations);
    }

    static TransactionReport committed(String transactionId, List<String> applied) {
        return new TransactionReport(transactionId, TransactionState.COMMITTED, applied, null, null);
    }

    static TransactionReport failed(String transactionId, List<String> applied, TransactionFailureException failure) {
        return new TransactionReport(transactionId, TransactionState.FAILED, applied,
            failure.getFailedOperation(), failure);
    }

    static TransactionReport rolledBack(String transactionId) {
        return new TransactionReport(transactionId, TransactionState.ROLLED_BACK, List.of(), null, null);
    }

    public boolean isCommitted() {
        return state == TransactionState.COMMITTED;
    }

    public Optional<TransactionFailureException> failureCause() {
        return Optional.ofNullable(failure);
    }
}
