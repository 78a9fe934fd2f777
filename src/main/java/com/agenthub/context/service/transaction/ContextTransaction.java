package com.agenthub.context.service.transaction;

import com.agenthub.context.exception.TransactionFailureException;
import com.agenthub.context.model.ContextScope;
import com.agenthub.context.model.ContextWriteRequest;
import com.agenthub.context.service.AgentContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 上下文事务
 * 操作先缓存，commit 时按提交顺序逐个执行；
 * 任一操作被拒绝或出错即停止，已执行的操作不会自动撤销
 */
public class ContextTransaction {

    private static final Logger log = LoggerFactory.getLogger(ContextTransaction.class);

    private final String id;
    private final AgentContextStore store;
    private final List<StagedOperation> staged = new ArrayList<>();
    private final AtomicReference<TransactionState> state = new AtomicReference<>(TransactionState.OPEN);
    private volatile TransactionReport report;

    public ContextTransaction(String id, AgentContextStore store) {
        this.id = id;
        this.store = store;
    }

    public String getId() {
        return id;
    }

    public TransactionState getState() {
        return state.get();
    }

    public synchronized ContextTransaction stageSet(ContextWriteRequest request) {
        ensureOpen();
        staged.add(new StagedOperation.SetOperation(request));
        return this;
    }

    public synchronized ContextTransaction stageDelete(String key, ContextScope scope, String agent) {
        ensureOpen();
        staged.add(new StagedOperation.DeleteOperation(key, scope, agent));
        return this;
    }

    public synchronized List<StagedOperation> stagedOperations() {
        return List.copyOf(staged);
    }

    /**
     * 提交
     * 全部成功返回 true；被拒绝返回 false；
     * 后端异常时以 TransactionFailureException 异常完成。
     * 已结束的事务再次调用返回 false
     */
    public CompletableFuture<Boolean> commit() {
        List<StagedOperation> operations;
        synchronized (this) {
            if (!state.compareAndSet(TransactionState.OPEN, TransactionState.COMMITTING)) {
                return CompletableFuture.completedFuture(false);
            }
            operations = List.copyOf(staged);
        }
        log.debug("Committing transaction: id={}, operations={}", id, operations.size());
        return applyFrom(operations, 0, new ArrayList<>());
    }

    /**
     * 提交前回滚，丢弃所有缓存的操作
     */
    public synchronized boolean rollback() {
        if (!state.compareAndSet(TransactionState.OPEN, TransactionState.ROLLED_BACK)) {
            return false;
        }
        staged.clear();
        report = TransactionReport.rolledBack(id);
        log.debug("Transaction rolled back: id={}", id);
        return true;
    }

    public Optional<TransactionReport> report() {
        return Optional.ofNullable(report);
    }

    private CompletableFuture<Boolean> applyFrom(List<StagedOperation> operations, int index, List<String> applied) {
        if (index == operations.size()) {
            report = TransactionReport.committed(id, applied);
            state.set(TransactionState.COMMITTED);
            log.info("Transaction committed: id={}, operations={}", id, applied.size());
            return CompletableFuture.completedFuture(true);
        }
        StagedOperation operation = operations.get(index);
        CompletableFuture<Boolean> attempt;
        try {
            attempt = operation.apply(store);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        return attempt.<CompletableFuture<Boolean>>handle((accepted, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                TransactionFailureException failure = fail(operation, applied, cause.getMessage(), cause);
                return CompletableFuture.<Boolean>failedFuture(failure);
            }
            if (!Boolean.TRUE.equals(accepted)) {
                fail(operation, applied, "denied, rejected or not found", null);
                return CompletableFuture.completedFuture(false);
            }
            applied.add(operation.describe());
            return applyFrom(operations, index + 1, applied);
        }).thenCompose(Function.identity());
    }

    private TransactionFailureException fail(StagedOperation operation, List<String> applied,
                                             String reason, Throwable cause) {
        TransactionFailureException failure = new TransactionFailureException(
            id, applied, operation.describe(), reason, cause);
        report = TransactionReport.failed(id, applied, failure);
        state.set(TransactionState.FAILED);
        log.warn("Transaction stopped: id={}, failed=[{}], applied={}", id, operation.describe(), applied);
        return failure;
    }

    private void ensureOpen() {
        if (state.get() != TransactionState.OPEN) {
            throw new IllegalStateException("Transaction " + id + " is " + state.get());
        }
    }
}
