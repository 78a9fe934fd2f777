package com.agenthub.context.service.transaction;

import com.agenthub.context.model.ContextScope;
import com.agenthub.context.model.ContextWriteRequest;
import com.agenthub.context.service.AgentContextStore;

import java.util.concurrent.CompletableFuture;

/**
 * 事务中缓存的写操作，提交时经 Facade 执行，仍需通过鉴权与冲突解决
 */
public sealed interface StagedOperation permits StagedOperation.SetOperation, StagedOperation.DeleteOperation {

    CompletableFuture<Boolean> apply(AgentContextStore store);

    String describe();

    record SetOperation(ContextWriteRequest request) implements StagedOperation {

        @Override
        public CompletableFuture<Boolean> apply(AgentContextStore store) {
            return store.set(request);
        }

        @Override
        public String describe() {
            return "set " + request.fullKey() + " by " + request.getWriterAgent();
        }
    }

    record DeleteOperation(String key, ContextScope scope, String agent) implements StagedOperation {

        @Override
        public CompletableFuture<Boolean> apply(AgentContextStore store) {
            return store.delete(key, scope, agent);
        }

        @Override
        public String describe() {
            return "delete " + scope.getValue() + ":" + key + " by " + agent;
        }
    }
}
