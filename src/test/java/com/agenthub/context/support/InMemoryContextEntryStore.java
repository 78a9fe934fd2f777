package com.agenthub.context.support;

import com.agenthub.context.model.AccessRecord;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.ContextQuery;
import com.agenthub.context.repository.ContextEntryStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 内存版持久层，行为与 MongoContextEntryStore 一致：
 * 存取均为拷贝，update 追加写日志而不是整体覆盖
 */
public class InMemoryContextEntryStore implements ContextEntryStore {

    private final Map<String, ContextEntry> documents = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private volatile RuntimeException globalFailure;
    private volatile Duration deleteDelay = Duration.ZERO;

    /**
     * 之后所有调用都抛出 failure，传 null 恢复
     */
    public void failWith(RuntimeException failure) {
        this.globalFailure = failure;
    }

    /**
     * 涉及指定 full key 的调用抛出 failure
     */
    public void failFor(String fullKey, RuntimeException failure) {
        failures.put(fullKey, failure);
    }

    /**
     * deleteOne 完成删除后再阻塞 delay 才返回，模拟写入已生效但响应超时
     */
    public void delayDeleteBy(Duration delay) {
        this.deleteDelay = delay;
    }

    /**
     * 直接写入文档，绕过 Facade
     */
    public void seed(ContextEntry entry) {
        documents.put(entry.getId(), entry.copy());
    }

    public Optional<ContextEntry> raw(String fullKey) {
        return Optional.ofNullable(documents.get(fullKey)).map(ContextEntry::copy);
    }

    @Override
    public synchronized Optional<ContextEntry> findOne(String fullKey) {
        check(fullKey);
        return raw(fullKey);
    }

    @Override
    public synchronized boolean upsert(ContextEntry entry, long expectedVersion) {
        check(entry.getId());
        ContextEntry current = documents.get(entry.getId());
        if (expectedVersion == 0) {
            if (current != null) {
                return false;
            }
        } else if (current == null || current.getVersion() != expectedVersion) {
            return false;
        }
        documents.put(entry.getId(), entry.copy());
        return true;
    }

    @Override
    public synchronized boolean update(ContextEntry entry, long expectedVersion, AccessRecord writeRecord) {
        check(entry.getId());
        ContextEntry current = documents.get(entry.getId());
        if (current == null || current.getVersion() != expectedVersion) {
            return false;
        }
        ContextEntry stored = current.copy();
        stored.setValue(entry.copy().getValue());
        stored.setDataType(entry.getDataType());
        stored.setAccessLevel(entry.getAccessLevel());
        stored.setLastWriter(entry.getLastWriter());
        stored.setUpdatedAt(entry.getUpdatedAt());
        stored.setExpiresAt(entry.getExpiresAt());
        stored.setVersion(entry.getVersion());
        stored.setMetadata(new LinkedHashMap<>(entry.getMetadata()));
        stored.getAccessLog().add(writeRecord);
        documents.put(stored.getId(), stored);
        return true;
    }

    @Override
    public boolean deleteOne(String fullKey) {
        boolean removed;
        synchronized (this) {
            check(fullKey);
            removed = documents.remove(fullKey) != null;
        }
        Duration delay = deleteDelay;
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return removed;
    }

    @Override
    public synchronized Optional<ContextEntry> appendAccessLog(String fullKey, AccessRecord record) {
        check(fullKey);
        ContextEntry current = documents.get(fullKey);
        if (current == null) {
            return Optional.empty();
        }
        current.getAccessLog().add(record);
        return Optional.of(current.copy());
    }

    @Override
    public synchronized List<ContextEntry> query(ContextQuery query, Instant now) {
        check(null);
        Pattern keyPattern = query.getKeyPattern() == null ? null : Pattern.compile(query.getKeyPattern());
        List<ContextEntry> results = new ArrayList<>();
        for (ContextEntry entry : documents.values()) {
            if (query.getScope() != null && query.getScope() != entry.getScope()) {
                continue;
            }
            if (query.getDataType() != null && query.getDataType() != entry.getDataType()) {
                continue;
            }
            if (query.getOwnerAgent() != null && !query.getOwnerAgent().equals(entry.getOwnerAgent())) {
                continue;
            }
            if (keyPattern != null && !keyPattern.matcher(entry.getKey()).find()) {
                continue;
            }
            if (query.getCreatedAfter() != null && entry.getCreatedAt().isBefore(query.getCreatedAfter())) {
                continue;
            }
            if (query.getCreatedBefore() != null && entry.getCreatedAt().isAfter(query.getCreatedBefore())) {
                continue;
            }
            if (!query.isIncludeExpired() && entry.isExpired(now)) {
                continue;
            }
            results.add(entry.copy());
        }
        results.sort(Comparator.comparing(ContextEntry::getCreatedAt).reversed());
        return results;
    }

    @Override
    public void ensureIndexes() {
        check(null);
    }

    @Override
    public void ping() {
        check(null);
    }

    public int size() {
        return documents.size();
    }

    private void check(String fullKey) {
        RuntimeException failure = globalFailure;
        if (failure == null && fullKey != null) {
            failure = failures.get(fullKey);
        }
        if (failure != null) {
            throw failure;
        }
    }
}
