package com.agenthub.context.service;

import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.exception.ContextStoreException;
import com.agenthub.context.model.AccessIntent;
import com.agenthub.context.model.AccessLevel;
import com.agenthub.context.model.AccessRecord;
import com.agenthub.context.model.ChangeOperation;
import com.agenthub.context.model.ConflictStrategy;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.ContextQuery;
import com.agenthub.context.model.ContextScope;
import com.agenthub.context.model.ContextWriteRequest;
import com.agenthub.context.model.DataType;
import com.agenthub.context.repository.ContextEntryStore;
import com.agenthub.context.service.cache.CacheSweepTask;
import com.agenthub.context.service.cache.ContextCacheService;
import com.agenthub.context.service.notify.ChangeNotifier;
import com.agenthub.context.service.notify.ContextChangeListener;
import com.agenthub.context.service.notify.ContextSubscription;
import com.agenthub.context.service.transaction.ContextTransaction;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 共享上下文存储 Facade，所有 Agent 的唯一入口
 *
 * 写流程：加锁 -> 读持久层快照 -> 鉴权 -> 冲突解决 -> 条件写入 -> 更新缓存 -> 广播 -> 发布通知 -> 解锁
 * 读流程：L1 -> L2 -> 持久层，无论数据来自哪一层都重新鉴权并判断过期
 *
 * 鉴权拒绝、冲突拒绝、未找到都以普通返回值表达；
 * 后端故障以 ContextStoreException 异常完成返回的 future
 */
@Service
public class AgentContextStore {

    private static final Logger log = LoggerFactory.getLogger(AgentContextStore.class);

    private final ContextEntryStore entryStore;
    private final ContextCacheService cacheService;
    private final AccessControlEngine accessControl;
    private final ConflictResolver conflictResolver;
    private final AccessAuditLogger auditLogger;
    private final BackendGuard backendGuard;
    private final EntryWriteLock writeLock;
    private final ChangeNotifier changeNotifier;
    private final CacheSweepTask sweepTask;
    private final Executor executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public AgentContextStore(ContextEntryStore entryStore,
                             ContextCacheService cacheService,
                             AccessControlEngine accessControl,
                             ConflictResolver conflictResolver,
                             AccessAuditLogger auditLogger,
                             BackendGuard backendGuard,
                             EntryWriteLock writeLock,
                             ChangeNotifier changeNotifier,
                             CacheSweepTask sweepTask,
                             @Qualifier("contextTaskExecutor") Executor executor,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.entryStore = entryStore;
        this.cacheService = cacheService;
        this.accessControl = accessControl;
        this.conflictResolver = conflictResolver;
        this.auditLogger = auditLogger;
        this.backendGuard = backendGuard;
        this.writeLock = writeLock;
        this.changeNotifier = changeNotifier;
        this.sweepTask = sweepTask;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    // ==================== 生命周期 ====================

    /**
     * 检查后端连通性、建立索引并启动缓存清理任务
     * 后端不可用时只记录错误，服务照常启动，各操作以 BackendUnavailableException 失败直至恢复
     */
    @PostConstruct
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        try {
            backendGuard.read(ContextConstants.BACKEND_MONGO, () -> {
                entryStore.ping();
                entryStore.ensureIndexes();
                return Boolean.TRUE;
            });
        } catch (ContextStoreException e) {
            log.error("MongoDB unavailable at startup: {}", e.getMessage());
        }
        try {
            cacheService.pingRemote();
        } catch (ContextStoreException e) {
            log.error("Redis unavailable at startup: {}", e.getMessage());
        }
        sweepTask.start();
        log.info("Agent context store initialized");
    }

    /**
     * 停止清理任务并取消全部订阅，返回后不再有后台任务运行
     * 连接由 Spring 容器在 Bean 销毁时关闭
     */
    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        sweepTask.stop();
        changeNotifier.shutdown();
        log.info("Agent context store shut down");
    }

    // ==================== 写入 ====================

    public CompletableFuture<Boolean> set(String key, Object value, ContextScope scope, DataType dataType,
                                          AccessLevel accessLevel, String ownerAgent) {
        return set(key, value, scope, dataType, accessLevel, ownerAgent, null, ConflictStrategy.LAST_WRITER_WINS);
    }

    public CompletableFuture<Boolean> set(String key, Object value, ContextScope scope, DataType dataType,
                                          AccessLevel accessLevel, String ownerAgent,
                                          Duration ttl, ConflictStrategy conflictStrategy) {
        return set(ContextWriteRequest.builder()
            .key(key)
            .value(value)
            .scope(scope)
            .dataType(dataType)
            .accessLevel(accessLevel)
            .writerAgent(ownerAgent)
            .ttl(ttl)
            .conflictStrategy(conflictStrategy)
            .build());
    }

    /**
     * 写入条目
     *
     * @return true 写入被接受；false 鉴权拒绝或冲突拒绝
     */
    public CompletableFuture<Boolean> set(ContextWriteRequest request) {
        validate(request);
        return CompletableFuture.supplyAsync(() -> doSet(request), executor);
    }

    private boolean doSet(ContextWriteRequest request) {
        String fullKey = request.fullKey();
        WriteOutcome outcome;
        try {
            outcome = writeLock.withLock(fullKey, () -> applyWrite(request, fullKey));
        } catch (RuntimeException e) {
            countWrite(WriteOutcome.ERROR);
            log.error("Context set failed: fullKey={}, writer={}, error={}",
                fullKey, request.getWriterAgent(), e.getMessage());
            throw e;
        }
        countWrite(outcome);
        return outcome == WriteOutcome.ACCEPTED;
    }

    private WriteOutcome applyWrite(ContextWriteRequest request, String fullKey) {
        Instant now = clock.instant();
        // 冲突解决必须基于写入前刚读取的快照
        Optional<ContextEntry> snapshot = backendGuard.read(ContextConstants.BACKEND_MONGO,
            () -> entryStore.findOne(fullKey));
        Optional<ContextEntry> live = snapshot.filter(entry -> !entry.isExpired(now));
        if (live.isPresent()) {
            return update(request, live.get(), now);
        }
        return create(request, snapshot.orElse(null), now);
    }

    /**
     * 首次写入，或覆盖物理上仍存在但已过期的条目（开始新的生命周期，版本号继续递增）
     * 显式删除或被 TTL 索引物理清除后，版本序列随文档一起结束，再次写入从 1 开始
     */
    private WriteOutcome create(ContextWriteRequest request, ContextEntry expired, Instant now) {
        String writer = request.getWriterAgent();
        long previousVersion = expired == null ? 0L : expired.getVersion();
        List<AccessRecord> accessLog = new ArrayList<>();
        accessLog.add(new AccessRecord(writer, ContextConstants.OPERATION_WRITE, now));

        ContextEntry entry = ContextEntry.builder()
            .id(request.fullKey())
            .key(request.getKey())
            .value(request.getValue())
            .scope(request.getScope())
            .dataType(request.getDataType())
            .accessLevel(request.getAccessLevel())
            .ownerAgent(writer)
            .lastWriter(writer)
            .createdAt(now)
            .updatedAt(now)
            .expiresAt(expiresAt(request, now))
            .version(previousVersion + 1)
            .metadata(request.getMetadata() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(request.getMetadata()))
            .accessLog(accessLog)
            .build();

        if (!accessControl.authorize(writer, entry, AccessIntent.WRITE)) {
            auditLogger.denied(writer, entry, AccessIntent.WRITE, "set");
            return WriteOutcome.DENIED;
        }

        cacheService.evict(entry.getId());
        boolean stored = backendGuard.write(ContextConstants.BACKEND_MONGO,
            () -> entryStore.upsert(entry, previousVersion));
        if (!stored) {
            log.warn("Context create lost a concurrent race: fullKey={}, writer={}", entry.getId(), writer);
            return WriteOutcome.REJECTED;
        }
        afterWrite(entry, ChangeOperation.CREATED);
        log.debug("Context entry created: fullKey={}, owner={}, version={}", entry.getId(), writer, entry.getVersion());
        return WriteOutcome.ACCEPTED;
    }

    private WriteOutcome update(ContextWriteRequest request, ContextEntry existing, Instant now) {
        String writer = request.getWriterAgent();
        if (!accessControl.authorize(writer, existing, AccessIntent.WRITE)) {
            auditLogger.denied(writer, existing, AccessIntent.WRITE, "set");
            return WriteOutcome.DENIED;
        }

        Optional<Object> accepted = conflictResolver.resolve(existing, request.getValue(), writer,
            request.getConflictStrategy(), request.getExpectedVersion());
        if (accepted.isEmpty()) {
            log.info("Context write rejected by conflict strategy: fullKey={}, writer={}, strategy={}",
                existing.getId(), writer, request.getConflictStrategy());
            return WriteOutcome.REJECTED;
        }

        AccessRecord writeRecord = new AccessRecord(writer, ContextConstants.OPERATION_WRITE, now);
        ContextEntry updated = existing.copy();
        updated.setValue(accepted.get());
        updated.setLastWriter(writer);
        updated.setUpdatedAt(now);
        updated.setExpiresAt(expiresAt(request, now));
        updated.setVersion(existing.getVersion() + 1);
        // 只有 owner 可以修改访问级别和数据类型
        if (writer.equals(existing.getOwnerAgent())) {
            updated.setAccessLevel(request.getAccessLevel());
            updated.setDataType(request.getDataType());
        }
        if (request.getMetadata() != null) {
            updated.getMetadata().putAll(request.getMetadata());
        }
        updated.getAccessLog().add(writeRecord);

        cacheService.evict(existing.getId());
        boolean stored = backendGuard.write(ContextConstants.BACKEND_MONGO,
            () -> entryStore.update(updated, existing.getVersion(), writeRecord));
        if (!stored) {
            // 锁租期过期后被其他写入方抢先
            log.warn("Context update lost a concurrent race: fullKey={}, writer={}, expectedVersion={}",
                existing.getId(), writer, existing.getVersion());
            return WriteOutcome.REJECTED;
        }
        afterWrite(updated, ChangeOperation.UPDATED);
        log.debug("Context entry updated: fullKey={}, writer={}, version={}",
            updated.getId(), writer, updated.getVersion());
        return WriteOutcome.ACCEPTED;
    }

    private void afterWrite(ContextEntry entry, ChangeOperation operation) {
        cacheService.put(entry);
        changeNotifier.publish(entry, operation);
    }

    // ==================== 读取 ====================

    /**
     * 读取值，不记录访问日志
     */
    public CompletableFuture<Optional<Object>> get(String key, ContextScope scope, String agent) {
        validateRead(key, scope, agent);
        String fullKey = ContextEntry.fullKey(scope, key);
        return CompletableFuture.supplyAsync(
            () -> readVisible(fullKey, agent, "get").map(entry -> entry.copy().getValue()), executor);
    }

    /**
     * 读取完整条目，并在持久层原子追加一条读日志
     */
    public CompletableFuture<Optional<ContextEntry>> getEntry(String key, ContextScope scope, String agent) {
        validateRead(key, scope, agent);
        String fullKey = ContextEntry.fullKey(scope, key);
        return CompletableFuture.supplyAsync(() -> doGetEntry(fullKey, agent), executor);
    }

    private Optional<ContextEntry> doGetEntry(String fullKey, String agent) {
        if (readVisible(fullKey, agent, "get_entry").isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        AccessRecord readRecord = new AccessRecord(agent, ContextConstants.OPERATION_READ, now);
        Optional<ContextEntry> fresh = backendGuard.write(ContextConstants.BACKEND_MONGO,
                () -> entryStore.appendAccessLog(fullKey, readRecord))
            .filter(entry -> !entry.isExpired(now));
        if (fresh.isEmpty()) {
            // 读取与追加之间被删除
            return Optional.empty();
        }
        ContextEntry entry = fresh.get();
        if (!accessControl.authorize(agent, entry, AccessIntent.READ)) {
            auditLogger.denied(agent, entry, AccessIntent.READ, "get_entry");
            return Optional.empty();
        }
        cacheService.refreshLocal(entry);
        return Optional.of(entry.copy());
    }

    private Optional<ContextEntry> readVisible(String fullKey, String agent, String operation) {
        Optional<ContextEntry> found = cacheService.get(fullKey, this::loadFromStore);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ContextEntry entry = found.get();
        if (!accessControl.authorize(agent, entry, AccessIntent.READ)) {
            auditLogger.denied(agent, entry, AccessIntent.READ, operation);
            return Optional.empty();
        }
        return found;
    }

    private Optional<ContextEntry> loadFromStore(String fullKey) {
        Instant now = clock.instant();
        return backendGuard.read(ContextConstants.BACKEND_MONGO, () -> entryStore.findOne(fullKey))
            .filter(entry -> !entry.isExpired(now));
    }

    // ==================== 删除 ====================

    /**
     * 删除条目
     *
     * @return true 已删除；false 不存在、已过期或无写权限
     */
    public CompletableFuture<Boolean> delete(String key, ContextScope scope, String agent) {
        validateRead(key, scope, agent);
        String fullKey = ContextEntry.fullKey(scope, key);
        return CompletableFuture.supplyAsync(() -> writeLock.withLock(fullKey, () -> doDelete(fullKey, agent)), executor);
    }

    private boolean doDelete(String fullKey, String agent) {
        Instant now = clock.instant();
        Optional<ContextEntry> existing = backendGuard.read(ContextConstants.BACKEND_MONGO,
                () -> entryStore.findOne(fullKey))
            .filter(entry -> !entry.isExpired(now));
        if (existing.isEmpty()) {
            return false;
        }
        ContextEntry entry = existing.get();
        if (!accessControl.authorize(agent, entry, AccessIntent.WRITE)) {
            auditLogger.denied(agent, entry, AccessIntent.WRITE, "delete");
            return false;
        }
        // 写入前后都清缓存：删除超时结果未知时，后续读取直接回源
        cacheService.evict(fullKey);
        boolean deleted;
        try {
            deleted = backendGuard.write(ContextConstants.BACKEND_MONGO, () -> entryStore.deleteOne(fullKey));
        } finally {
            cacheService.invalidate(fullKey);
        }
        if (deleted) {
            changeNotifier.publish(entry, ChangeOperation.DELETED);
            log.debug("Context entry deleted: fullKey={}, agent={}", fullKey, agent);
        }
        return deleted;
    }

    // ==================== 查询 ====================

    /**
     * 条件查询，每条结果单独鉴权
     */
    public CompletableFuture<List<ContextEntry>> query(ContextQuery query, String agent) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        requireText(agent, "agent");
        return CompletableFuture.supplyAsync(() -> doQuery(query, agent), executor);
    }

    private List<ContextEntry> doQuery(ContextQuery query, String agent) {
        Instant now = clock.instant();
        List<ContextEntry> candidates = backendGuard.read(ContextConstants.BACKEND_MONGO,
            () -> entryStore.query(query, now));
        List<ContextEntry> visible = new ArrayList<>(candidates.size());
        for (ContextEntry entry : candidates) {
            if (!query.isIncludeExpired() && entry.isExpired(now)) {
                continue;
            }
            if (!accessControl.authorize(agent, entry, AccessIntent.READ)) {
                auditLogger.denied(agent, entry, AccessIntent.READ, "query");
                continue;
            }
            visible.add(entry.copy());
        }
        log.debug("Context query: agent={}, candidates={}, visible={}", agent, candidates.size(), visible.size());
        return visible;
    }

    // ==================== 事务 / 订阅 ====================

    public ContextTransaction beginTransaction() {
        return new ContextTransaction(UUID.randomUUID().toString(), this);
    }

    /**
     * 订阅 scope 下 key 匹配 keyPattern（glob 语法，如 risk_*）的变更
     */
    public ContextSubscription subscribe(String keyPattern, ContextScope scope, String agent,
                                         ContextChangeListener listener) {
        requireText(keyPattern, "keyPattern");
        requireText(agent, "agent");
        if (scope == null || listener == null) {
            throw new IllegalArgumentException("scope and listener must not be null");
        }
        return changeNotifier.subscribe(scope, keyPattern, agent, listener);
    }

    // ==================== 内部方法 ====================

    private static Instant expiresAt(ContextWriteRequest request, Instant now) {
        return request.getTtl() == null ? null : now.plus(request.getTtl());
    }

    private void countWrite(WriteOutcome outcome) {
        meterRegistry.counter("context.write", "outcome", outcome.name().toLowerCase()).increment();
    }

    private static void validate(ContextWriteRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        requireText(request.getKey(), "key");
        requireText(request.getWriterAgent(), "writerAgent");
        if (request.getValue() == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (request.getScope() == null || request.getDataType() == null || request.getAccessLevel() == null) {
            throw new IllegalArgumentException("scope, dataType and accessLevel are required");
        }
        if (request.getConflictStrategy() == null) {
            throw new IllegalArgumentException("conflictStrategy must not be null");
        }
        if (request.getTtl() != null && (request.getTtl().isZero() || request.getTtl().isNegative())) {
            throw new IllegalArgumentException("ttl must be positive: " + request.getTtl());
        }
    }

    private static void validateRead(String key, ContextScope scope, String agent) {
        requireText(key, "key");
        requireText(agent, "agent");
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private enum WriteOutcome {
        ACCEPTED,
        DENIED,
        REJECTED,
        ERROR
    }
}
