package com.agenthub.context.repository;

import com.agenthub.context.model.AccessRecord;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.ContextQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 持久层契约，MongoDB 为权威数据源
 * 所有方法都是同步阻塞调用，超时与熔断由调用方的 BackendGuard 负责
 */
public interface ContextEntryStore {

    /**
     * 按 full key 查询，不过滤过期条目
     */
    Optional<ContextEntry> findOne(String fullKey);

    /**
     * 整条写入
     * expectedVersion 为 0 时插入，已存在则返回 false；
     * 否则仅当存储中的版本等于 expectedVersion 时整体替换
     */
    boolean upsert(ContextEntry entry, long expectedVersion);

    /**
     * 条件更新：版本匹配时覆盖可变字段并追加一条写日志
     * 访问日志以追加方式写入，不会覆盖并发的读日志
     */
    boolean update(ContextEntry entry, long expectedVersion, AccessRecord writeRecord);

    boolean deleteOne(String fullKey);

    /**
     * 原子追加访问日志，返回追加后的条目
     */
    Optional<ContextEntry> appendAccessLog(String fullKey, AccessRecord record);

    List<ContextEntry> query(ContextQuery query, Instant now);

    /**
     * (scope, dataType, key)、(ownerAgent, createdAt)、expiresAt TTL 索引
     */
    void ensureIndexes();

    void ping();
}
