package com.agenthub.context.model;

import java.time.Instant;

/**
 * 变更通知消息，不携带 value
 */
public record ContextChangeEvent(
    ChangeOperation operation,
    String fullKey,
    String key,
    ContextScope scope,
    DataType dataType,
    AccessLevel accessLevel,
    String ownerAgent,
    long version,
    Instant timestamp
) {

    public static ContextChangeEvent of(ContextEntry entry, ChangeOperation operation, Instant timestamp) {
        return new ContextChangeEvent(
            operation,
            entry.getId(),
            entry.getKey(),
            entry.getScope(),
            entry.getDataType(),
            entry.getAccessLevel(),
            entry.getOwnerAgent(),
            entry.getVersion(),
            timestamp
        );
    }

    /**
     * 仅包含鉴权所需元数据的条目视图
     */
    public ContextEntry toAccessView() {
        return ContextEntry.builder()
            .id(fullKey)
            .key(key)
            .scope(scope)
            .dataType(dataType)
            .accessLevel(accessLevel)
            .ownerAgent(ownerAgent)
            .version(version)
            .build();
    }
}
