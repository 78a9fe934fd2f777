package com.agenthub.context.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * set 请求参数
 * writerAgent 即写入方身份；首次写入时成为 owner
 */
@Value
@Builder
public class ContextWriteRequest {

    String key;

    Object value;

    ContextScope scope;

    DataType dataType;

    AccessLevel accessLevel;

    String writerAgent;

    /** 为空表示永不过期 */
    Duration ttl;

    @Builder.Default
    ConflictStrategy conflictStrategy = ConflictStrategy.LAST_WRITER_WINS;

    /** VERSION_BASED 策略下调用方读到的版本 */
    Long expectedVersion;

    Map<String, Object> metadata;

    public String fullKey() {
        return ContextEntry.fullKey(scope, key);
    }
}
