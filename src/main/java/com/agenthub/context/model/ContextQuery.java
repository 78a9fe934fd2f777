package com.agenthub.context.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 查询条件，所有字段均可选
 */
@Value
@Builder
public class ContextQuery {

    ContextScope scope;

    DataType dataType;

    String ownerAgent;

    /** 作用于 key 的正则表达式 */
    String keyPattern;

    Instant createdAfter;

    Instant createdBefore;

    @Builder.Default
    boolean includeExpired = false;
}
