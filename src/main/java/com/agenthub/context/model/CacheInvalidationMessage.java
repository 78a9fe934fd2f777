package com.agenthub.context.model;

import java.util.List;

/**
 * 本地缓存失效广播消息
 */
public record CacheInvalidationMessage(
    List<String> fullKeys,
    String sourceInstance,
    long timestamp
) {}
