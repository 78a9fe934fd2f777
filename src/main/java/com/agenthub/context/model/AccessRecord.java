package com.agenthub.context.model;

import java.time.Instant;

/**
 * 访问日志记录，只追加不修改
 */
public record AccessRecord(
    String agent,
    String operation,
    Instant timestamp
) {}
