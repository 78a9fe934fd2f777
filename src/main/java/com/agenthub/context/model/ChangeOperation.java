package com.agenthub.context.model;

/**
 * 条目生命周期事件类型
 */
public enum ChangeOperation {
    CREATED,
    UPDATED,
    DELETED
}
