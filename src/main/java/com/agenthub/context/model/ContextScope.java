package com.agenthub.context.model;

/**
 * 上下文作用域，对键空间做分区
 */
public enum ContextScope {

    /** 系统级配置 */
    GLOBAL("global"),
    /** 用户数据 */
    USER("user"),
    /** 会话数据 */
    SESSION("session"),
    /** 工作流数据 */
    WORKFLOW("workflow"),
    /** Agent 私有数据 */
    AGENT("agent");

    private final String value;

    ContextScope(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ContextScope fromValue(String value) {
        for (ContextScope scope : values()) {
            if (scope.value.equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown context scope: " + value);
    }
}
