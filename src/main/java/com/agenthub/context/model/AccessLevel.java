package com.agenthub.context.model;

/**
 * 访问级别
 */
public enum AccessLevel {

    /** 所有 Agent 可读写 */
    PUBLIC("public"),
    /** 所有 Agent 可读，仅 owner 或高优先级 Agent 可写 */
    PROTECTED("protected"),
    /** 仅 owner 可读写 */
    PRIVATE("private"),
    /** 按数据类型单独判定 */
    RESTRICTED("restricted");

    private final String value;

    AccessLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AccessLevel fromValue(String value) {
        for (AccessLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown access level: " + value);
    }
}
