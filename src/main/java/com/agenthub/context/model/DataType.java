package com.agenthub.context.model;

/**
 * 上下文数据类型
 * SECURITY 类型始终按最严格的规则鉴权
 */
public enum DataType {

    CONFIGURATION("configuration"),
    PREFERENCES("preferences"),
    STATE("state"),
    HISTORY("history"),
    METRICS("metrics"),
    SECURITY("security");

    private final String value;

    DataType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DataType fromValue(String value) {
        for (DataType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + value);
    }
}
