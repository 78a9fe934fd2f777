package com.agenthub.context.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 共享上下文条目
 * 以 (scope, key) 组成的 full key 作为唯一标识，同时作为 MongoDB 文档 _id
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("context_entries")
public class ContextEntry {

    /** full key: {scope}:{key} */
    @Id
    private String id;

    private String key;

    /** 不透明负载，需可 JSON 序列化（String / Number / Boolean / Map / List） */
    private Object value;

    private ContextScope scope;

    private DataType dataType;

    private AccessLevel accessLevel;

    /** 创建者，所有权不可转移 */
    private String ownerAgent;

    /** 最近一次被接受写入的 Agent */
    private String lastWriter;

    private Instant createdAt;

    private Instant updatedAt;

    /** 为空表示永不过期 */
    private Instant expiresAt;

    /** 每次被接受的写入 +1 */
    private long version;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private List<AccessRecord> accessLog = new ArrayList<>();

    public static String fullKey(ContextScope scope, String key) {
        return scope.getValue() + ":" + key;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * 深拷贝，调用方修改返回值（含嵌套的 Map / List）不会影响缓存中的实例
     */
    public ContextEntry copy() {
        return toBuilder()
            .value(copyValue(value))
            .metadata(copyMetadata(metadata))
            .accessLog(accessLog == null ? new ArrayList<>() : new ArrayList<>(accessLog))
            .build();
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> copy.put(k, copyValue(v)));
        }
        return copy;
    }

    /**
     * 逐层拷贝 Map / List，其余类型视为不可变
     */
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>(map.size());
            map.forEach((k, v) -> copy.put(k, copyValue(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }
}
