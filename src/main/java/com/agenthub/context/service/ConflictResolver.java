package com.agenthub.context.service;

import com.agenthub.context.config.AccessPolicy;
import com.agenthub.context.model.ConflictStrategy;
import com.agenthub.context.model.ContextEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 写冲突解决
 * 仅在 full key 已有有效条目时调用；返回空表示拒绝写入，原条目保持不变
 */
@Slf4j
@Component
public class ConflictResolver {

    private final AccessPolicy policy;

    public ConflictResolver(AccessPolicy policy) {
        this.policy = policy;
    }

    public Optional<Object> resolve(ContextEntry existing, Object incoming, String writer,
                                    ConflictStrategy strategy, Long expectedVersion) {
        return switch (strategy) {
            case LAST_WRITER_WINS -> Optional.of(incoming);
            case VERSION_BASED -> resolveByVersion(existing, incoming, expectedVersion);
            case AGENT_PRIORITY -> resolveByPriority(existing, incoming, writer);
            case MERGE -> Optional.of(merge(existing.getValue(), incoming));
        };
    }

    private Optional<Object> resolveByVersion(ContextEntry existing, Object incoming, Long expectedVersion) {
        if (expectedVersion == null || expectedVersion != existing.getVersion()) {
            log.debug("Version check failed: fullKey={}, expected={}, actual={}",
                existing.getId(), expectedVersion, existing.getVersion());
            return Optional.empty();
        }
        return Optional.of(incoming);
    }

    /**
     * 与当前值的写入方比较，而不是 owner：
     * 这样最终值总是来自优先级最高的写入方
     */
    private Optional<Object> resolveByPriority(ContextEntry existing, Object incoming, String writer) {
        String holder = existing.getLastWriter() != null ? existing.getLastWriter() : existing.getOwnerAgent();
        int writerRank = policy.rankOf(writer);
        int holderRank = policy.rankOf(holder);
        if (writerRank > holderRank) {
            log.debug("Priority check failed: fullKey={}, writer={}({}), holder={}({})",
                existing.getId(), writer, writerRank, holder, holderRank);
            return Optional.empty();
        }
        return Optional.of(incoming);
    }

    /**
     * 浅合并，两边都是 Map 时新值覆盖旧值，否则等同 last_writer_wins
     */
    static Object merge(Object current, Object incoming) {
        if (current instanceof Map<?, ?> currentMap && incoming instanceof Map<?, ?> incomingMap) {
            Map<Object, Object> merged = new LinkedHashMap<>(currentMap);
            merged.putAll(incomingMap);
            return merged;
        }
        return incoming;
    }
}
