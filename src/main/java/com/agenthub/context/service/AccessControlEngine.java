package com.agenthub.context.service;

import com.agenthub.context.config.AccessPolicy;
import com.agenthub.context.model.AccessIntent;
import com.agenthub.context.model.AccessLevel;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.DataType;
import org.springframework.stereotype.Component;

/**
 * 访问控制引擎
 * 纯函数，无 I/O；拒绝是正常返回值，由调用方记录审计日志
 */
@Component
public class AccessControlEngine {

    private final AccessPolicy policy;

    public AccessControlEngine(AccessPolicy policy) {
        this.policy = policy;
    }

    public boolean authorize(String agent, ContextEntry entry, AccessIntent intent) {
        if (agent == null || entry == null) {
            return false;
        }
        return switch (effectiveLevel(entry)) {
            case PUBLIC -> true;
            case PROTECTED -> intent == AccessIntent.READ
                || isOwner(agent, entry)
                || policy.rankOf(agent) <= policy.protectedWriteMaxRank();
            case PRIVATE -> isOwner(agent, entry);
            case RESTRICTED -> restricted(agent, entry.getDataType());
        };
    }

    /**
     * security 数据无论声明的访问级别如何，一律按 restricted 处理
     */
    public static AccessLevel effectiveLevel(ContextEntry entry) {
        if (entry.getDataType() == DataType.SECURITY) {
            return AccessLevel.RESTRICTED;
        }
        return entry.getAccessLevel();
    }

    private boolean restricted(String agent, DataType dataType) {
        if (dataType == null) {
            return false;
        }
        return switch (dataType) {
            case SECURITY -> policy.validatorAgent().equals(agent);
            case CONFIGURATION -> policy.rankOf(agent) <= policy.restrictedConfigurationMaxRank();
            case PREFERENCES, STATE, HISTORY, METRICS -> false;
        };
    }

    private static boolean isOwner(String agent, ContextEntry entry) {
        return agent.equals(entry.getOwnerAgent());
    }
}
