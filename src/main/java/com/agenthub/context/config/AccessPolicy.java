package com.agenthub.context.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 不可变的访问策略：Agent 优先级表 + 鉴权阈值
 * 启动时构建一次，通过构造器注入，测试可自行构造
 */
public record AccessPolicy(
    Map<String, Integer> priorities,
    int defaultRank,
    String validatorAgent,
    int protectedWriteMaxRank,
    int restrictedConfigurationMaxRank
) {

    public AccessPolicy {
        priorities = Map.copyOf(priorities);
        Objects.requireNonNull(validatorAgent, "validatorAgent");
    }

    public static AccessPolicy from(AgentContextProperties properties) {
        return new AccessPolicy(
            properties.getPriorities(),
            properties.getDefaultRank(),
            properties.getValidatorAgent(),
            properties.getProtectedWriteMaxRank(),
            properties.getRestrictedConfigurationMaxRank()
        );
    }

    public static AccessPolicy defaults() {
        return from(new AgentContextProperties());
    }

    public int rankOf(String agent) {
        if (agent == null) {
            return defaultRank;
        }
        return priorities.getOrDefault(agent, defaultRank);
    }

    /**
     * 追加或覆盖部分 Agent 的优先级，返回新实例
     */
    public AccessPolicy withPriorities(Map<String, Integer> overrides) {
        Map<String, Integer> merged = new HashMap<>(priorities);
        merged.putAll(overrides);
        return new AccessPolicy(merged, defaultRank, validatorAgent,
            protectedWriteMaxRank, restrictedConfigurationMaxRank);
    }
}
