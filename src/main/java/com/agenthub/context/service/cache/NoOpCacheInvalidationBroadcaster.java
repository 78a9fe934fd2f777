package com.agenthub.context.service.cache;

import java.util.Collection;

/**
 * 单实例部署使用，不做广播
 */
public class NoOpCacheInvalidationBroadcaster implements CacheInvalidationBroadcaster {

    private static final String LOCAL_INSTANCE = "local";

    @Override
    public void broadcast(Collection<String> fullKeys) {
        // 单实例无需同步
    }

    @Override
    public String instanceId() {
        return LOCAL_INSTANCE;
    }
}
