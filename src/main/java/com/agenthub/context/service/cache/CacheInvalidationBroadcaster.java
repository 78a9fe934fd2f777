package com.agenthub.context.service.cache;

import java.util.Collection;

/**
 * 跨实例 L1 失效广播
 * 广播失败只影响其他实例 L1 的新鲜度，不影响写入结果
 */
public interface CacheInvalidationBroadcaster {

    void broadcast(Collection<String> fullKeys);

    /**
     * 当前实例标识，消费端据此跳过自己发出的消息
     */
    String instanceId();
}
