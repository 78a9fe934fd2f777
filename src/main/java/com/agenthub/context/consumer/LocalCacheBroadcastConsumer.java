package com.agenthub.context.consumer;

import com.agenthub.context.model.CacheInvalidationMessage;
import com.agenthub.context.service.cache.CacheInvalidationBroadcaster;
import com.agenthub.context.service.cache.ContextCacheService;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import org.apache.rocketmq.spring.annotation.MessageModel;
import org.apache.rocketmq.spring.annotation.RocketMQMessageListener;
import org.apache.rocketmq.spring.core.RocketMQListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 本地缓存广播消费者
 * 广播模式，每个实例都会收到；用于多实例部署时同步 L1
 */
@Component
@ConditionalOnProperty(name = "agent-context.cache.broadcast.enabled", havingValue = "true")
@RocketMQMessageListener(
    topic = "${agent-context.cache.broadcast.topic:CONTEXT_LOCAL_CACHE_BROADCAST}",
    consumerGroup = "${spring.application.name:agent-context-store}_LOCAL_CACHE",
    messageModel = MessageModel.BROADCASTING
)
public class LocalCacheBroadcastConsumer implements RocketMQListener<String> {

    private static final Logger log = LoggerFactory.getLogger(LocalCacheBroadcastConsumer.class);

    private final ContextCacheService cacheService;
    private final CacheInvalidationBroadcaster broadcaster;

    public LocalCacheBroadcastConsumer(ContextCacheService cacheService, CacheInvalidationBroadcaster broadcaster) {
        this.cacheService = cacheService;
        this.broadcaster = broadcaster;
    }

    @Override
    public void onMessage(String message) {
        CacheInvalidationMessage msg;
        try {
            msg = JSON.parseObject(message, CacheInvalidationMessage.class);
        } catch (JSONException e) {
            log.warn("Malformed cache broadcast dropped: {}", message, e);
            return;
        }
        if (msg == null || msg.fullKeys() == null) {
            return;
        }
        // 跳过自己发送的消息
        if (broadcaster.instanceId().equals(msg.sourceInstance())) {
            log.debug("Skipping self-sent cache broadcast");
            return;
        }
        for (String fullKey : msg.fullKeys()) {
            cacheService.invalidateLocal(fullKey);
        }
        log.debug("Local cache invalidated by broadcast: keys={}, source={}",
            msg.fullKeys().size(), msg.sourceInstance());
    }
}
