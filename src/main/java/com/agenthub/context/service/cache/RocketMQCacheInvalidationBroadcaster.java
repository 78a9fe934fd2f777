package com.agenthub.context.service.cache;

import com.agenthub.context.model.CacheInvalidationMessage;
import com.alibaba.fastjson2.JSON;
import org.apache.rocketmq.client.producer.SendCallback;
import org.apache.rocketmq.client.producer.SendResult;
import org.apache.rocketmq.spring.core.RocketMQTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * 基于 RocketMQ 广播消费的 L1 失效通知
 * 异步发送，不阻塞写路径
 */
public class RocketMQCacheInvalidationBroadcaster implements CacheInvalidationBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(RocketMQCacheInvalidationBroadcaster.class);

    private final RocketMQTemplate rocketMQTemplate;
    private final String topic;
    private final String instanceId;

    public RocketMQCacheInvalidationBroadcaster(RocketMQTemplate rocketMQTemplate, String topic, String instanceId) {
        this.rocketMQTemplate = rocketMQTemplate;
        this.topic = topic;
        this.instanceId = instanceId;
    }

    @Override
    public void broadcast(Collection<String> fullKeys) {
        if (fullKeys.isEmpty()) {
            return;
        }
        CacheInvalidationMessage message = new CacheInvalidationMessage(
            List.copyOf(fullKeys), instanceId, System.currentTimeMillis());
        try {
            rocketMQTemplate.asyncSend(topic, JSON.toJSONString(message), new SendCallback() {
                @Override
                public void onSuccess(SendResult sendResult) {
                    log.debug("Cache invalidation broadcast sent: keys={}, msgId={}",
                        fullKeys.size(), sendResult.getMsgId());
                }

                @Override
                public void onException(Throwable e) {
                    log.error("Cache invalidation broadcast failed: keys={}", fullKeys, e);
                }
            });
        } catch (RuntimeException e) {
            log.error("Cache invalidation broadcast rejected: keys={}", fullKeys, e);
        }
    }

    @Override
    public String instanceId() {
        return instanceId;
    }
}
