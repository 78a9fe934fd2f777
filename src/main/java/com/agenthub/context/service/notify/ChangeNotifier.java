package com.agenthub.context.service.notify;

import com.agenthub.context.config.AgentContextProperties;
import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.exception.ContextStoreException;
import com.agenthub.context.model.AccessIntent;
import com.agenthub.context.model.ChangeOperation;
import com.agenthub.context.model.ContextChangeEvent;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.ContextScope;
import com.agenthub.context.service.AccessAuditLogger;
import com.agenthub.context.service.AccessControlEngine;
import com.agenthub.context.service.BackendGuard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 变更通知
 * 基于 Redis 发布订阅，至多一次、尽力而为，仅保证同一 full key 内有序
 * 通知不参与正确性：发布失败只记录日志，不影响写入结果
 */
@Service
public class ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private static final Duration DISPATCH_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final AccessControlEngine accessControl;
    private final AccessAuditLogger auditLogger;
    private final BackendGuard backendGuard;
    private final Clock clock;
    private final String channelPrefix;
    private final KeyOrderedDispatcher dispatcher;
    private final Counter publishedCounter;
    private final Set<ContextSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    public ChangeNotifier(StringRedisTemplate redisTemplate,
                          RedisMessageListenerContainer listenerContainer,
                          ObjectMapper objectMapper,
                          AccessControlEngine accessControl,
                          AccessAuditLogger auditLogger,
                          BackendGuard backendGuard,
                          Clock clock,
                          AgentContextProperties properties,
                          MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
        this.accessControl = accessControl;
        this.auditLogger = auditLogger;
        this.backendGuard = backendGuard;
        this.clock = clock;
        this.channelPrefix = properties.getNotify().getChannelPrefix();
        this.dispatcher = new KeyOrderedDispatcher(properties.getNotify().getDispatchThreads(), "context-notify-");
        this.publishedCounter = meterRegistry.counter("context.notify.published");
    }

    /**
     * 发布条目变更，消息不携带 value
     */
    public void publish(ContextEntry entry, ChangeOperation operation) {
        String channel = channelOf(entry.getScope(), entry.getKey());
        try {
            String payload = objectMapper.writeValueAsString(ContextChangeEvent.of(entry, operation, clock.instant()));
            backendGuard.runWrite(ContextConstants.BACKEND_REDIS, () -> redisTemplate.convertAndSend(channel, payload));
            publishedCounter.increment();
            log.debug("Change notification published: channel={}, operation={}, version={}",
                channel, operation, entry.getVersion());
        } catch (JsonProcessingException | ContextStoreException e) {
            log.warn("Change notification publish failed: channel={}, operation={}, error={}",
                channel, operation, e.getMessage());
        }
    }

    /**
     * 订阅 scope 下匹配 keyPattern（Redis glob 语法）的变更
     * 只投递订阅方有读权限的条目事件
     */
    public ContextSubscription subscribe(ContextScope scope, String keyPattern, String agent,
                                         ContextChangeListener listener) {
        String channelPattern = channelOf(scope, keyPattern);
        String recordKey = ContextConstants.SUBSCRIPTION_PREFIX + agent + ":" + channelPattern;
        String record = subscriptionRecord(agent, channelPattern);
        backendGuard.runWrite(ContextConstants.BACKEND_REDIS,
            () -> redisTemplate.opsForValue().set(recordKey, record));

        MessageListener messageListener = (message, pattern) -> onMessage(message, agent, listener);
        PatternTopic topic = new PatternTopic(channelPattern);
        listenerContainer.addMessageListener(messageListener, topic);

        ContextSubscription[] holder = new ContextSubscription[1];
        holder[0] = new ContextSubscription(agent, channelPattern, () -> {
            subscriptions.remove(holder[0]);
            listenerContainer.removeMessageListener(messageListener, topic);
            deleteRecord(recordKey);
            log.info("Context change subscription cancelled: agent={}, channel={}", agent, channelPattern);
        });
        subscriptions.add(holder[0]);
        log.info("Context change subscription created: agent={}, channel={}", agent, channelPattern);
        return holder[0];
    }

    void onMessage(Message message, String agent, ContextChangeListener listener) {
        ContextChangeEvent event;
        try {
            event = objectMapper.readValue(message.getBody(), ContextChangeEvent.class);
        } catch (IOException e) {
            log.warn("Malformed change notification dropped: channel={}", new String(message.getChannel()), e);
            return;
        }
        ContextEntry view = event.toAccessView();
        if (!accessControl.authorize(agent, view, AccessIntent.READ)) {
            auditLogger.denied(agent, view, AccessIntent.READ, "notify");
            return;
        }
        dispatcher.dispatch(event.fullKey(), () -> {
            try {
                listener.onChange(event);
            } catch (RuntimeException e) {
                log.error("Change listener failed: agent={}, fullKey={}, operation={}",
                    agent, event.fullKey(), event.operation(), e);
            }
        });
    }

    public int activeSubscriptions() {
        return subscriptions.size();
    }

    /**
     * 取消全部订阅并等待已派发的回调执行完毕
     */
    public void shutdown() {
        for (ContextSubscription subscription : List.copyOf(subscriptions)) {
            subscription.cancel();
        }
        dispatcher.shutdown(DISPATCH_DRAIN_TIMEOUT);
        log.info("Change notifier shut down");
    }

    String channelOf(ContextScope scope, String keyOrPattern) {
        return channelPrefix + ":" + scope.getValue() + ":" + keyOrPattern;
    }

    private String subscriptionRecord(String agent, String channel) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("agentId", agent);
        record.put("channel", channel);
        record.put("createdAt", clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Subscription record not serializable", e);
        }
    }

    private void deleteRecord(String recordKey) {
        try {
            backendGuard.runWrite(ContextConstants.BACKEND_REDIS, () -> redisTemplate.delete(recordKey));
        } catch (ContextStoreException e) {
            log.warn("Subscription record delete failed: key={}, error={}", recordKey, e.getMessage());
        }
    }
}
