package com.agenthub.context.service.notify;

import com.agenthub.context.model.ContextChangeEvent;

/**
 * 变更回调
 * 在分发线程上执行，同一 full key 的事件按发布顺序回调
 */
@FunctionalInterface
public interface ContextChangeListener {

    void onChange(ContextChangeEvent event);
}
