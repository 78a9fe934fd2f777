package com.agenthub.context.service.notify;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 订阅句柄，cancel 可重复调用
 */
public class ContextSubscription {

    private final String agent;
    private final String channelPattern;
    private final Runnable canceller;
    private final AtomicBoolean active = new AtomicBoolean(true);

    ContextSubscription(String agent, String channelPattern, Runnable canceller) {
        this.agent = agent;
        this.channelPattern = channelPattern;
        this.canceller = canceller;
    }

    public String getAgent() {
        return agent;
    }

    public String getChannelPattern() {
        return channelPattern;
    }

    public boolean isActive() {
        return active.get();
    }

    public void cancel() {
        if (active.compareAndSet(true, false)) {
            canceller.run();
        }
    }

    @Override
    public String toString() {
        return "ContextSubscription{agent=" + agent + ", channel=" + channelPattern + ", active=" + active.get() + "}";
    }
}
