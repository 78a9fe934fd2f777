package com.agenthub.context.service.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 按 Key 分条带的单线程分发器
 * 同一 Key 固定落在同一线程，保证顺序；不同 Key 并行
 */
public class KeyOrderedDispatcher {

    private static final Logger log = LoggerFactory.getLogger(KeyOrderedDispatcher.class);

    private final ExecutorService[] stripes;

    public KeyOrderedDispatcher(int threads, String namePrefix) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.stripes = new ExecutorService[threads];
        for (int i = 0; i < threads; i++) {
            String threadName = namePrefix + i;
            stripes[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                return t;
            });
        }
    }

    public void dispatch(String key, Runnable task) {
        ExecutorService stripe = stripes[Math.floorMod(key.hashCode(), stripes.length)];
        try {
            stripe.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher is shut down, dropping task: key={}", key);
        }
    }

    /**
     * 停止接收新任务并等待已提交的任务完成，超时后强制中断
     */
    public void shutdown(Duration timeout) {
        for (ExecutorService stripe : stripes) {
            stripe.shutdown();
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (ExecutorService stripe : stripes) {
                long remaining = deadline - System.nanoTime();
                if (!stripe.awaitTermination(Math.max(remaining, 0L), TimeUnit.NANOSECONDS)) {
                    stripe.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            for (ExecutorService stripe : stripes) {
                stripe.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }
}
