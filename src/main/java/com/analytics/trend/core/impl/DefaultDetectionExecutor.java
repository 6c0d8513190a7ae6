package com.analytics.trend.core.impl;

import com.analytics.trend.core.DetectionExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 检测任务执行器默认实现。
 * 固定大小的线程池 + 有界队列，按分类合并排队中的任务。
 */
public class DefaultDetectionExecutor implements DetectionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultDetectionExecutor.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30L;

    private final ThreadPoolExecutor workerPool;

    /** 已入队但尚未开始执行的分类，用于合并重复提交 */
    private final Set<String> pendingCategories = ConcurrentHashMap.newKeySet();

    private final AtomicLong totalExecuted = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);
    private final AtomicLong coalesced = new AtomicLong(0);

    public DefaultDetectionExecutor(int workers, int queueCapacity) {
        this.workerPool = new ThreadPoolExecutor(
                workers, workers,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new DetectorThreadFactory());

        log.info("DetectionExecutor initialized. Workers: {}, Queue capacity: {}", workers, queueCapacity);
    }

    @Override
    public boolean submit(String category, Runnable task) {
        // 合并：该分类已有排队任务
        if (!pendingCategories.add(category)) {
            coalesced.incrementAndGet();
            log.debug("Detection for category '{}' is already queued, trigger coalesced.", category);
            return false;
        }

        try {
            workerPool.execute(() -> {
                // 开始执行后允许新的触发再次入队
                pendingCategories.remove(category);
                long startTime = System.currentTimeMillis();
                try {
                    task.run();
                    totalExecuted.incrementAndGet();
                    log.debug("Detection for category '{}' completed in {}ms",
                            category, System.currentTimeMillis() - startTime);
                } catch (RuntimeException e) {
                    totalFailed.incrementAndGet();
                    log.error("Detection for category '{}' failed: {}", category, e.getMessage(), e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            pendingCategories.remove(category);
            log.warn("Detection queue is full or shut down, dropping trigger for category '{}'.", category);
            return false;
        }
    }

    @Override
    public boolean isPending(String category) {
        return pendingCategories.contains(category);
    }

    @Override
    public long getCoalescedCount() { return coalesced.get(); }

    @Override
    public long getTotalExecuted() { return totalExecuted.get(); }

    @Override
    public long getTotalFailed() { return totalFailed.get(); }

    @Override
    public void shutdown() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Detection tasks did not finish within {}s, forcing shutdown.", SHUTDOWN_TIMEOUT_SECONDS);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
        pendingCategories.clear();
        log.info("DetectionExecutor shut down. Executed: {}, Failed: {}, Coalesced: {}",
                totalExecuted.get(), totalFailed.get(), coalesced.get());
    }

    private static class DetectorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "trend-detector-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Uncaught exception in worker thread {}: {}", thread.getName(), e.getMessage(), e));
            return t;
        }
    }
}
