package com.analytics.trend.core.impl;

import com.analytics.trend.core.TrendRepository;
import com.analytics.trend.model.DataPoint;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TrendAlert;
import com.analytics.trend.model.TrendForecast;
import com.analytics.trend.model.TrendPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 异步持久化写入器。
 *
 * 数据点和检测结果先进入写入队列，由专用线程写入仓库，
 * 仓库变慢时不会阻塞数据写入线程和检测线程池。
 * 写入失败的条目重新入队，超过重试次数后丢弃并计数。
 * 队列满时直接丢弃（不做同步写入）。
 */
public class AsyncPersistenceWriter {

    private static final Logger log = LoggerFactory.getLogger(AsyncPersistenceWriter.class);

    private static final long POLL_TIMEOUT_MS = 200L;

    private final TrendRepository repository;
    private final BlockingQueue<WriteTask> queue;
    private final int maxRetries;

    private Thread writerThread;
    private volatile boolean running = false;

    private final AtomicLong written = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);

    public AsyncPersistenceWriter(TrendRepository repository, int queueCapacity, int maxRetries) {
        this.repository = repository;
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
        this.maxRetries = maxRetries;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        writerThread = new Thread(this::writeLoop, "trend-persistence-writer");
        writerThread.setDaemon(true);
        writerThread.start();
    }

    // ==================== 入队 ====================

    public void submitPoint(DataPoint point) {
        enqueue("point " + point.getCategory() + "@" + point.getTimestamp(), repo -> repo.savePoint(point));
    }

    /**
     * 趋势及其挂载的模式、预测、告警分别入队
     */
    public void submitTrend(DetectedTrend trend) {
        enqueue("trend " + trend.getId(), repo -> repo.saveTrend(trend));
        for (TrendPattern pattern : trend.getPatterns()) {
            enqueue("pattern " + pattern.getId(), repo -> repo.savePattern(pattern));
        }
        for (TrendForecast forecast : trend.getForecasts()) {
            enqueue("forecast " + forecast.getId(), repo -> repo.saveForecast(forecast));
        }
        for (TrendAlert alert : trend.getAlerts()) {
            enqueue("alert " + alert.getId(), repo -> repo.saveAlert(alert));
        }
    }

    private void enqueue(String description, Consumer<TrendRepository> action) {
        if (!queue.offer(new WriteTask(description, action))) {
            failures.incrementAndGet();
            log.warn("Persistence queue is full, dropping write of {}", description);
        }
    }

    // ==================== 写入线程 ====================

    private void writeLoop() {
        log.info("Persistence writer thread started.");
        while (running) {
            try {
                WriteTask task = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (task != null && !execute(task)) {
                    // 失败的条目重新入队（有限重试）
                    if (task.retryCount < maxRetries) {
                        task.retryCount++;
                        if (!queue.offer(task)) {
                            dropped(task);
                        }
                    } else {
                        dropped(task);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Persistence writer thread stopped.");
    }

    private boolean execute(WriteTask task) {
        try {
            task.action.accept(repository);
            written.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            log.error("Write of {} failed (attempt {}): {}", task.description, task.retryCount + 1, e.getMessage(), e);
            return false;
        }
    }

    private void dropped(WriteTask task) {
        failures.incrementAndGet();
        log.error("Write of {} failed after {} retries, dropped.", task.description, task.retryCount);
    }

    /**
     * 停止写入线程，并把队列中剩余的条目同步写完
     */
    public void shutdown() {
        synchronized (this) {
            running = false;
        }
        if (writerThread != null) {
            writerThread.interrupt();
            try {
                writerThread.join(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for persistence writer to finish.");
            }
        }

        int flushed = 0;
        WriteTask task;
        while ((task = queue.poll()) != null) {
            boolean ok = execute(task);
            while (!ok && task.retryCount < maxRetries) {
                task.retryCount++;
                ok = execute(task);
            }
            if (ok) {
                flushed++;
            } else {
                dropped(task);
            }
        }
        log.info("Persistence writer shut down, {} pending writes flushed.", flushed);
    }

    public int getPendingCount() { return queue.size(); }
    public long getWrittenCount() { return written.get(); }
    public long getFailureCount() { return failures.get(); }

    /**
     * 写入队列条目
     */
    static class WriteTask {
        final String description;
        final Consumer<TrendRepository> action;
        int retryCount = 0;

        WriteTask(String description, Consumer<TrendRepository> action) {
            this.description = description;
            this.action = action;
        }
    }
}
