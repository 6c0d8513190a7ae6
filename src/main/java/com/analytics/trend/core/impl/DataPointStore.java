package com.analytics.trend.core.impl;

import com.analytics.trend.model.DataPoint;
import com.analytics.trend.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存数据点缓冲，按分类分区，只追加。
 *
 * 写入顺序不保证按时间戳排列，读取时生成的 TimeSeries 负责排序。
 * 写入线程与后台淘汰线程并发访问，用读写锁保护。
 */
public class DataPointStore {

    private static final Logger log = LoggerFactory.getLogger(DataPointStore.class);

    /** 分类 -> 该分类的数据点（写入顺序） */
    private final Map<String, List<DataPoint>> partitions = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 追加一个数据点
     *
     * @return 追加后该分类的数据点数
     */
    public int add(DataPoint point) {
        lock.writeLock().lock();
        try {
            List<DataPoint> partition = partitions.computeIfAbsent(point.getCategory(), k -> new ArrayList<>());
            partition.add(point);
            return partition.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 批量加载（启动时从仓库回填）
     */
    public void addAll(Collection<DataPoint> points) {
        lock.writeLock().lock();
        try {
            for (DataPoint point : points) {
                partitions.computeIfAbsent(point.getCategory(), k -> new ArrayList<>()).add(point);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按分类和起始时间取快照
     *
     * @param category 分类；null 表示全部分类
     * @param since    起始时间（含）；null 表示不限
     */
    public TimeSeries snapshot(String category, Instant since) {
        List<DataPoint> selected = new ArrayList<>();
        lock.readLock().lock();
        try {
            if (category != null) {
                List<DataPoint> partition = partitions.get(category);
                if (partition != null) {
                    collect(partition, since, selected);
                }
            } else {
                for (List<DataPoint> partition : partitions.values()) {
                    collect(partition, since, selected);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return new TimeSeries(category, selected);
    }

    private static void collect(List<DataPoint> partition, Instant since, List<DataPoint> out) {
        for (DataPoint point : partition) {
            if (since == null || !point.getTimestamp().isBefore(since)) {
                out.add(point);
            }
        }
    }

    /**
     * 淘汰早于指定时间的数据点（时间窗口滑动淘汰），仓库中的副本不受影响
     *
     * @return 淘汰的数据点数
     */
    public int evictBefore(Instant threshold) {
        int evicted = 0;
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, List<DataPoint>> entry : partitions.entrySet()) {
                List<DataPoint> partition = entry.getValue();
                int before = partition.size();
                partition.removeIf(p -> p.getTimestamp().isBefore(threshold));
                evicted += before - partition.size();
            }
            partitions.values().removeIf(List::isEmpty);
        } finally {
            lock.writeLock().unlock();
        }
        if (evicted > 0) {
            log.debug("Evicted {} data points older than {}", evicted, threshold);
        }
        return evicted;
    }

    public Set<String> categories() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(partitions.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int sizeOf(String category) {
        lock.readLock().lock();
        try {
            List<DataPoint> partition = partitions.get(category);
            return partition == null ? 0 : partition.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            int total = 0;
            for (List<DataPoint> partition : partitions.values()) {
                total += partition.size();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }
}
