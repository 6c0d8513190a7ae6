package com.analytics.trend.core;

/**
 * 检测任务执行器接口 —— 有界工作线程池。
 *
 * 检测任务是 CPU 密集型的阻塞任务，统一提交到此执行器运行。
 * 同一分类的任务按分类合并：某分类已有排队未开始的任务时，
 * 新提交直接合并到该任务，避免数据突发时重复检测。
 * 排队任务开始运行时才读取最新数据，因此合并不会丢失数据。
 */
public interface DetectionExecutor {

    /**
     * 提交一个分类的检测任务。
     *
     * @param category 分类标识，作为合并键
     * @param task     检测任务
     * @return true 表示任务已入队；false 表示被合并或因队列已满被拒绝
     */
    boolean submit(String category, Runnable task);

    /**
     * 是否有该分类的排队任务。
     *
     * @param category 分类标识
     * @return 有排队未开始的任务时返回 true
     */
    boolean isPending(String category);

    /**
     * 被合并的提交次数
     */
    long getCoalescedCount();

    /**
     * 成功执行完成的任务数
     */
    long getTotalExecuted();

    /**
     * 执行失败的任务数
     */
    long getTotalFailed();

    /**
     * 停止接收新任务，等待运行中的任务完成。
     */
    void shutdown();
}
