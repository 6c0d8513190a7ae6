package com.analytics.trend.core;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.TimeSeries;

import java.time.Instant;
import java.util.List;

/**
 * 趋势检测算法接口 —— 所有检测策略的基础契约。
 *
 * 每个检测器封装一种独立的统计方法（线性回归、频谱分析、自相关、
 * 均值突变检验、滚动波动率），输入一条按时间升序排列的序列，
 * 输出零个或多个候选趋势。检测器集合是封闭的，由 TrendDetectors
 * 按固定顺序注册，编排器逐个调用。
 *
 * 实现约定：
 * - 检测器必须是无状态、线程安全的，同一实例会被多个检测任务并发调用
 * - 数据点不足属于正常情况，返回空列表，不抛异常
 * - 低于置信度阈值的候选直接丢弃，不返回低置信度结果
 * - 数值退化（如自变量方差为0）抛出 AlgorithmFailureException，
 *   由编排器记录并跳过该算法，不影响其他检测器
 * - 检测器不做任何 I/O
 */
public interface TrendDetector {

    /**
     * 算法名称，写入趋势元数据并用于日志。
     *
     * @return 算法名称，如 "linear_regression"
     */
    String getName();

    /**
     * 该算法所需的最少数据点数。
     * 少于该数量时 detect 直接返回空列表。
     *
     * @return 最少数据点数
     */
    int getMinimumPoints();

    /**
     * 对序列执行检测。
     *
     * @param series        按时间戳升序排列的序列
     * @param config        检测参数和启发式常量
     * @param detectionTime 本轮检测时间，写入趋势的 detection_date
     * @return 候选趋势列表；无显著结果时为空列表
     * @throws com.analytics.trend.exception.AlgorithmFailureException 数值计算失败时抛出
     */
    List<DetectedTrend> detect(TimeSeries series, EngineConfig config, Instant detectionTime);
}
