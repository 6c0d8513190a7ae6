package com.analytics.trend.core;

import com.analytics.trend.model.DetectedTrend;
import com.analytics.trend.model.SystemStatistics;
import com.analytics.trend.model.TrendSummary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 趋势检测引擎接口 —— 系统的对外入口和生命周期管理者。
 *
 * 引擎持有自己的数据点缓冲和结果缓存，由显式配置构造，不存在进程级单例。
 * 检测流水线：
 *   过滤并排序数据点 → 五种检测算法 → 合并 → 模式识别 / 预测 / 告警 → 持久化并返回
 *
 * 除按需调用外，引擎在两个后台节奏上运行检测：
 * 写入数据点后的实时触发（按分类合并），以及周期性的全量扫描。
 *
 * 典型用法：
 * <pre>
 * TrendDetectionEngine engine = new DefaultTrendDetectionEngine(config, repository);
 * engine.start();
 * engine.addDataPoint(Instant.now(), 42.0, "erp", "sales", null);
 * List&lt;DetectedTrend&gt; trends = engine.detectTrends("sales", 30);
 * engine.shutdown();
 * </pre>
 */
public interface TrendDetectionEngine {

    /**
     * 启动引擎。
     * 从仓库回填保留期内的数据点，启动写入线程、检测线程池和后台循环。
     */
    void start();

    /**
     * 优雅关闭引擎。
     * 停止后台循环，等待运行中的检测任务完成，把写入队列刷写到仓库。
     * 关闭后调用 detectTrends 抛出 IllegalStateException。
     */
    void shutdown();

    /**
     * 写入一个观测数据点。
     * 数据点进入内存缓冲并异步写入仓库；分类的数据点数超过最少点数时
     * 异步触发该分类的检测。
     *
     * @param timestamp 观测时间
     * @param value     观测值，必须是有限数
     * @param source    数据来源
     * @param category  分类标识
     * @param metadata  附加信息，可为 null
     * @throws com.analytics.trend.exception.ValidationException 数据点不合法时抛出
     */
    void addDataPoint(Instant timestamp, double value, String source, String category,
                      Map<String, Object> metadata);

    /**
     * 同步执行一次趋势检测。
     * 数据不足或没有显著趋势时返回空列表，不抛异常。
     *
     * @param category   分类标识；null 表示全部分类
     * @param windowDays 只使用最近若干天的数据；null 或 0 表示不限
     * @return 本轮检测出的趋势（已挂载模式、预测、告警），不可修改
     * @throws IllegalArgumentException category 为空白字符串或 windowDays 为负数时抛出
     * @throws IllegalStateException    引擎已关闭时抛出
     */
    List<DetectedTrend> detectTrends(String category, Integer windowDays);

    /**
     * 对全部分类、全部数据执行检测。
     */
    default List<DetectedTrend> detectTrends() {
        return detectTrends(null, null);
    }

    /**
     * 某分类最近一轮检测的结果（缓存未过期时）。
     *
     * @param category 分类标识
     * @return 趋势列表；没有缓存时为空列表
     */
    List<DetectedTrend> getLatestTrends(String category);

    /**
     * 趋势摘要。
     *
     * @param trendId 趋势 id；null 或未知 id 时返回全局汇总
     * @return 单趋势详情或全局汇总
     */
    TrendSummary getTrendSummary(String trendId);

    /**
     * 运行统计快照。
     */
    SystemStatistics getSystemStatistics();
}
