package com.analytics.trend;

import com.analytics.trend.collector.KafkaObservationCollector;
import com.analytics.trend.core.impl.DefaultTrendDetectionEngine;
import com.analytics.trend.storage.SQLiteTrendRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 系统启动引导类。
 * 创建仓库、启动检测引擎，按配置启动 Kafka 采集。
 *
 * 用法：java -jar trend-detection-engine.jar [配置文件路径]
 */
public class TrendDetectionApplication {

    private static final Logger log = LoggerFactory.getLogger(TrendDetectionApplication.class);

    private SQLiteTrendRepository repository;
    private DefaultTrendDetectionEngine engine;
    private KafkaObservationCollector collector;

    public void start(EngineConfig config) {
        log.info("=== Trend Detection Engine ===");
        log.info("Starting with config: {}", config);

        // 1. 初始化存储层
        repository = new SQLiteTrendRepository(config.getStoragePath());

        // 2. 启动检测引擎
        engine = new DefaultTrendDetectionEngine(config, repository);

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        engine.start();

        // 3. 数据接入
        if (config.isKafkaEnabled()) {
            collector = new KafkaObservationCollector(config, engine);
            collector.start();
        } else {
            log.info("Kafka ingestion disabled.");
        }

        log.info("=== Engine started successfully ===");
    }

    /**
     * 按与启动相反的顺序关闭：采集 → 引擎（刷写队列）→ 仓库
     */
    public synchronized void shutdown() {
        if (collector != null) {
            collector.close();
            collector = null;
        }
        if (engine != null) {
            engine.shutdown();
            engine = null;
        }
        if (repository != null) {
            repository.close();
            repository = null;
        }
        log.info("=== Engine shut down ===");
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/trend-detection.properties";

        EngineConfig config = EngineConfig.load(configPath);
        TrendDetectionApplication app = new TrendDetectionApplication();
        app.start(config);
    }
}
