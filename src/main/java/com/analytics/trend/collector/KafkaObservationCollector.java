package com.analytics.trend.collector;

import com.analytics.trend.EngineConfig;
import com.analytics.trend.core.TrendDetectionEngine;
import com.analytics.trend.exception.ValidationException;
import com.analytics.trend.model.DataPoint;
import org.apache.kafka.clients.consumer.*;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Kafka 观测数据采集。
 * 从 Topic 消费 JSON 观测消息，解析后写入检测引擎；
 * 格式错误或校验失败的消息记录日志后跳过。
 */
public class KafkaObservationCollector implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KafkaObservationCollector.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

    private final String topic;
    private final TrendDetectionEngine engine;
    private final ObservationMessageParser parser = new ObservationMessageParser();
    private final Consumer<String, String> consumer;
    private final boolean subscribeOnStart;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);

    private Thread collectorThread;

    public KafkaObservationCollector(EngineConfig config, TrendDetectionEngine engine) {
        this(createConsumer(config), config.getKafkaTopic(), engine, true);
    }

    /**
     * 使用外部提供的消费者；调用方负责订阅或分配分区
     */
    public KafkaObservationCollector(Consumer<String, String> consumer, String topic, TrendDetectionEngine engine) {
        this(consumer, topic, engine, false);
    }

    private KafkaObservationCollector(Consumer<String, String> consumer, String topic,
                                      TrendDetectionEngine engine, boolean subscribeOnStart) {
        this.consumer = consumer;
        this.topic = topic;
        this.engine = engine;
        this.subscribeOnStart = subscribeOnStart;
    }

    private static Consumer<String, String> createConsumer(EngineConfig config) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, config.getKafkaGroupId());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        return new KafkaConsumer<>(props);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("KafkaObservationCollector is already running.");
            return;
        }
        if (subscribeOnStart) {
            consumer.subscribe(Collections.singletonList(topic));
        }

        collectorThread = new Thread(this, "kafka-observation-collector");
        collectorThread.setDaemon(true);
        collectorThread.start();

        log.info("KafkaObservationCollector started. Topic: {}", topic);
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                pollOnce(POLL_TIMEOUT);
            }
        } catch (WakeupException e) {
            // stop() 唤醒阻塞中的 poll
            if (running.get()) {
                log.error("Unexpected consumer wakeup while running", e);
            }
        } catch (RuntimeException e) {
            log.error("KafkaObservationCollector encountered fatal error", e);
        } finally {
            consumer.close();
            log.info("KafkaObservationCollector stopped. Accepted: {}, Rejected: {}", accepted.get(), rejected.get());
        }
    }

    /**
     * 拉取一批消息并写入引擎
     *
     * @return 本批成功写入的消息数
     */
    int pollOnce(Duration timeout) {
        ConsumerRecords<String, String> records = consumer.poll(timeout);
        int count = 0;
        for (ConsumerRecord<String, String> record : records) {
            try {
                DataPoint point = parser.parse(record.value());
                engine.addDataPoint(point.getTimestamp(), point.getValue(), point.getSource(),
                        point.getCategory(), point.getMetadata());
                accepted.incrementAndGet();
                count++;
            } catch (ValidationException e) {
                rejected.incrementAndGet();
                log.warn("Skipping invalid observation at offset {}: {}", record.offset(), e.getMessage());
            }
        }
        return count;
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            consumer.wakeup();
        }
    }

    @Override
    public void close() {
        stop();
        if (collectorThread == null) {
            consumer.close();
        } else {
            try {
                collectorThread.join(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for collector thread to finish.");
            }
        }
    }

    public long getAcceptedCount() { return accepted.get(); }
    public long getRejectedCount() { return rejected.get(); }
}
