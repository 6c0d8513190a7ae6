package com.analytics.trend.collector;

import com.analytics.trend.core.TrendDetectionEngine;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("KafkaObservationCollector")
class KafkaObservationCollectorTest {

    private static final String TOPIC = "trend-observations";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private MockConsumer<String, String> consumer;
    private TrendDetectionEngine engine;
    private KafkaObservationCollector collector;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.assign(List.of(PARTITION));
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        engine = mock(TrendDetectionEngine.class);
        collector = new KafkaObservationCollector(consumer, TOPIC, engine);
    }

    @Test
    @DisplayName("Valid records are forwarded to the engine, invalid ones skipped")
    void forwardsValidRecords() {
        consumer.addRecord(record(0, "{\"category\":\"sales\",\"value\":12.5,\"timestamp\":1708128000000}"));
        consumer.addRecord(record(1, "garbage"));
        consumer.addRecord(record(2, "{\"category\":\"sales\",\"value\":13.0,\"timestamp\":1708214400000}"));

        int accepted = collector.pollOnce(Duration.ofMillis(100));

        assertEquals(2, accepted);
        assertEquals(2, collector.getAcceptedCount());
        assertEquals(1, collector.getRejectedCount());
        verify(engine).addDataPoint(eq(Instant.ofEpochMilli(1708128000000L)), eq(12.5),
                eq(ObservationMessageParser.DEFAULT_SOURCE), eq("sales"), any());
        verify(engine, times(2)).addDataPoint(any(), anyDouble(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Close without a running thread closes the consumer")
    void closeWithoutThread() {
        collector.close();
        assertTrue(consumer.closed());
    }

    private static ConsumerRecord<String, String> record(long offset, String value) {
        return new ConsumerRecord<>(TOPIC, 0, offset, null, value);
    }
}
