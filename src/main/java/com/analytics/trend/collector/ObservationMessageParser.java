package com.analytics.trend.collector;

import com.analytics.trend.exception.ValidationException;
import com.analytics.trend.model.DataPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Map;

/**
 * 观测消息解析。
 *
 * 消息格式约定（JSON）：
 * {"category":"sales","value":12.5,"timestamp":1708128000000,"source":"erp","metadata":{...}}
 * timestamp 可以是毫秒时间戳或 ISO-8601 字符串；source 缺省为 "kafka"。
 */
public class ObservationMessageParser {

    static final String DEFAULT_SOURCE = "kafka";

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ObservationMessageParser() {
        this(new ObjectMapper());
    }

    public ObservationMessageParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ValidationException 消息不是合法 JSON 或缺少必需字段时抛出
     */
    public DataPoint parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Empty observation message");
        }

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed observation message: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Observation message must be a JSON object");
        }

        String category = requiredText(root, "category");

        JsonNode valueNode = root.get("value");
        if (valueNode == null || !valueNode.isNumber()) {
            throw new ValidationException("Observation field 'value' must be a number");
        }

        Instant timestamp = parseTimestamp(root.get("timestamp"));

        JsonNode sourceNode = root.get("source");
        String source = (sourceNode != null && sourceNode.isTextual() && !sourceNode.asText().isBlank())
                ? sourceNode.asText()
                : DEFAULT_SOURCE;

        Map<String, Object> metadata = Collections.emptyMap();
        JsonNode metadataNode = root.get("metadata");
        if (metadataNode != null && metadataNode.isObject()) {
            metadata = mapper.convertValue(metadataNode, OBJECT_MAP);
        }

        return new DataPoint(timestamp, valueNode.asDouble(), source, category, metadata);
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ValidationException("Observation field '" + field + "' is required");
        }
        return node.asText();
    }

    private static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new ValidationException("Observation field 'timestamp' is required");
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                throw new ValidationException("Malformed timestamp: " + node.asText(), e);
            }
        }
        throw new ValidationException("Observation field 'timestamp' must be epoch millis or ISO-8601");
    }
}
