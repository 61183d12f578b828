package com.openrangelabs.donpetre.pipeline.processor.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts JSON values into records. Objects map field by field; any other value is
 * wrapped as {@code {"value": ...}}.
 */
public final class JsonRecords {

    public static final String VALUE_FIELD = "value";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonRecords() {
    }

    public static DataRecord toRecord(ObjectMapper objectMapper, JsonNode node) {
        if (node.isObject()) {
            Map<String, Object> fields = objectMapper.convertValue(node, MAP_TYPE);
            return new DataRecord(fields);
        }
        DataRecord record = new DataRecord();
        record.put(VALUE_FIELD, objectMapper.convertValue(node, Object.class));
        return record;
    }
}
