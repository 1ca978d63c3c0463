package net.quay.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** args / kwargs / 결과 값을 CLOB JSON으로. */
public final class JsonCodec {
    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(Object value) {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable: " + value.getClass().getName(), e);
        }
    }

    public List<Object> readList(String json) {
        return json == null ? List.of() : read(json, LIST);
    }

    public Map<String, Object> readMap(String json) {
        return json == null ? Map.of() : read(json, MAP);
    }

    public Object readValue(String json) {
        return json == null ? null : read(json, new TypeReference<Object>() {});
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
