package com.backupcenter.server.util;

import com.backupcenter.server.exception.JsonException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule()) // jackson to handle field to LocalDateTime
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final TypeReference<List<Long>> LONG_LIST_TYPE = new TypeReference<>() {};

    public static String toJson(Object value) throws JsonException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonException("toJson failed. value type is %s".formatted(
                    value == null ? "null" : value.getClass().getSimpleName()), e);
        }
    }

    public static <T> T parseJson(String json, Class<T> clazz) throws JsonException {
        if (StringUtils.isBlank(json)) {
            throw new JsonException("parseJson failed. json is blank");
        }
        try {
            return objectMapper.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJson failed. target is %s".formatted(clazz.getSimpleName()), e);
        }
    }

    public static Map<String, Object> parseJsonToMap(String json) throws JsonException {
        if (StringUtils.isBlank(json)) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonToMap failed.", e);
        }
    }

    public static List<Long> parseJsonToLongList(String json) throws JsonException {
        if (StringUtils.isBlank(json)) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, LONG_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonToLongList failed. json is %s".formatted(json), e);
        }
    }
}
