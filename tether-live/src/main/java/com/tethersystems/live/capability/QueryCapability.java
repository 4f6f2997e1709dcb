package com.tethersystems.live.capability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tethersystems.live.ConnectionState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DOM query support. Adds {@code value} as an alias of {@code val} and decodes the
 * {@code data} attributes of the sender element the way jQuery's {@code .data()} does:
 * strings that parse as JSON become numbers, booleans, objects or arrays.
 */
public class QueryCapability implements CapabilityModule {

    public static final String NAME = "query";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> transformPayload(Map<String, Object> payload, ConnectionState state) {
        Map<String, Object> result = new LinkedHashMap<>(payload);
        if (result.containsKey("val")) {
            result.putIfAbsent("value", result.get("val"));
        }
        Object data = result.get("data");
        if (data instanceof Map) {
            Map<String, Object> decoded = new LinkedHashMap<>();
            ((Map<?, ?>) data).forEach((key, value) -> decoded.put(String.valueOf(key), decode(value)));
            result.put("data", decoded);
        }
        return result;
    }

    private static Object decode(Object value) {
        if (!(value instanceof String)) {
            return value;
        }
        String text = ((String) value).trim();
        if (text.isEmpty()) {
            return value;
        }
        try {
            return MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return value;
        }
    }
}
