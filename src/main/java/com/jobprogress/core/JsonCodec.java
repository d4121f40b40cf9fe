package com.jobprogress.core;

import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text encoding for part descriptors and metadata.
 *
 * <p>Both backends store values as JSON text since neither a Redis hash field nor a CLOB
 * column holds structured values natively.</p>
 */
public final class JsonCodec {

    private JsonCodec() {
    }

    /**
     * Encode a mapping as a JSON object. Null values are dropped.
     *
     * @param map the mapping to encode
     * @return JSON text
     */
    public static String encode(Map<String, ?> map) {
        return new JSONObject(map).toString();
    }

    /**
     * Decode a JSON object into nested maps and lists.
     *
     * <p>Decimal numbers come back as {@link Double}; integral numbers as {@link Integer},
     * {@link Long} or {@link java.math.BigInteger} depending on their magnitude.</p>
     *
     * @param text JSON text, may be null or blank
     * @return a mutable map, empty when the text is null or blank
     */
    public static Map<String, Object> decode(String text) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<>();
        }
        return normalizeMap(new JSONObject(text).toMap());
    }

    // org.json parses decimals as BigDecimal
    private static Object normalize(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) value;
            return normalizeMap(map);
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object element : (List<?>) value) {
                list.add(normalize(element));
            }
            return list;
        }
        return value;
    }

    private static Map<String, Object> normalizeMap(Map<String, Object> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            result.put(entry.getKey(), normalize(entry.getValue()));
        }
        return result;
    }

    /**
     * Decode a JSON object whose values are all strings.
     *
     * @param text JSON text, may be null or blank
     * @return a mutable string map, empty when the text is null or blank
     */
    public static Map<String, String> decodeStrings(String text) {
        Map<String, String> result = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        JSONObject json = new JSONObject(text);
        for (String key : json.keySet()) {
            result.put(key, json.optString(key));
        }
        return result;
    }

    /**
     * Merge updates into encoded metadata, overwriting keys present in both.
     *
     * @param current the stored JSON text, may be null
     * @param updates the keys to set
     * @return the merged JSON text
     */
    public static String merge(String current, Map<String, String> updates) {
        Map<String, String> merged = decodeStrings(current);
        merged.putAll(updates);
        return encode(merged);
    }
}
