package com.example.redislens.infrastructure.redis;

import io.lettuce.core.KeyValue;
import io.lettuce.core.ScoredValue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 바이너리 Redis 응답을 JSON으로 직렬화할 수 있는 값으로 변환
 *
 * - bulk string(byte[]) → UTF-8 문자열
 * - 정수/불리언/상태 응답 → 그대로
 * - 배열/집합 → List (재귀 변환)
 * - nil → null
 */
public final class RedisReplyConverter {

    private RedisReplyConverter() { }

    public static Object toDisplayValue(Object reply) {
        if (reply == null) {
            return null;
        }
        if (reply instanceof byte[]) {
            return new String((byte[]) reply, StandardCharsets.UTF_8);
        }
        if (reply instanceof ByteBuffer) {
            return StandardCharsets.UTF_8.decode(((ByteBuffer) reply).duplicate()).toString();
        }
        if (reply instanceof String || reply instanceof Number || reply instanceof Boolean) {
            return reply;
        }
        if (reply instanceof ScoredValue) {
            ScoredValue<?> scored = (ScoredValue<?>) reply;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("member", scored.hasValue() ? toDisplayValue(scored.getValue()) : null);
            entry.put("score", scored.getScore());
            return entry;
        }
        if (reply instanceof KeyValue) {
            KeyValue<?, ?> keyValue = (KeyValue<?, ?>) reply;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", toDisplayValue(keyValue.getKey()));
            entry.put("value", keyValue.hasValue() ? toDisplayValue(keyValue.getValue()) : null);
            return entry;
        }
        if (reply instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) reply;
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> converted.put(String.valueOf(toDisplayValue(k)), toDisplayValue(v)));
            return converted;
        }
        if (reply instanceof Collection) {
            Collection<?> collection = (Collection<?>) reply;
            List<Object> converted = new ArrayList<>(collection.size());
            for (Object element : collection) {
                converted.add(toDisplayValue(element));
            }
            return converted;
        }
        if (reply instanceof Object[]) {
            Object[] array = (Object[]) reply;
            List<Object> converted = new ArrayList<>(array.length);
            for (Object element : array) {
                converted.add(toDisplayValue(element));
            }
            return converted;
        }
        return reply.toString();
    }

    public static String toUtf8(byte[] bytes) {
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    public static byte[] toBytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
