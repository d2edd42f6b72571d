package com.example.redislens.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 단일 키 상세 정보
 *
 * value 타입은 Redis 타입에 따라 달라진다.
 * string → String, list → List, set → List, zset → List&lt;ZSetEntry&gt;, hash → Map, 그 외 → null
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class KeyDetails {

    private final String key;
    private final String type;
    private final Object value;
    private final long ttl;
    private final long memoryUsage;
}
