package com.example.redislens.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 패턴에 매칭된 전체 키 목록
 *
 * - 순서는 Redis가 돌려준 그대로 (정렬 보장 없음)
 * - SCAN 결과의 중복 키는 제거하지 않음
 */
@Getter
@ToString
@EqualsAndHashCode
public class KeyListing {

    private final List<String> keys;
    private final ListingStrategyType strategy;

    private KeyListing(List<String> keys, ListingStrategyType strategy) {
        this.keys = Collections.unmodifiableList(keys);
        this.strategy = strategy;
    }

    public static KeyListing direct(List<String> keys) {
        return new KeyListing(keys, ListingStrategyType.DIRECT);
    }

    public static KeyListing scanned(List<String> keys) {
        return new KeyListing(keys, ListingStrategyType.SCAN);
    }

    public int size() {
        return keys.size();
    }
}
