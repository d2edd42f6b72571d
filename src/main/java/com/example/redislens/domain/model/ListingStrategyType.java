package com.example.redislens.domain.model;

/**
 * 키 목록을 만들 때 사용한 전략
 */
public enum ListingStrategyType {
    /** KEYS pattern 한 번 호출 */
    DIRECT,
    /** SCAN 커서 반복 */
    SCAN
}
