package com.example.redislens.domain.catalog;

import com.example.redislens.domain.model.KeyListing;
import com.example.redislens.domain.model.ListingStrategyType;
import com.example.redislens.infrastructure.redis.KeyspaceClient;

/**
 * 키 목록 조회 전략을 정의하는 인터페이스
 *
 * SOLID 원칙:
 * - Strategy Pattern: KEYS / SCAN 조회 방식을 캡슐화하고 상호 교환 가능하게 만듦
 * - Dependency Inversion: 연결 핸들(KeyspaceClient)을 인자로 받아 전역 상태에 의존하지 않음
 */
public interface KeyListingStrategy {

    /**
     * 패턴에 매칭되는 전체 키 조회
     *
     * @param client 요청 단위 연결 핸들
     * @param pattern glob 패턴
     * @return 전체 키 목록 (부분 결과 없음)
     */
    KeyListing listKeys(KeyspaceClient client, String pattern);

    /**
     * 전략 타입 반환
     */
    ListingStrategyType getType();
}
