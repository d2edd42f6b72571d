package com.example.redislens.infrastructure.redis;

import java.util.List;

/**
 * 키 카탈로그가 사용하는 Redis 키스페이스 기본 명령을 추상화한 인터페이스
 *
 * SOLID 원칙:
 * - Interface Segregation: 키 목록 조회에 필요한 세 가지 명령만 노출
 * - Dependency Inversion: KeyCatalog는 Lettuce 구현 세부사항을 모름
 */
public interface KeyspaceClient {

    /**
     * 현재 DB의 대략적인 키 개수 (DBSIZE, O(1))
     *
     * @return 키 개수
     */
    long approximateKeyCount();

    /**
     * 패턴에 매칭되는 키를 한 번에 조회 (KEYS)
     *
     * @param pattern glob 패턴
     * @return 매칭된 키 목록
     * @throws com.example.redislens.common.exception.KeyEnumerationRejectedException 서버가 KEYS를 거부한 경우
     */
    List<String> matchKeys(String pattern);

    /**
     * 커서 기반 키 조회 한 번 (SCAN cursor MATCH pattern COUNT hint)
     *
     * @param cursor 이전 호출이 돌려준 커서 (시작은 "0")
     * @param pattern glob 패턴
     * @param batchSizeHint COUNT 힌트
     * @return 다음 커서와 이번 배치의 키
     */
    ScanBatch scanBatch(String cursor, String pattern, int batchSizeHint);
}
