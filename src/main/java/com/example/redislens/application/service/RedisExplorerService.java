package com.example.redislens.application.service;

import com.example.redislens.domain.model.BulkDeleteResult;
import com.example.redislens.domain.model.ConnectionDescriptor;
import com.example.redislens.domain.model.KeyDetails;
import com.example.redislens.domain.model.KeyPage;
import com.example.redislens.domain.model.ServerStats;

import java.util.List;
import java.util.Map;

/**
 * Redis 관리 콘솔 서비스 인터페이스
 *
 * SOLID 원칙:
 * - Interface Segregation: 콘솔 화면이 필요로 하는 작업만 정의
 * - Dependency Inversion: 구현이 아닌 추상화에 의존
 *
 * 모든 작업은 요청마다 새 Redis 세션을 열고 닫는다.
 */
public interface RedisExplorerService {

    /**
     * 연결 확인 (PING)
     *
     * @param connection 접속 정보
     */
    void ping(ConnectionDescriptor connection);

    /**
     * INFO 전체 항목
     */
    Map<String, String> getInfo(ConnectionDescriptor connection);

    /**
     * 메모리/키/성능 통계
     */
    ServerStats getStats(ConnectionDescriptor connection);

    /**
     * 패턴에 매칭되는 키 목록의 한 페이지
     *
     * @param connection 접속 정보
     * @param pattern glob 패턴
     * @param page 1부터 시작하는 페이지 번호
     * @param perPage 페이지 크기
     * @return 페이지 결과
     */
    KeyPage getKeysPage(ConnectionDescriptor connection, String pattern, int page, int perPage);

    /**
     * 접두어로 키 검색
     *
     * @param prefix 키 접두어 (glob 특수문자는 이스케이프됨)
     * @param limit 최대 반환 개수
     */
    List<String> searchByPrefix(ConnectionDescriptor connection, String prefix, int limit);

    /**
     * 키 타입, 값, TTL, 메모리 사용량 조회
     *
     * @throws com.example.redislens.common.exception.KeyNotFoundException 키가 없는 경우
     */
    KeyDetails getKeyDetails(ConnectionDescriptor connection, String key);

    /**
     * 키 하나 삭제
     *
     * @throws com.example.redislens.common.exception.KeyNotFoundException 키가 없는 경우
     */
    void deleteKey(ConnectionDescriptor connection, String key);

    /**
     * 여러 키 삭제 (키 단위로 성공/실패 집계)
     */
    BulkDeleteResult deleteKeys(ConnectionDescriptor connection, List<String> keys);

    /**
     * 임의의 Redis 명령 실행
     *
     * @return JSON 직렬화 가능한 응답
     */
    Object executeCommand(ConnectionDescriptor connection, String command, List<String> args);
}
