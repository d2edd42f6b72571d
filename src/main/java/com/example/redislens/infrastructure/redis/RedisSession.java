package com.example.redislens.infrastructure.redis;

import com.example.redislens.domain.model.ZSetEntry;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * 요청 하나 동안만 사용하는 Redis 연결 핸들
 *
 * 프로세스 전역 클라이언트 대신 요청마다 열고 닫는다.
 * try-with-resources로 사용한다.
 */
public interface RedisSession extends KeyspaceClient, AutoCloseable {

    String ping();

    Properties info();

    /**
     * @return Redis 타입 코드 ("string", "list", "set", "zset", "hash", "stream", 키가 없으면 "none")
     */
    String type(String key);

    String getString(String key);

    List<String> getList(String key);

    Set<String> getSetMembers(String key);

    /**
     * @return score 오름차순 member/score 쌍
     */
    List<ZSetEntry> getSortedSet(String key);

    Map<String, String> getHash(String key);

    /**
     * @return 초 단위 TTL (-1: 만료 없음, -2: 키 없음)
     */
    long ttl(String key);

    /**
     * @return 바이트 단위 메모리 사용량, MEMORY 명령을 지원하지 않는 서버면 0
     */
    long memoryUsage(String key);

    /**
     * @return 실제로 삭제되었으면 true
     */
    boolean delete(String key);

    /**
     * 임의의 Redis 명령 실행
     *
     * @return JSON으로 직렬화할 수 있는 형태로 변환된 응답
     */
    Object execute(String command, List<String> args);

    @Override
    void close();
}
