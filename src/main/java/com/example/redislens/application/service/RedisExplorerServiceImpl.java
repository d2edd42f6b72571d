package com.example.redislens.application.service;

import com.example.redislens.common.exception.InvalidRequestException;
import com.example.redislens.common.exception.KeyNotFoundException;
import com.example.redislens.common.exception.RedisOperationException;
import com.example.redislens.domain.catalog.KeyCatalog;
import com.example.redislens.domain.catalog.KeyPaginator;
import com.example.redislens.domain.model.BulkDeleteResult;
import com.example.redislens.domain.model.ConnectionDescriptor;
import com.example.redislens.domain.model.KeyDetails;
import com.example.redislens.domain.model.KeyListing;
import com.example.redislens.domain.model.KeyPage;
import com.example.redislens.domain.model.ServerStats;
import com.example.redislens.infrastructure.redis.RedisSession;
import com.example.redislens.infrastructure.redis.RedisSessionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Redis 관리 콘솔 서비스 구현체
 *
 * SOLID 원칙:
 * - Single Responsibility: 요청 단위 세션 관리와 작업 조합만 담당
 * - Dependency Inversion: RedisSessionFactory / KeyCatalog 추상화에 의존
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisExplorerServiceImpl implements RedisExplorerService {

    private static final String TYPE_NONE = "none";

    private final RedisSessionFactory sessionFactory;
    private final KeyCatalog keyCatalog;

    @Override
    public void ping(ConnectionDescriptor connection) {
        try (RedisSession session = sessionFactory.open(connection)) {
            session.ping();
        }
    }

    @Override
    public Map<String, String> getInfo(ConnectionDescriptor connection) {
        try (RedisSession session = sessionFactory.open(connection)) {
            Properties info = session.info();
            Map<String, String> result = new LinkedHashMap<>();
            for (String name : info.stringPropertyNames()) {
                result.put(name, info.getProperty(name));
            }
            return result;
        }
    }

    @Override
    public ServerStats getStats(ConnectionDescriptor connection) {
        try (RedisSession session = sessionFactory.open(connection)) {
            Properties info = session.info();
            long keyCount = session.approximateKeyCount();
            return ServerStats.from(info, keyCount);
        }
    }

    @Override
    public KeyPage getKeysPage(ConnectionDescriptor connection, String pattern, int page, int perPage) {
        // 연결을 열기 전에 페이지 인자 검증
        KeyPaginator.validate(page, perPage);

        try (RedisSession session = sessionFactory.open(connection)) {
            return keyCatalog.getKeysPage(session, pattern, page, perPage);
        }
    }

    @Override
    public List<String> searchByPrefix(ConnectionDescriptor connection, String prefix, int limit) {
        if (limit < 1) {
            throw new InvalidRequestException("Limit must be at least 1: " + limit);
        }

        String pattern = escapeGlob(prefix == null ? "" : prefix) + KeyCatalog.MATCH_ALL;

        try (RedisSession session = sessionFactory.open(connection)) {
            KeyListing listing = keyCatalog.listKeys(session, pattern);
            List<String> keys = listing.getKeys();
            return listing.size() > limit ? List.copyOf(keys.subList(0, limit)) : keys;
        }
    }

    @Override
    public KeyDetails getKeyDetails(ConnectionDescriptor connection, String key) {
        requireKey(key);

        try (RedisSession session = sessionFactory.open(connection)) {
            String type = session.type(key);
            if (TYPE_NONE.equals(type)) {
                throw new KeyNotFoundException(key);
            }

            return KeyDetails.builder()
                    .key(key)
                    .type(type)
                    .value(readValue(session, key, type))
                    .ttl(session.ttl(key))
                    .memoryUsage(session.memoryUsage(key))
                    .build();
        }
    }

    @Override
    public void deleteKey(ConnectionDescriptor connection, String key) {
        requireKey(key);

        try (RedisSession session = sessionFactory.open(connection)) {
            if (!session.delete(key)) {
                throw new KeyNotFoundException(key);
            }
            log.info("Key deleted - Endpoint: {}, Key: {}", connection.describe(), key);
        }
    }

    @Override
    public BulkDeleteResult deleteKeys(ConnectionDescriptor connection, List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new InvalidRequestException("No keys provided");
        }

        BulkDeleteResult.BulkDeleteResultBuilder result = BulkDeleteResult.builder()
                .totalCount(keys.size());
        int deleted = 0;

        try (RedisSession session = sessionFactory.open(connection)) {
            for (String key : keys) {
                try {
                    if (session.delete(key)) {
                        deleted++;
                    } else {
                        result.error("Key not found: " + key);
                    }

                } catch (RedisOperationException e) {
                    // 키 단위 실패는 집계만 하고 나머지 키는 계속 처리
                    log.warn("Error deleting key '{}': {}", key, e.getMessage());
                    result.error("Error deleting key '" + key + "': " + e.getMessage());
                }
            }
        }

        log.info("Bulk delete - Endpoint: {}, Deleted: {}/{}", connection.describe(), deleted, keys.size());
        return result.deletedCount(deleted).build();
    }

    @Override
    public Object executeCommand(ConnectionDescriptor connection, String command, List<String> args) {
        if (command == null || command.isBlank()) {
            throw new InvalidRequestException("Command must not be blank");
        }
        List<String> arguments = args != null ? args : List.of();

        // 인자에 비밀번호 등이 들어갈 수 있으므로 명령 이름과 개수만 기록
        log.info("Executing command: {} ({} args) on {}", command, arguments.size(), connection.describe());

        try (RedisSession session = sessionFactory.open(connection)) {
            return session.execute(command.trim(), arguments);
        }
    }

    /**
     * Redis 타입별 값 조회
     */
    private Object readValue(RedisSession session, String key, String type) {
        return switch (type) {
            case "string" -> session.getString(key);
            case "list" -> session.getList(key);
            case "set" -> new ArrayList<>(session.getSetMembers(key));
            case "zset" -> session.getSortedSet(key);
            case "hash" -> session.getHash(key);
            default -> {
                log.warn("Unknown key type: {} for key: {}", type, key);
                yield null;
            }
        };
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidRequestException("Key must not be empty");
        }
    }

    /**
     * glob 특수문자(*, ?, [, ], \)를 이스케이프하여 접두어를 문자 그대로 매칭
     */
    static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
