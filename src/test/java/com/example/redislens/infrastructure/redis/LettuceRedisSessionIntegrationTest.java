package com.example.redislens.infrastructure.redis;

import com.example.redislens.common.exception.CommandExecutionException;
import com.example.redislens.common.exception.RedisConnectivityException;
import com.example.redislens.domain.model.ConnectionDescriptor;
import com.example.redislens.domain.model.ZSetEntry;
import com.redis.testcontainers.RedisContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * LettuceRedisSession 통합 테스트 (Testcontainers 사용)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LettuceRedisSessionIntegrationTest {

    @Container
    static RedisContainer redis = new RedisContainer(
            DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void registerRedisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", redis::getFirstMappedPort);
        registry.add("redis-lens.connection.host", redis::getHost);
        registry.add("redis-lens.connection.port", redis::getFirstMappedPort);
    }

    @Autowired
    private RedisSessionFactory sessionFactory;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private ConnectionDescriptor descriptor;

    @BeforeEach
    void setUp() {
        // 각 테스트 전 Redis 초기화
        redisTemplate.getConnectionFactory()
                .getConnection()
                .serverCommands()
                .flushAll();
        descriptor = ConnectionDescriptor.of(redis.getHost(), redis.getFirstMappedPort(), 0, null);
    }

    @Test
    @DisplayName("세션 열기 및 PING")
    void openSessionAndPingTest() {
        try (RedisSession session = sessionFactory.open(descriptor)) {
            assertThat(session.ping()).isEqualToIgnoringCase("PONG");
            assertThat(session.info().getProperty("redis_version")).isNotBlank();
        }
    }

    @Test
    @DisplayName("닫힌 포트로 연결하면 RedisConnectivityException")
    void unreachableServerTest() {
        // given
        ConnectionDescriptor unreachable = ConnectionDescriptor.of("127.0.0.1", 1, 0, null);

        // when & then
        assertThatThrownBy(() -> sessionFactory.open(unreachable))
                .isInstanceOf(RedisConnectivityException.class)
                .hasMessageContaining("127.0.0.1:1/0");
    }

    @Test
    @DisplayName("KEYS와 SCAN이 같은 키 집합을 반환")
    void matchKeysAndScanTest() {
        // given
        for (int i = 0; i < 30; i++) {
            redisTemplate.opsForValue().set("user:" + i, "v");
        }
        redisTemplate.opsForValue().set("order:1", "v");

        try (RedisSession session = sessionFactory.open(descriptor)) {
            // when
            List<String> matched = session.matchKeys("user:*");

            List<String> scanned = new ArrayList<>();
            String cursor = ScanBatch.INITIAL_CURSOR;
            do {
                ScanBatch batch = session.scanBatch(cursor, "user:*", 5);
                scanned.addAll(batch.getKeys());
                cursor = batch.getNextCursor();
            } while (!ScanBatch.INITIAL_CURSOR.equals(cursor));

            // then
            assertThat(session.approximateKeyCount()).isEqualTo(31);
            assertThat(matched).hasSize(30);
            assertThat(scanned).containsAll(matched);
        }
    }

    @Test
    @DisplayName("타입별 값 조회")
    void readValuesByTypeTest() {
        // given
        redisTemplate.opsForValue().set("s", "hello");
        redisTemplate.opsForList().rightPushAll("l", "a", "b", "c");
        redisTemplate.opsForSet().add("st", "x", "y");
        redisTemplate.opsForZSet().add("z", "low", 1.0);
        redisTemplate.opsForZSet().add("z", "high", 2.5);
        redisTemplate.opsForHash().put("h", "field", "value");

        try (RedisSession session = sessionFactory.open(descriptor)) {
            // then
            assertThat(session.type("s")).isEqualTo("string");
            assertThat(session.type("missing")).isEqualTo("none");
            assertThat(session.getString("s")).isEqualTo("hello");
            assertThat(session.getList("l")).containsExactly("a", "b", "c");
            assertThat(session.getSetMembers("st")).containsExactlyInAnyOrder("x", "y");
            assertThat(session.getSortedSet("z")).containsExactly(
                    ZSetEntry.of("low", 1.0), ZSetEntry.of("high", 2.5));
            assertThat(session.getHash("h")).isEqualTo(Map.of("field", "value"));
            assertThat(session.ttl("s")).isEqualTo(-1);
            assertThat(session.memoryUsage("s")).isPositive();
        }
    }

    @Test
    @DisplayName("키 삭제 결과 반환")
    void deleteTest() {
        // given
        redisTemplate.opsForValue().set("temp", "1");

        try (RedisSession session = sessionFactory.open(descriptor)) {
            // when & then
            assertThat(session.delete("temp")).isTrue();
            assertThat(session.delete("temp")).isFalse();
        }
    }

    @Test
    @DisplayName("임의 명령 실행 결과를 문자열로 변환")
    void executeCommandTest() {
        try (RedisSession session = sessionFactory.open(descriptor)) {
            // when
            session.execute("SET", List.of("greeting", "hi"));
            Object value = session.execute("GET", List.of("greeting"));
            Object pushed = session.execute("RPUSH", List.of("items", "1", "2"));
            Object range = session.execute("LRANGE", List.of("items", "0", "-1"));

            // then
            assertThat(value).isEqualTo("hi");
            assertThat(pushed).isEqualTo(2L);
            assertThat(range).isEqualTo(List.of("1", "2"));
        }
    }

    @Test
    @DisplayName("서버 에러 응답은 CommandExecutionException")
    void executeErrorReplyTest() {
        // given
        redisTemplate.opsForValue().set("text", "abc");

        try (RedisSession session = sessionFactory.open(descriptor)) {
            // when & then
            assertThatThrownBy(() -> session.execute("INCR", List.of("text")))
                    .isInstanceOf(CommandExecutionException.class)
                    .hasMessageContaining("not an integer");
        }
    }
}
