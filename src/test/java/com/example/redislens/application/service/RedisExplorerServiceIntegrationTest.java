package com.example.redislens.application.service;

import com.example.redislens.common.exception.KeyNotFoundException;
import com.example.redislens.common.exception.RedisConnectivityException;
import com.example.redislens.domain.model.ConnectionDescriptor;
import com.example.redislens.domain.model.KeyDetails;
import com.example.redislens.domain.model.KeyPage;
import com.example.redislens.domain.model.ListingStrategyType;
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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * RedisExplorerService 통합 테스트
 *
 * SCAN 경로를 실제 서버로 확인하기 위해 임계값을 낮춰 둔다.
 */
@SpringBootTest(properties = {
        "redis-lens.catalog.scan-threshold=20",
        "redis-lens.catalog.scan-batch-size=7"
})
@Testcontainers(disabledWithoutDocker = true)
class RedisExplorerServiceIntegrationTest {

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
    private RedisExplorerService explorerService;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private ConnectionDescriptor descriptor;

    @BeforeEach
    void setUp() {
        redisTemplate.getConnectionFactory()
                .getConnection()
                .serverCommands()
                .flushAll();
        descriptor = ConnectionDescriptor.of(redis.getHost(), redis.getFirstMappedPort(), 0, null);
    }

    @Test
    @DisplayName("키 개수가 임계값 이하이면 KEYS로 조회")
    void smallDatabaseUsesKeysTest() {
        // given
        seed(20);

        // when
        KeyPage page = explorerService.getKeysPage(descriptor, "*", 1, 50);

        // then
        assertThat(page.getStrategy()).isEqualTo(ListingStrategyType.DIRECT);
        assertThat(page.getTotal()).isEqualTo(20);
    }

    @Test
    @DisplayName("키 개수가 임계값을 넘으면 SCAN으로 전체 키를 모아 페이지 분할")
    void largeDatabaseUsesScanTest() {
        // given
        seed(45);

        // when
        KeyPage first = explorerService.getKeysPage(descriptor, "*", 1, 20);

        // then - SCAN은 중복을 돌려줄 수 있으므로 total은 하한만 확인
        assertThat(first.getStrategy()).isEqualTo(ListingStrategyType.SCAN);
        assertThat(first.getKeys()).hasSize(20);
        assertThat(first.getTotal()).isGreaterThanOrEqualTo(45);
        assertThat(first.getTotalPages()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("페이지를 모두 합치면 전체 키 집합")
    void pagesCoverAllKeysTest() {
        // given
        seed(10);

        // when
        Set<String> collected = new HashSet<>();
        for (int page = 1; page <= 4; page++) {
            collected.addAll(explorerService.getKeysPage(descriptor, "*", page, 3).getKeys());
        }

        // then
        assertThat(collected).hasSize(10);
    }

    @Test
    @DisplayName("다른 논리 DB는 분리되어 조회")
    void logicalDatabaseIsolationTest() {
        // given
        seed(3);
        ConnectionDescriptor db1 = ConnectionDescriptor.of(redis.getHost(), redis.getFirstMappedPort(), 1, null);

        // when
        KeyPage page = explorerService.getKeysPage(db1, "*", 1, 10);

        // then
        assertThat(page.getTotal()).isZero();
        assertThat(page.getTotalPages()).isZero();
    }

    @Test
    @DisplayName("키 상세 조회 후 삭제")
    void keyDetailsAndDeleteTest() {
        // given
        redisTemplate.opsForHash().put("profile/1", "name", "lens");

        // when
        KeyDetails details = explorerService.getKeyDetails(descriptor, "profile/1");
        explorerService.deleteKey(descriptor, "profile/1");

        // then
        assertThat(details.getType()).isEqualTo("hash");
        assertThat(explorerService.searchByPrefix(descriptor, "profile/", 10)).isEmpty();
        assertThatThrownBy(() -> explorerService.getKeyDetails(descriptor, "profile/1"))
                .isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    @DisplayName("명령 실행 결과 반환")
    void executeCommandTest() {
        // when
        explorerService.executeCommand(descriptor, "SET", List.of("counter", "41"));
        Object result = explorerService.executeCommand(descriptor, "INCR", List.of("counter"));

        // then
        assertThat(result).isEqualTo(42L);
    }

    @Test
    @DisplayName("잘못된 비밀번호는 연결 오류로 처리")
    void wrongPasswordTest() {
        // given - 비밀번호가 없는 서버에 AUTH 시도
        ConnectionDescriptor withPassword =
                ConnectionDescriptor.of(redis.getHost(), redis.getFirstMappedPort(), 0, "wrong");

        // when & then
        assertThatThrownBy(() -> explorerService.ping(withPassword))
                .isInstanceOf(RedisConnectivityException.class);
    }

    private void seed(int count) {
        for (int i = 0; i < count; i++) {
            redisTemplate.opsForValue().set("seed:" + i, String.valueOf(i));
        }
    }
}
