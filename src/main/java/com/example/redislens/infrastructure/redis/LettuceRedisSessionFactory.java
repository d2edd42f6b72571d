package com.example.redislens.infrastructure.redis;

import com.example.redislens.common.exception.RedisConnectivityException;
import com.example.redislens.domain.model.ConnectionDescriptor;
import com.example.redislens.infrastructure.config.RedisLensProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.resource.ClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * 요청마다 Lettuce 연결을 새로 여는 RedisSessionFactory 구현체
 *
 * 연결 풀이나 공유 클라이언트 없이 매 요청 독립 연결을 사용한다.
 * 이벤트 루프 등 무거운 자원은 애플리케이션의 ClientResources 빈을 공유한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LettuceRedisSessionFactory implements RedisSessionFactory {

    private final ClientResources clientResources;
    private final RedisLensProperties properties;

    @Override
    public RedisSession open(ConnectionDescriptor descriptor) {
        RedisLensProperties.Connection settings = properties.getConnection();
        LettuceConnectionFactory connectionFactory = createConnectionFactory(descriptor, settings);
        RedisConnection connection = null;

        try {
            connectionFactory.afterPropertiesSet();
            connectionFactory.start();
            connection = connectionFactory.getConnection();
            connection.ping();

            if (log.isDebugEnabled()) {
                log.debug("Opened Redis session - Endpoint: {}", descriptor.describe());
            }

            return new LettuceRedisSession(descriptor.describe(), connectionFactory, connection,
                    settings.getCommandTimeout());

        } catch (RuntimeException e) {
            // 연결/인증/사전 PING 실패는 모두 연결 오류로 취급
            log.error("Redis connection error - Endpoint: {}: {}", descriptor.describe(), e.getMessage());
            if (connection != null) {
                connection.close();
            }
            connectionFactory.destroy();
            throw new RedisConnectivityException(descriptor.describe(), e);
        }
    }

    private LettuceConnectionFactory createConnectionFactory(ConnectionDescriptor descriptor,
                                                             RedisLensProperties.Connection settings) {
        RedisStandaloneConfiguration standalone =
                new RedisStandaloneConfiguration(descriptor.getHost(), descriptor.getPort());
        standalone.setDatabase(descriptor.getDatabase());
        if (descriptor.hasPassword()) {
            standalone.setPassword(RedisPassword.of(descriptor.getPassword()));
        }

        ClientOptions clientOptions = ClientOptions.builder()
                .autoReconnect(false)
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(settings.getConnectTimeout())
                        .build())
                .build();

        LettuceClientConfiguration clientConfiguration = LettuceClientConfiguration.builder()
                .clientResources(clientResources)
                .clientOptions(clientOptions)
                .commandTimeout(settings.getCommandTimeout())
                .build();

        return new LettuceConnectionFactory(standalone, clientConfiguration);
    }
}
