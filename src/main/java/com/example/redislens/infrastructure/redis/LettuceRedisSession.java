package com.example.redislens.infrastructure.redis;

import com.example.redislens.common.exception.CommandExecutionException;
import com.example.redislens.common.exception.KeyEnumerationRejectedException;
import com.example.redislens.common.exception.KeyRetrievalException;
import com.example.redislens.common.exception.RedisConnectivityException;
import com.example.redislens.common.exception.RedisOperationException;
import com.example.redislens.domain.model.ZSetEntry;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.LettuceFutures;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.cluster.api.async.RedisClusterAsyncCommands;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.DataType;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.zset.Tuple;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.example.redislens.infrastructure.redis.RedisReplyConverter.toBytes;
import static com.example.redislens.infrastructure.redis.RedisReplyConverter.toUtf8;

/**
 * Spring Data Redis(Lettuce) 기반 RedisSession 구현체
 *
 * 요청마다 만든 LettuceConnectionFactory와 연결을 소유하고, close() 시 함께 정리한다.
 * SCAN 한 배치와 MEMORY USAGE는 Spring Data API에 대응 메서드가 없어 네이티브 비동기 명령을 사용한다.
 *
 * 예외 변환:
 * - 연결/인증 실패 → RedisConnectivityException
 * - KEYS 에러 응답 → KeyEnumerationRejectedException (KeyCatalog가 SCAN으로 폴백)
 * - 키 목록 조회 실패 → KeyRetrievalException
 * - 사용자 명령 에러 응답 → CommandExecutionException
 * - 그 외 → RedisOperationException
 */
@Slf4j
public class LettuceRedisSession implements RedisSession {

    private final String endpoint;
    private final LettuceConnectionFactory connectionFactory;
    private final RedisConnection connection;
    private final Duration commandTimeout;

    LettuceRedisSession(String endpoint,
                        LettuceConnectionFactory connectionFactory,
                        RedisConnection connection,
                        Duration commandTimeout) {
        this.endpoint = endpoint;
        this.connectionFactory = connectionFactory;
        this.connection = connection;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public String ping() {
        return operation("PING", connection::ping);
    }

    @Override
    public Properties info() {
        return operation("INFO", () -> {
            Properties info = connection.serverCommands().info();
            return info != null ? info : new Properties();
        });
    }

    @Override
    public long approximateKeyCount() {
        return retrieval("DBSIZE", () -> {
            Long size = connection.serverCommands().dbSize();
            return size != null ? size : 0L;
        });
    }

    @Override
    public List<String> matchKeys(String pattern) {
        try {
            Set<byte[]> keys = connection.keyCommands().keys(toBytes(pattern));
            return decodeAll(keys);

        } catch (RuntimeException e) {
            if (RedisExceptionTranslator.isConnectivityFailure(e)) {
                throw new RedisConnectivityException(endpoint, e);
            }
            if (RedisExceptionTranslator.isErrorReply(e)) {
                throw new KeyEnumerationRejectedException(
                        "KEYS rejected by server: " + RedisExceptionTranslator.describe(e), e);
            }
            throw new KeyRetrievalException("KEYS failed: " + RedisExceptionTranslator.describe(e), e);
        }
    }

    @Override
    public ScanBatch scanBatch(String cursor, String pattern, int batchSizeHint) {
        return retrieval("SCAN", () -> {
            ScanArgs args = ScanArgs.Builder.matches(pattern).limit(batchSizeHint);
            KeyScanCursor<byte[]> result = LettuceFutures.awaitOrCancel(
                    nativeCommands().scan(ScanCursor.of(cursor), args),
                    commandTimeout.toMillis(), TimeUnit.MILLISECONDS);

            if (result == null || result.getCursor() == null) {
                throw new KeyRetrievalException("SCAN returned no cursor for " + endpoint);
            }
            return ScanBatch.of(result.getCursor(), decodeAll(result.getKeys()));
        });
    }

    @Override
    public String type(String key) {
        return operation("TYPE", () -> {
            DataType type = connection.keyCommands().type(toBytes(key));
            return type != null ? type.code() : DataType.NONE.code();
        });
    }

    @Override
    public String getString(String key) {
        return operation("GET", () -> toUtf8(connection.stringCommands().get(toBytes(key))));
    }

    @Override
    public List<String> getList(String key) {
        return operation("LRANGE", () -> decodeAll(connection.listCommands().lRange(toBytes(key), 0, -1)));
    }

    @Override
    public Set<String> getSetMembers(String key) {
        return operation("SMEMBERS", () ->
                new LinkedHashSet<>(decodeAll(connection.setCommands().sMembers(toBytes(key)))));
    }

    @Override
    public List<ZSetEntry> getSortedSet(String key) {
        return operation("ZRANGE", () -> {
            Set<Tuple> tuples = connection.zSetCommands().zRangeWithScores(toBytes(key), 0, -1);
            if (tuples == null) {
                return Collections.<ZSetEntry>emptyList();
            }
            List<ZSetEntry> entries = new ArrayList<>(tuples.size());
            for (Tuple tuple : tuples) {
                entries.add(ZSetEntry.of(toUtf8(tuple.getValue()), tuple.getScore()));
            }
            return entries;
        });
    }

    @Override
    public Map<String, String> getHash(String key) {
        return operation("HGETALL", () -> {
            Map<byte[], byte[]> raw = connection.hashCommands().hGetAll(toBytes(key));
            Map<String, String> hash = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((field, value) -> hash.put(toUtf8(field), toUtf8(value)));
            }
            return hash;
        });
    }

    @Override
    public long ttl(String key) {
        return operation("TTL", () -> {
            Long ttl = connection.keyCommands().ttl(toBytes(key));
            return ttl != null ? ttl : -2L;
        });
    }

    @Override
    public long memoryUsage(String key) {
        try {
            Long usage = LettuceFutures.awaitOrCancel(
                    nativeCommands().memoryUsage(toBytes(key)),
                    commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return usage != null ? usage : 0L;

        } catch (RuntimeException e) {
            if (RedisExceptionTranslator.isConnectivityFailure(e)) {
                throw new RedisConnectivityException(endpoint, e);
            }
            if (RedisExceptionTranslator.isErrorReply(e)) {
                // MEMORY 명령이 없는 서버 (구버전, 호환 서버)
                log.warn("Memory usage command not supported: {}. Returning 0.",
                        RedisExceptionTranslator.describe(e));
                return 0L;
            }
            throw new RedisOperationException("MEMORY USAGE failed for key " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        return operation("DEL", () -> {
            Long deleted = connection.keyCommands().del(toBytes(key));
            return deleted != null && deleted > 0;
        });
    }

    @Override
    public Object execute(String command, List<String> args) {
        byte[][] rawArgs = new byte[args.size()][];
        for (int i = 0; i < args.size(); i++) {
            rawArgs[i] = toBytes(args.get(i));
        }

        try {
            return RedisReplyConverter.toDisplayValue(connection.execute(command, rawArgs));

        } catch (RuntimeException e) {
            if (RedisExceptionTranslator.isConnectivityFailure(e)) {
                throw new RedisConnectivityException(endpoint, e);
            }
            if (RedisExceptionTranslator.isErrorReply(e)) {
                throw new CommandExecutionException(command, RedisExceptionTranslator.describe(e), e);
            }
            throw new RedisOperationException("Error executing command " + command, e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } finally {
            connectionFactory.destroy();
        }
    }

    @SuppressWarnings("unchecked") // LettuceConnection의 네이티브 연결은 byte[] 코덱 비동기 명령
    private RedisClusterAsyncCommands<byte[], byte[]> nativeCommands() {
        return (RedisClusterAsyncCommands<byte[], byte[]>) connection.getNativeConnection();
    }

    private <T> T retrieval(String command, Supplier<T> action) {
        try {
            return action.get();

        } catch (KeyRetrievalException e) {
            throw e;

        } catch (RuntimeException e) {
            if (RedisExceptionTranslator.isConnectivityFailure(e)) {
                throw new RedisConnectivityException(endpoint, e);
            }
            throw new KeyRetrievalException(command + " failed: " + RedisExceptionTranslator.describe(e), e);
        }
    }

    private <T> T operation(String command, Supplier<T> action) {
        try {
            return action.get();

        } catch (RuntimeException e) {
            if (RedisExceptionTranslator.isConnectivityFailure(e)) {
                throw new RedisConnectivityException(endpoint, e);
            }
            throw new RedisOperationException(command + " failed: " + RedisExceptionTranslator.describe(e), e);
        }
    }

    private static List<String> decodeAll(Collection<byte[]> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        List<String> decoded = new ArrayList<>(values.size());
        for (byte[] value : values) {
            decoded.add(toUtf8(value));
        }
        return decoded;
    }
}
