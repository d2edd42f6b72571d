package com.example.redislens.domain.model;

import com.example.redislens.common.exception.InvalidRequestException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 어떤 Redis 서버/논리 DB에 접속할지 나타내는 불변 Value Object
 *
 * - 요청마다 생성되며 저장하지 않음
 * - 비밀번호는 toString()에 포함하지 않음
 */
@Getter
@ToString(exclude = "password")
@EqualsAndHashCode
public class ConnectionDescriptor {

    private static final int MAX_PORT = 65535;

    private final String host;
    private final int port;
    private final int database;
    private final String password;

    private ConnectionDescriptor(String host, int port, int database, String password) {
        this.host = host;
        this.port = port;
        this.database = database;
        this.password = password;
    }

    /**
     * 정적 팩토리 메서드 + 매개변수 유효성 검사
     */
    public static ConnectionDescriptor of(String host, int port, int database, String password) {
        if (host == null || host.isBlank()) {
            throw new InvalidRequestException("Host must not be blank");
        }
        if (port < 1 || port > MAX_PORT) {
            throw new InvalidRequestException("Port must be between 1 and " + MAX_PORT + ": " + port);
        }
        if (database < 0) {
            throw new InvalidRequestException("Database index must not be negative: " + database);
        }
        String normalizedPassword = password == null || password.isEmpty() ? null : password;
        return new ConnectionDescriptor(host.trim(), port, database, normalizedPassword);
    }

    public boolean hasPassword() {
        return password != null;
    }

    /**
     * 로그/에러 메시지용 표기 (host:port/db)
     */
    public String describe() {
        return host + ":" + port + "/" + database;
    }
}
