package com.example.redislens.common.exception;

import lombok.Getter;

/**
 * Redis 서버에 연결하거나 인증할 수 없는 경우
 *
 * 이 계층에서는 재시도하지 않고 호출자에게 그대로 전달한다.
 */
@Getter
public class RedisConnectivityException extends RuntimeException {

    private final String endpoint;

    public RedisConnectivityException(String endpoint, Throwable cause) {
        super("Could not connect to Redis server at " + endpoint, cause);
        this.endpoint = endpoint;
    }
}
