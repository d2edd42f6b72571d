package com.example.redislens.common.exception;

/**
 * 키 목록 이외의 Redis 작업(값 조회, 삭제, INFO 등) 실패
 */
public class RedisOperationException extends RuntimeException {

    public RedisOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
