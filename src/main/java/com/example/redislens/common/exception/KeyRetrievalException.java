package com.example.redislens.common.exception;

/**
 * 키 목록 조회를 끝까지 완료할 수 없는 경우
 *
 * SCAN/KEYS 응답 오류, 타임아웃, 비정상 커서 등. 재시도하지 않는다.
 */
public class KeyRetrievalException extends RuntimeException {

    public KeyRetrievalException(String message) {
        super(message);
    }

    public KeyRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
