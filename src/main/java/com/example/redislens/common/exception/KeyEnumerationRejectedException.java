package com.example.redislens.common.exception;

/**
 * 서버가 KEYS 명령을 거부한 경우 (rename-command, ACL 등)
 *
 * KeyCatalog 내부에서 SCAN으로 폴백하여 복구되므로 HTTP 계층까지 전파되지 않는다.
 */
public class KeyEnumerationRejectedException extends RuntimeException {

    public KeyEnumerationRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
