package com.example.redislens.common.exception;

import lombok.Getter;

/**
 * 사용자가 실행한 Redis 명령이 서버에서 에러 응답을 받은 경우
 *
 * Redis 에러 메시지(예: "ERR unknown command")는 사용자 입력의 결과이므로 그대로 노출한다.
 */
@Getter
public class CommandExecutionException extends RuntimeException {

    private final String command;

    public CommandExecutionException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }
}
