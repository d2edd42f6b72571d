package com.example.redislens.infrastructure.redis;

import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisConnectionException;
import org.springframework.data.redis.RedisConnectionFailureException;

/**
 * Spring Data Redis / Lettuce 예외를 분류하는 유틸리티
 *
 * LettuceConnection은 Lettuce 예외를 DataAccessException으로 감싸고,
 * 네이티브 비동기 명령은 Lettuce 예외를 그대로 던지므로 cause 체인 전체를 확인한다.
 */
public final class RedisExceptionTranslator {

    private RedisExceptionTranslator() { }

    /**
     * 서버에 닿지 못했거나 인증에 실패한 경우
     */
    public static boolean isConnectivityFailure(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof RedisConnectionFailureException
                    || current instanceof RedisConnectionException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    /**
     * 서버가 에러 응답(-ERR, -NOPERM 등)을 돌려준 경우
     */
    public static boolean isErrorReply(Throwable ex) {
        return findErrorReply(ex) != null;
    }

    /**
     * 사용자에게 보여줄 메시지: Redis 에러 응답이 있으면 그 메시지, 없으면 예외 메시지
     */
    public static String describe(Throwable ex) {
        RedisCommandExecutionException reply = findErrorReply(ex);
        if (reply != null && reply.getMessage() != null) {
            return reply.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static RedisCommandExecutionException findErrorReply(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof RedisCommandExecutionException) {
                return (RedisCommandExecutionException) current;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }
}
