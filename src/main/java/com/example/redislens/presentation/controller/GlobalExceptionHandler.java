package com.example.redislens.presentation.controller;

import com.example.redislens.common.exception.CommandExecutionException;
import com.example.redislens.common.exception.InvalidRequestException;
import com.example.redislens.common.exception.KeyNotFoundException;
import com.example.redislens.common.exception.KeyRetrievalException;
import com.example.redislens.common.exception.RedisConnectivityException;
import com.example.redislens.common.exception.RedisOperationException;
import com.example.redislens.presentation.dto.RedisLensDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * 전역 예외 처리 핸들러
 *
 * SOLID 원칙:
 * - Single Responsibility: 예외 처리 및 에러 응답 생성만 담당
 *
 * errorCode:
 * - CONNECTIVITY: 서버 연결/인증 실패 (503)
 * - KEY_RETRIEVAL: 키 목록 조회를 끝내지 못함 (500)
 * - KEY_NOT_FOUND (404), INVALID_REQUEST / COMMAND_FAILED (400), REDIS_OPERATION / INTERNAL_ERROR (500)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String MASKED_MESSAGE = "An internal server error occurred. Please try again later.";

    /**
     * 잘못된 요청 파라미터 예외 처리
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    /**
     * 파라미터 타입 불일치 (예: page=abc)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST",
                "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request body");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "NOT_FOUND", "Resource not found: " + ex.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        return buildResponse(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", ex.getMessage());
    }

    /**
     * Redis 연결 실패 예외 처리
     */
    @ExceptionHandler(RedisConnectivityException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleConnectivity(RedisConnectivityException ex) {
        log.warn("Redis connectivity failure - Endpoint: {}", ex.getEndpoint());
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "CONNECTIVITY", "Could not connect to Redis server");
    }

    /**
     * 키 목록 조회 실패 예외 처리
     */
    @ExceptionHandler(KeyRetrievalException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleKeyRetrieval(KeyRetrievalException ex) {
        log.error("Key retrieval failed", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "KEY_RETRIEVAL",
                "Error fetching keys: " + ex.getMessage());
    }

    @ExceptionHandler(KeyNotFoundException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleKeyNotFound(KeyNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "KEY_NOT_FOUND", ex.getMessage());
    }

    /**
     * 사용자 명령의 Redis 에러 응답 처리
     */
    @ExceptionHandler(CommandExecutionException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleCommandExecution(CommandExecutionException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "COMMAND_FAILED",
                "Error executing command: " + ex.getMessage());
    }

    @ExceptionHandler(RedisOperationException.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleRedisOperation(RedisOperationException ex) {
        log.error("Redis operation failed", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "REDIS_OPERATION", ex.getMessage());
    }

    /**
     * 일반 예외 처리 (내부 메시지 마스킹)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<RedisLensDto.ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", MASKED_MESSAGE);
    }

    private ResponseEntity<RedisLensDto.ErrorResponse> buildResponse(HttpStatus status, String errorCode,
                                                                    String message) {
        RedisLensDto.ErrorResponse response = RedisLensDto.ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .timestamp(Instant.now())
                .build();

        return ResponseEntity
                .status(status)
                .body(response);
    }
}
