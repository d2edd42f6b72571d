package com.example.redislens.presentation.dto;

import com.example.redislens.domain.model.BulkDeleteResult;
import com.example.redislens.domain.model.KeyDetails;
import com.example.redislens.domain.model.KeyPage;
import com.example.redislens.domain.model.ListingStrategyType;
import com.example.redislens.domain.model.ServerStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * API 요청/응답 DTO들
 *
 * SOLID 원칙:
 * - Single Responsibility: 각 DTO는 하나의 요청/응답 타입만 표현
 *
 * - JSON 필드 이름은 snake_case (spring.jackson.property-naming-strategy)
 * - null이 아닌 빈 컬렉션 반환
 */
public class RedisLensDto {

    /**
     * 쿼리 파라미터로 받는 연결 정보 (없으면 설정 기본값 사용)
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @ToString(exclude = "password")
    public static class ConnectionParams {
        private String host;
        private Integer port;
        private Integer db;
        private String password;
    }

    /**
     * 단순 상태 응답
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusResponse {
        private String status;
        private String message;

        public static StatusResponse ok(String message) {
            return StatusResponse.builder()
                    .status("ok")
                    .message(message)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InfoResponse {
        private Map<String, String> info;
    }

    /**
     * 키 목록 페이지 응답
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeysPageResponse {
        private List<String> keys;
        private int count;
        private long total;
        private int page;
        private int perPage;
        private long totalPages;
        private ListingStrategyType strategy;

        public static KeysPageResponse from(KeyPage page) {
            return KeysPageResponse.builder()
                    .keys(page.getKeys() != null ? page.getKeys() : List.of())
                    .count(page.getCount())
                    .total(page.getTotal())
                    .page(page.getPage())
                    .perPage(page.getPerPage())
                    .totalPages(page.getTotalPages())
                    .strategy(page.getStrategy())
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeySearchResponse {
        private String prefix;
        private List<String> keys;
        private int count;
    }

    /**
     * 키 상세 응답
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeyDetailsResponse {
        private String key;
        private String type;
        private Object value;
        private long ttl;
        private long memoryUsage;

        public static KeyDetailsResponse from(KeyDetails details) {
            return KeyDetailsResponse.builder()
                    .key(details.getKey())
                    .type(details.getType())
                    .value(details.getValue())
                    .ttl(details.getTtl())
                    .memoryUsage(details.getMemoryUsage())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BulkDeleteRequest {
        private List<String> keys;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BulkDeleteResponse {
        private String status;
        private int deletedCount;
        private int totalCount;
        private List<String> errors;

        public static BulkDeleteResponse from(BulkDeleteResult result) {
            return BulkDeleteResponse.builder()
                    .status(result.getStatus())
                    .deletedCount(result.getDeletedCount())
                    .totalCount(result.getTotalCount())
                    .errors(result.getErrors() != null ? result.getErrors() : List.of())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommandRequest {
        private String command;
        private List<String> args = List.of();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommandResponse {
        private Object result;
    }

    /**
     * 서버 통계 응답
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatsResponse {
        private ServerStats.Memory memory;
        private ServerStats.Keys keys;
        private ServerStats.Performance performance;
        private Instant timestamp;

        public static StatsResponse from(ServerStats stats) {
            return StatsResponse.builder()
                    .memory(stats.getMemory())
                    .keys(stats.getKeys())
                    .performance(stats.getPerformance())
                    .timestamp(Instant.now())
                    .build();
        }
    }

    /**
     * 에러 응답 DTO
     *
     * errorCode로 "연결 실패"와 "조회 실패"를 구분한다.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private int status;
        private String error;
        private String errorCode;
        private String message;
        private Instant timestamp;
    }
}
