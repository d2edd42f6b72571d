package com.example.redislens.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Redis Lens 설정 (application.yml의 redis-lens.*)
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "redis-lens")
@Validated
public class RedisLensProperties {

    /**
     * 요청에 연결 정보가 없을 때 사용할 기본값과 타임아웃
     */
    @Valid
    private Connection connection = new Connection();

    /**
     * 키 목록 조회 전략
     */
    @Valid
    private Catalog catalog = new Catalog();

    @Valid
    private Pagination pagination = new Pagination();

    @Valid
    private Search search = new Search();

    @Data
    public static class Connection {

        @NotBlank
        private String host = "localhost";

        @Min(1)
        @Max(65535)
        private int port = 6379;

        @Min(0)
        private int database = 0;

        private String password;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration commandTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Catalog {

        /**
         * DBSIZE가 이 값을 넘으면 KEYS 대신 SCAN 사용
         */
        @Min(0)
        private long scanThreshold = 10_000;

        /**
         * SCAN COUNT 힌트
         */
        @Min(1)
        private int scanBatchSize = 1_000;

        /**
         * 커서가 0으로 돌아오지 않는 서버에 대한 안전장치
         */
        @Min(1)
        private long maxScanIterations = 1_000_000;
    }

    @Data
    public static class Pagination {

        @Min(1)
        private int defaultPerPage = 50;
    }

    @Data
    public static class Search {

        @Min(1)
        private int defaultLimit = 100;
    }
}
