package com.example.redislens.presentation.controller;

import com.example.redislens.application.service.RedisExplorerService;
import com.example.redislens.common.exception.InvalidRequestException;
import com.example.redislens.domain.model.ConnectionDescriptor;
import com.example.redislens.domain.model.KeyPage;
import com.example.redislens.infrastructure.config.RedisLensProperties;
import com.example.redislens.presentation.dto.RedisLensDto;
import com.example.redislens.presentation.util.KeyPathResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Redis 관리 콘솔 REST Controller
 *
 * SOLID 원칙:
 * - Single Responsibility: HTTP 요청 처리만 담당
 * - Dependency Inversion: Service 인터페이스에 의존
 *
 * 연결 정보(host, port, db, password)는 모든 엔드포인트에서 쿼리 파라미터로 받는다.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RedisExplorerController {

    private final RedisExplorerService explorerService;
    private final RedisLensProperties properties;

    /**
     * 연결 확인
     */
    @PostMapping("/ping")
    public ResponseEntity<RedisLensDto.StatusResponse> ping(
            @ModelAttribute RedisLensDto.ConnectionParams params) {

        explorerService.ping(toDescriptor(params));
        return ResponseEntity.ok(RedisLensDto.StatusResponse.ok("Connected to Redis server"));
    }

    /**
     * INFO 전체 조회
     */
    @PostMapping("/info")
    public ResponseEntity<RedisLensDto.InfoResponse> getInfo(
            @ModelAttribute RedisLensDto.ConnectionParams params) {

        return ResponseEntity.ok(RedisLensDto.InfoResponse.builder()
                .info(explorerService.getInfo(toDescriptor(params)))
                .build());
    }

    /**
     * 메모리/키/성능 통계
     */
    @PostMapping("/stats")
    public ResponseEntity<RedisLensDto.StatsResponse> getStats(
            @ModelAttribute RedisLensDto.ConnectionParams params) {

        return ResponseEntity.ok(RedisLensDto.StatsResponse.from(
                explorerService.getStats(toDescriptor(params))));
    }

    /**
     * 키 목록 (페이지)
     */
    @PostMapping("/keys")
    public ResponseEntity<RedisLensDto.KeysPageResponse> getKeys(
            @ModelAttribute RedisLensDto.ConnectionParams params,
            @RequestParam(defaultValue = "*") String pattern,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", required = false) Integer perPage) {

        int pageSize = perPage != null ? perPage : properties.getPagination().getDefaultPerPage();
        KeyPage keyPage = explorerService.getKeysPage(toDescriptor(params), pattern, page, pageSize);
        return ResponseEntity.ok(RedisLensDto.KeysPageResponse.from(keyPage));
    }

    /**
     * 접두어 검색
     */
    @PostMapping("/keys/search")
    public ResponseEntity<RedisLensDto.KeySearchResponse> searchByPrefix(
            @ModelAttribute RedisLensDto.ConnectionParams params,
            @RequestParam(defaultValue = "") String prefix,
            @RequestParam(required = false) Integer limit) {

        int maxKeys = limit != null ? limit : properties.getSearch().getDefaultLimit();
        List<String> keys = explorerService.searchByPrefix(toDescriptor(params), prefix, maxKeys);

        return ResponseEntity.ok(RedisLensDto.KeySearchResponse.builder()
                .prefix(prefix)
                .keys(keys)
                .count(keys.size())
                .build());
    }

    /**
     * 여러 키 삭제
     */
    @PostMapping("/keys/delete")
    public ResponseEntity<RedisLensDto.BulkDeleteResponse> deleteKeys(
            @ModelAttribute RedisLensDto.ConnectionParams params,
            @RequestBody RedisLensDto.BulkDeleteRequest request) {

        return ResponseEntity.ok(RedisLensDto.BulkDeleteResponse.from(
                explorerService.deleteKeys(toDescriptor(params), request.getKeys())));
    }

    /**
     * 키 상세 조회 ("/"가 포함된 키 지원)
     */
    @PostMapping("/key/**")
    public ResponseEntity<RedisLensDto.KeyDetailsResponse> getKey(
            @ModelAttribute RedisLensDto.ConnectionParams params,
            HttpServletRequest request) {

        String key = requireKey(request);
        return ResponseEntity.ok(RedisLensDto.KeyDetailsResponse.from(
                explorerService.getKeyDetails(toDescriptor(params), key)));
    }

    /**
     * 키 삭제
     */
    @DeleteMapping("/key/**")
    public ResponseEntity<RedisLensDto.StatusResponse> deleteKey(
            @ModelAttribute RedisLensDto.ConnectionParams params,
            HttpServletRequest request) {

        String key = requireKey(request);
        explorerService.deleteKey(toDescriptor(params), key);
        return ResponseEntity.ok(RedisLensDto.StatusResponse.ok("Successfully deleted key: " + key));
    }

    /**
     * 임의의 Redis 명령 실행
     */
    @PostMapping("/execute")
    public ResponseEntity<RedisLensDto.CommandResponse> execute(
            @ModelAttribute RedisLensDto.ConnectionParams params,
            @RequestBody RedisLensDto.CommandRequest request) {

        Object result = explorerService.executeCommand(
                toDescriptor(params), request.getCommand(), request.getArgs());
        return ResponseEntity.ok(RedisLensDto.CommandResponse.builder()
                .result(result)
                .build());
    }

    /**
     * 요청 파라미터와 설정 기본값으로 연결 정보 생성
     */
    private ConnectionDescriptor toDescriptor(RedisLensDto.ConnectionParams params) {
        RedisLensProperties.Connection defaults = properties.getConnection();
        return ConnectionDescriptor.of(
                params.getHost() != null ? params.getHost() : defaults.getHost(),
                params.getPort() != null ? params.getPort() : defaults.getPort(),
                params.getDb() != null ? params.getDb() : defaults.getDatabase(),
                params.getPassword() != null ? params.getPassword() : defaults.getPassword());
    }

    private static String requireKey(HttpServletRequest request) {
        String key = KeyPathResolver.resolveKey(request);
        if (key == null) {
            throw new InvalidRequestException("Key must not be empty");
        }
        return key;
    }
}
