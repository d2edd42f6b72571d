package com.example.redislens.domain.catalog;

import com.example.redislens.common.exception.KeyEnumerationRejectedException;
import com.example.redislens.domain.model.KeyListing;
import com.example.redislens.domain.model.KeyPage;
import com.example.redislens.infrastructure.redis.KeyspaceClient;
import lombok.extern.slf4j.Slf4j;

/**
 * 키 카탈로그: 패턴에 매칭되는 키를 조회하고 페이지로 나눈다
 *
 * 조회 전략 결정:
 * 1. 패턴이 "*"이면 DBSIZE로 대략적인 키 개수 확인
 * 2. 개수가 임계값(기본 10,000)을 넘으면 SCAN
 * 3. 그 외에는 KEYS 먼저 시도
 * 4. 서버가 KEYS를 거부하면 SCAN으로 폴백 (호출자에게는 투명)
 *
 * 연결/프로토콜 오류는 그대로 전파하며, KEYS→SCAN 폴백 외의 재시도는 하지 않는다.
 * 연결 핸들은 매 호출 인자로 받으므로 이 객체에는 요청 간 공유 상태가 없다.
 */
@Slf4j
public class KeyCatalog {

    public static final String MATCH_ALL = "*";

    private final CatalogSettings settings;
    private final KeyListingStrategy directStrategy;
    private final KeyListingStrategy scanStrategy;

    public KeyCatalog(CatalogSettings settings) {
        this(settings,
                new DirectEnumerationStrategy(),
                new IncrementalScanStrategy(settings.getScanBatchSize(), settings.getMaxScanIterations()));
    }

    KeyCatalog(CatalogSettings settings, KeyListingStrategy directStrategy, KeyListingStrategy scanStrategy) {
        this.settings = settings;
        this.directStrategy = directStrategy;
        this.scanStrategy = scanStrategy;
    }

    /**
     * 패턴에 매칭되는 전체 키 조회
     *
     * @param client 요청 단위 연결 핸들
     * @param pattern glob 패턴 (비어 있으면 "*")
     */
    public KeyListing listKeys(KeyspaceClient client, String pattern) {
        String effectivePattern = normalizePattern(pattern);

        if (MATCH_ALL.equals(effectivePattern)) {
            long keyCount = client.approximateKeyCount();
            if (keyCount > settings.getScanThreshold()) {
                log.info("Large database detected ({} keys), using SCAN instead of KEYS", keyCount);
                return scanStrategy.listKeys(client, effectivePattern);
            }
        }

        try {
            return directStrategy.listKeys(client, effectivePattern);

        } catch (KeyEnumerationRejectedException e) {
            log.warn("KEYS command failed, falling back to SCAN: {}", e.getMessage());
            return scanStrategy.listKeys(client, effectivePattern);
        }
    }

    /**
     * 전체 키를 조회한 뒤 요청한 페이지만 잘라서 반환
     *
     * page/perPage는 Redis 호출 전에 검증한다.
     */
    public KeyPage getKeysPage(KeyspaceClient client, String pattern, int page, int perPage) {
        KeyPaginator.validate(page, perPage);

        KeyListing listing = listKeys(client, pattern);
        KeyPage keyPage = KeyPaginator.paginate(listing.getKeys(), page, perPage)
                .withStrategy(listing.getStrategy());

        if (log.isDebugEnabled()) {
            log.debug("Keys page - Pattern: {}, Page: {}/{}, Count: {}, Total: {}, Strategy: {}, BeyondLastPage: {}",
                    pattern, page, keyPage.getTotalPages(), keyPage.getCount(), keyPage.getTotal(),
                    listing.getStrategy(), keyPage.isBeyondLastPage());
        }

        return keyPage;
    }

    static String normalizePattern(String pattern) {
        return pattern == null || pattern.isBlank() ? MATCH_ALL : pattern;
    }
}
