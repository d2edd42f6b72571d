package com.example.redislens.domain.catalog;

import com.example.redislens.common.exception.InvalidRequestException;
import com.example.redislens.common.exception.KeyRetrievalException;
import com.example.redislens.domain.model.KeyListing;
import com.example.redislens.domain.model.ListingStrategyType;
import com.example.redislens.infrastructure.redis.KeyspaceClient;
import com.example.redislens.infrastructure.redis.ScanBatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * SCAN 커서를 반복해 전체 키를 모으는 전략
 *
 * 특징:
 * - 커서 "0"에서 시작, 서버가 커서 "0"을 돌려주면 종료
 * - 순회 내내 존재한 키는 최소 한 번 반환됨
 * - 순회 중 추가/삭제된 키는 포함될 수도 있고 아닐 수도 있음 (약한 일관성)
 * - 중복 키가 나올 수 있으며 제거하지 않음
 *
 * 트레이드오프:
 * - 장점: 서버를 블로킹하지 않음
 * - 단점: 왕복 횟수가 많아 느림
 */
@Slf4j
public class IncrementalScanStrategy implements KeyListingStrategy {

    private final int batchSizeHint;
    private final long maxIterations;

    public IncrementalScanStrategy(int batchSizeHint, long maxIterations) {
        if (batchSizeHint <= 0) {
            throw new InvalidRequestException("Batch size hint must be positive: " + batchSizeHint);
        }
        if (maxIterations <= 0) {
            throw new InvalidRequestException("Max iterations must be positive: " + maxIterations);
        }
        this.batchSizeHint = batchSizeHint;
        this.maxIterations = maxIterations;
    }

    @Override
    public KeyListing listKeys(KeyspaceClient client, String pattern) {
        List<String> keys = new ArrayList<>();
        String cursor = ScanBatch.INITIAL_CURSOR;
        long iterations = 0;

        while (true) {
            if (iterations >= maxIterations) {
                throw new KeyRetrievalException(
                        "SCAN did not complete within " + maxIterations + " iterations (pattern: " + pattern + ")");
            }

            ScanBatch batch = client.scanBatch(cursor, pattern, batchSizeHint);
            iterations++;

            if (batch == null || batch.getNextCursor() == null) {
                throw new KeyRetrievalException("Malformed SCAN reply at cursor " + cursor);
            }

            keys.addAll(batch.getKeys());

            if (batch.isFinished()) {
                break;
            }
            cursor = batch.getNextCursor();
        }

        if (log.isDebugEnabled()) {
            log.debug("SCAN finished - Pattern: {}, Iterations: {}, Keys: {}", pattern, iterations, keys.size());
        }

        return KeyListing.scanned(keys);
    }

    @Override
    public ListingStrategyType getType() {
        return ListingStrategyType.SCAN;
    }
}
