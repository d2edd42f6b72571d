package com.example.redislens.domain.catalog;

import com.example.redislens.common.exception.InvalidRequestException;

/**
 * 키 카탈로그 설정을 담는 Value Object
 *
 * - 빌더 패턴 (플루언트 API)
 * - 매개변수 유효성 검사
 */
public class CatalogSettings {

    public static final long DEFAULT_SCAN_THRESHOLD = 10_000;
    public static final int DEFAULT_SCAN_BATCH_SIZE = 1_000;
    public static final long DEFAULT_MAX_SCAN_ITERATIONS = 1_000_000;

    private long scanThreshold = DEFAULT_SCAN_THRESHOLD;
    private int scanBatchSize = DEFAULT_SCAN_BATCH_SIZE;
    private long maxScanIterations = DEFAULT_MAX_SCAN_ITERATIONS;

    public static CatalogSettings defaults() {
        return new CatalogSettings();
    }

    /**
     * DBSIZE가 이 값을 초과하면 SCAN 사용 (같으면 KEYS)
     */
    public CatalogSettings scanThreshold(long scanThreshold) {
        if (scanThreshold < 0) {
            throw new InvalidRequestException("Scan threshold must not be negative: " + scanThreshold);
        }
        this.scanThreshold = scanThreshold;
        return this;
    }

    /**
     * 매개변수 유효성 검사
     */
    public CatalogSettings scanBatchSize(int scanBatchSize) {
        if (scanBatchSize <= 0) {
            throw new InvalidRequestException("Scan batch size must be positive: " + scanBatchSize);
        }
        this.scanBatchSize = scanBatchSize;
        return this;
    }

    /**
     * 매개변수 유효성 검사
     */
    public CatalogSettings maxScanIterations(long maxScanIterations) {
        if (maxScanIterations <= 0) {
            throw new InvalidRequestException("Max scan iterations must be positive: " + maxScanIterations);
        }
        this.maxScanIterations = maxScanIterations;
        return this;
    }

    public long getScanThreshold() { return scanThreshold; }
    public int getScanBatchSize() { return scanBatchSize; }
    public long getMaxScanIterations() { return maxScanIterations; }
}
