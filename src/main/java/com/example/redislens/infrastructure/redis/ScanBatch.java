package com.example.redislens.infrastructure.redis;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * SCAN 한 번의 결과
 *
 * Redis 커서는 부호 없는 64비트 정수이므로 문자열로 보관한다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ScanBatch {

    public static final String INITIAL_CURSOR = "0";

    private final String nextCursor;
    private final List<String> keys;

    private ScanBatch(String nextCursor, List<String> keys) {
        this.nextCursor = nextCursor;
        this.keys = keys == null ? Collections.emptyList() : Collections.unmodifiableList(keys);
    }

    public static ScanBatch of(String nextCursor, List<String> keys) {
        return new ScanBatch(nextCursor, keys);
    }

    /**
     * 서버가 커서 0을 돌려주면 순회 종료
     */
    public boolean isFinished() {
        return INITIAL_CURSOR.equals(nextCursor);
    }
}
