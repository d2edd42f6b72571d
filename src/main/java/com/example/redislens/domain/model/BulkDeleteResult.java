package com.example.redislens.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 여러 키 삭제 결과
 *
 * 키 하나가 실패해도 나머지는 계속 삭제하고 실패 사유를 errors에 모은다.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class BulkDeleteResult {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_PARTIAL = "partial";

    private final int deletedCount;
    private final int totalCount;
    @Singular
    private final List<String> errors;

    public String getStatus() {
        return errors.isEmpty() ? STATUS_OK : STATUS_PARTIAL;
    }
}
