package com.example.redislens.domain.catalog;

import com.example.redislens.common.exception.InvalidRequestException;
import com.example.redislens.domain.model.KeyPage;

import java.util.Collections;
import java.util.List;

/**
 * 전체 키 목록을 페이지 단위로 자르는 순수 함수 모음
 *
 * 범위를 벗어난 페이지는 예외 없이 빈 페이지를 돌려준다.
 * 인덱스 계산은 long으로 하여 큰 page 값에서도 오버플로가 나지 않는다.
 */
public final class KeyPaginator {

    private KeyPaginator() { }

    public static KeyPage paginate(List<String> allKeys, int page, int perPage) {
        validate(page, perPage);

        List<String> keys = allKeys != null ? allKeys : Collections.emptyList();
        int total = keys.size();

        long start = (long) (page - 1) * perPage;
        long end = Math.min(start + perPage, total);

        List<String> slice = start >= total
                ? Collections.emptyList()
                : List.copyOf(keys.subList((int) start, (int) end));

        return KeyPage.builder()
                .keys(slice)
                .count(slice.size())
                .total(total)
                .page(page)
                .perPage(perPage)
                .totalPages(totalPages(total, perPage))
                .build();
    }

    /**
     * ceil(total / perPage), total이 0이면 0
     */
    public static long totalPages(long total, int perPage) {
        if (total <= 0) {
            return 0;
        }
        return (total + perPage - 1) / perPage;
    }

    public static void validate(int page, int perPage) {
        if (page < 1) {
            throw new InvalidRequestException("Page must be at least 1: " + page);
        }
        if (perPage < 1) {
            throw new InvalidRequestException("Per page must be at least 1: " + perPage);
        }
    }
}
