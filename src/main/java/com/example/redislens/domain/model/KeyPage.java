package com.example.redislens.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 키 목록의 한 페이지를 나타내는 불변 Value Object
 *
 * - count: 이 페이지에 담긴 키 개수
 * - total: 패턴에 매칭된 전체 키 개수
 * - totalPages: ceil(total / perPage), total이 0이면 0
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class KeyPage {

    private final List<String> keys;
    private final int count;
    private final long total;
    private final int page;
    private final int perPage;
    private final long totalPages;
    private final ListingStrategyType strategy;

    /**
     * 요청한 페이지가 범위를 벗어났는지 확인
     */
    public boolean isBeyondLastPage() {
        return page > totalPages;
    }

    /**
     * 목록을 만든 전략 정보를 붙여 새 객체 생성
     */
    public KeyPage withStrategy(ListingStrategyType strategy) {
        return KeyPage.builder()
                .keys(this.keys)
                .count(this.count)
                .total(this.total)
                .page(this.page)
                .perPage(this.perPage)
                .totalPages(this.totalPages)
                .strategy(strategy)
                .build();
    }
}
