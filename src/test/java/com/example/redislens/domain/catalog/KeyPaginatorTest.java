package com.example.redislens.domain.catalog;

import com.example.redislens.common.exception.InvalidRequestException;
import com.example.redislens.domain.model.KeyPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * KeyPaginator 테스트
 */
class KeyPaginatorTest {

    private static List<String> keys(int count) {
        List<String> keys = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            keys.add("key:" + i);
        }
        return keys;
    }

    @Test
    @DisplayName("25개 키, 페이지당 10개 - 1페이지는 10개, 전체 3페이지")
    void firstPageOfTwentyFiveKeysTest() {
        // when
        KeyPage page = KeyPaginator.paginate(keys(25), 1, 10);

        // then
        assertThat(page.getKeys()).hasSize(10).startsWith("key:0").endsWith("key:9");
        assertThat(page.getCount()).isEqualTo(10);
        assertThat(page.getTotal()).isEqualTo(25);
        assertThat(page.getTotalPages()).isEqualTo(3);
    }

    @Test
    @DisplayName("25개 키, 페이지당 10개 - 3페이지는 나머지 5개")
    void lastPartialPageTest() {
        // when
        KeyPage page = KeyPaginator.paginate(keys(25), 3, 10);

        // then
        assertThat(page.getKeys()).containsExactly("key:20", "key:21", "key:22", "key:23", "key:24");
        assertThat(page.getCount()).isEqualTo(5);
        assertThat(page.getTotalPages()).isEqualTo(3);
    }

    @Test
    @DisplayName("마지막 페이지를 넘어선 요청은 예외 없이 빈 페이지 반환")
    void pageBeyondLastTest() {
        // when
        KeyPage page = KeyPaginator.paginate(keys(25), 4, 10);

        // then
        assertThat(page.getKeys()).isEmpty();
        assertThat(page.getCount()).isZero();
        assertThat(page.getTotal()).isEqualTo(25);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getPage()).isEqualTo(4);
        assertThat(page.isBeyondLastPage()).isTrue();
    }

    @ParameterizedTest(name = "page={0}")
    @CsvSource({"1", "2", "100"})
    @DisplayName("키가 없으면 어떤 페이지든 빈 결과, total=0, totalPages=0")
    void emptyKeyspaceTest(int pageNumber) {
        // when
        KeyPage page = KeyPaginator.paginate(List.of(), pageNumber, 10);

        // then
        assertThat(page.getKeys()).isEmpty();
        assertThat(page.getTotal()).isZero();
        assertThat(page.getTotalPages()).isZero();
    }

    @Test
    @DisplayName("null 키 목록은 빈 목록으로 취급")
    void nullKeysTest() {
        // when
        KeyPage page = KeyPaginator.paginate(null, 1, 10);

        // then
        assertThat(page.getKeys()).isEmpty();
        assertThat(page.getTotalPages()).isZero();
    }

    @Test
    @DisplayName("totalPages는 total이 0일 때만 0이고 그 외에는 ceil(total / perPage)")
    void totalPagesPropertyTest() {
        for (int total = 0; total <= 60; total++) {
            for (int perPage = 1; perPage <= 13; perPage++) {
                long totalPages = KeyPaginator.totalPages(total, perPage);

                if (total == 0) {
                    assertThat(totalPages).isZero();
                } else {
                    assertThat(totalPages).isEqualTo((long) Math.ceil((double) total / perPage));
                }
            }
        }
    }

    @Test
    @DisplayName("페이지 크기는 min(perPage, max(0, total - (page-1)*perPage))")
    void sliceLengthPropertyTest() {
        for (int total = 0; total <= 30; total++) {
            List<String> all = keys(total);
            for (int perPage = 1; perPage <= 7; perPage++) {
                for (int page = 1; page <= 8; page++) {
                    KeyPage result = KeyPaginator.paginate(all, page, perPage);

                    int expected = Math.min(perPage, Math.max(0, total - (page - 1) * perPage));
                    assertThat(result.getKeys()).hasSize(expected);
                    assertThat(result.getCount()).isEqualTo(expected);
                }
            }
        }
    }

    @Test
    @DisplayName("아주 큰 페이지 번호도 오버플로 없이 빈 페이지 반환")
    void hugePageNumberTest() {
        // when
        KeyPage page = KeyPaginator.paginate(keys(5), Integer.MAX_VALUE, Integer.MAX_VALUE);

        // then
        assertThat(page.getKeys()).isEmpty();
        assertThat(page.getTotalPages()).isEqualTo(1);
    }

    @Test
    @DisplayName("페이지 결과는 원본 목록 변경에 영향받지 않음")
    void sliceIsDetachedTest() {
        // given
        List<String> all = keys(5);
        KeyPage page = KeyPaginator.paginate(all, 1, 3);

        // when
        all.set(0, "changed");

        // then
        assertThat(page.getKeys()).containsExactly("key:0", "key:1", "key:2");
    }

    @Test
    @DisplayName("page가 1보다 작으면 InvalidRequestException 발생")
    void invalidPageTest() {
        assertThatThrownBy(() -> KeyPaginator.paginate(keys(5), 0, 10))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("Page must be at least 1");
    }

    @Test
    @DisplayName("perPage가 1보다 작으면 InvalidRequestException 발생")
    void invalidPerPageTest() {
        assertThatThrownBy(() -> KeyPaginator.paginate(keys(5), 1, 0))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("Per page must be at least 1");
    }
}
