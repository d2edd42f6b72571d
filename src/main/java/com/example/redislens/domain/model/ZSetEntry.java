package com.example.redislens.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Sorted Set의 member/score 쌍
 *
 * member와 score를 하나의 평탄한 배열로 섞지 않고 쌍 그대로 유지한다.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public class ZSetEntry {

    private final String member;
    private final double score;
}
