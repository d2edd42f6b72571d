package com.example.redislens.domain.catalog;

import com.example.redislens.domain.model.KeyListing;
import com.example.redislens.domain.model.ListingStrategyType;
import com.example.redislens.infrastructure.redis.KeyspaceClient;

/**
 * KEYS pattern 한 번으로 전체 키를 조회
 *
 * 트레이드오프:
 * - 장점: 왕복 한 번, 서버 관점에서 원자적인 결과
 * - 단점: O(N) 블로킹 명령이라 큰 DB에서는 서버를 멈출 수 있음
 *
 * 서버가 KEYS를 거부하면 KeyEnumerationRejectedException이 그대로 전파된다.
 */
public class DirectEnumerationStrategy implements KeyListingStrategy {

    @Override
    public KeyListing listKeys(KeyspaceClient client, String pattern) {
        return KeyListing.direct(client.matchKeys(pattern));
    }

    @Override
    public ListingStrategyType getType() {
        return ListingStrategyType.DIRECT;
    }
}
