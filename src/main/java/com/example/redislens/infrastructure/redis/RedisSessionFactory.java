package com.example.redislens.infrastructure.redis;

import com.example.redislens.domain.model.ConnectionDescriptor;

/**
 * 연결 정보로 RedisSession을 여는 팩토리
 */
public interface RedisSessionFactory {

    /**
     * 연결을 열고 PING으로 사전 점검
     *
     * @param descriptor 접속할 서버/DB
     * @return 열린 세션
     * @throws com.example.redislens.common.exception.RedisConnectivityException 연결 또는 인증 실패
     */
    RedisSession open(ConnectionDescriptor descriptor);
}
