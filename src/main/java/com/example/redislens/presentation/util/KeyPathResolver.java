package com.example.redislens.presentation.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * {@code /api/key/**} 매핑에서 Redis 키를 추출
 *
 * Redis 키에는 {@code /}나 {@code :}가 흔하므로 단일 경로 변수 대신 와일드카드 나머지를 키로 사용한다.
 * 나머지 경로는 세그먼트로 나누지 않고 그대로 잘라내므로 앞/뒤/연속 {@code /}도 키의 일부로 유지된다.
 * 디코딩은 UriUtils를 사용하여 {@code +}를 공백으로 바꾸지 않는다.
 */
public final class KeyPathResolver {

    private static final String WILDCARD = "**";

    private KeyPathResolver() { }

    /**
     * @param request {@code /**} 패턴으로 매칭된 요청
     * @return 디코딩된 키, 추출할 수 없으면 null
     */
    public static String resolveKey(HttpServletRequest request) {
        String fullPath = (String) request.getAttribute(HandlerMapping.PATH_WITHIN_HANDLER_MAPPING_ATTRIBUTE);
        String bestPattern = (String) request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);

        if (fullPath == null || bestPattern == null) {
            return null;
        }

        int wildcard = bestPattern.indexOf(WILDCARD);
        String prefix = wildcard >= 0 ? bestPattern.substring(0, wildcard) : bestPattern;
        if (!fullPath.startsWith(prefix) || fullPath.length() == prefix.length()) {
            return null;
        }

        return UriUtils.decode(fullPath.substring(prefix.length()), StandardCharsets.UTF_8);
    }
}
