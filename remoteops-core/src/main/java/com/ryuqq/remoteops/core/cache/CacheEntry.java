package com.ryuqq.remoteops.core.cache;

import java.time.Instant;

/**
 * 캐시 엔트리 (값, 만료 시각).
 *
 * @param value 캐시된 값
 * @param expiresAt 만료 시각 (이 시각 이후는 물론 같은 시각도 만료)
 * @param <V> 값 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
record CacheEntry<V>(V value, Instant expiresAt) {

    CacheEntry {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
    }

    /**
     * 유효 여부 확인 (엄격 비교: now &lt; expiresAt).
     *
     * @param now 기준 시각
     * @return 아직 만료되지 않았으면 true
     */
    boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
