package com.ryuqq.remoteops.core.cache;

import java.time.Duration;

/**
 * TTL 캐시 설정.
 *
 * @param ttl 엔트리 유효 기간 (양수)
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record CacheConfig(Duration ttl) {

    public CacheConfig {
        if (ttl == null) {
            throw new IllegalArgumentException("ttl cannot be null");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    public static CacheConfig ofTtl(Duration ttl) {
        return new CacheConfig(ttl);
    }
}
