package com.ryuqq.remoteops.application.config;

import com.ryuqq.remoteops.application.poller.PollConfig;
import com.ryuqq.remoteops.core.batch.BatchLimits;
import com.ryuqq.remoteops.core.cache.CacheConfig;

import java.time.Duration;

/**
 * 호출자 계층의 기본 설정값.
 *
 * <p>코어는 기본값을 갖지 않습니다. 대상 원격 서비스에 맞게 값을 바꿔야 할 때는
 * 여기서 얻은 설정에 {@code withX(...)}를 적용합니다.</p>
 *
 * <ul>
 *   <li>레코드 배치: 단일 1,000,000 bytes, 전체 5,000,000 bytes, 500건</li>
 *   <li>메시지 배치: 최대 10건</li>
 *   <li>폴링: timeout 60초, checkInterval 1초</li>
 *   <li>캐시: TTL 60초</li>
 * </ul>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class ClientDefaults {

    public static final long RECORD_SINGLE_LIMIT = 1_000_000L;
    public static final long RECORD_TOTAL_LIMIT = 5_000_000L;
    public static final int RECORD_COUNT_LIMIT = 500;
    public static final int MESSAGE_BATCH_MAX_ENTRIES = 10;
    public static final Duration POLL_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration POLL_CHECK_INTERVAL = Duration.ofSeconds(1);
    public static final Duration CACHE_TTL = Duration.ofSeconds(60);

    private ClientDefaults() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static BatchLimits batchLimits() {
        return new BatchLimits(RECORD_SINGLE_LIMIT, RECORD_TOTAL_LIMIT, RECORD_COUNT_LIMIT);
    }

    public static PollConfig pollConfig() {
        return new PollConfig(POLL_TIMEOUT, POLL_CHECK_INTERVAL);
    }

    public static CacheConfig cacheConfig() {
        return CacheConfig.ofTtl(CACHE_TTL);
    }
}
