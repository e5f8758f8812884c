package com.ryuqq.remoteops.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * 비싼 단건 조회 결과를 일정 시간 동안 보관하는 메모이징 캐시.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>유효한 엔트리(now &lt; expiresAt)가 있으면 조회 함수를 호출하지 않고 반환</li>
 *   <li>없거나 만료됐으면 조회 함수 호출</li>
 *   <li>빈 결과: 아무것도 저장하지 않고 빈 값 반환 (기존 만료 엔트리도 유지)</li>
 *   <li>값 있음: (값, now + ttl) 저장 후 반환</li>
 *   <li>조회 실패: 예외 전파, 캐시 변경 없음</li>
 * </ol>
 *
 * <p><strong>키 단위 배타 갱신:</strong> 같은 키에 대한 갱신은 Caffeine의
 * {@code asMap().compute()} 안에서 수행되므로, 동시에 만료된 키에 접근한 호출자 중
 * 한 명만 조회 함수를 실행하고 나머지는 그 결과를 받습니다.
 * 따라서 조회 함수 안에서 같은 캐시를 다시 호출하면 안 되며, 느린 조회는 같은 해시 구간에 놓인
 * 다른 키의 갱신도 지연시킬 수 있습니다 ({@link Lookup} 호출 규약 참고).</p>
 *
 * <p>엔트리는 선제적으로 제거되지 않습니다 (크기 제한, Caffeine 만료 없음).
 * 만료 판단은 엔트리에 기록된 expiresAt만 사용합니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class TtlCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final Cache<K, CacheEntry<V>> entries;
    private final Duration ttl;
    private final Clock clock;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder emptyLoads = new LongAdder();

    /**
     * 생성자 (시스템 UTC 시계).
     *
     * @param config 캐시 설정
     */
    public TtlCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param config 캐시 설정
     * @param clock now 미지정 시 사용할 시계
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public TtlCache(CacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.ttl = config.ttl();
        this.clock = clock;
        this.entries = Caffeine.newBuilder().build();
    }

    /**
     * 현재 시각 기준 조회.
     *
     * @param key 키
     * @param lookup 캐시 미스 시 호출할 조회 함수
     * @return 값 (없으면 empty)
     */
    public Optional<V> get(K key, Lookup<K, V> lookup) {
        return get(key, lookup, clock.instant());
    }

    /**
     * 지정 시각 기준 조회.
     *
     * @param key 키
     * @param lookup 캐시 미스 시 호출할 조회 함수
     * @param now 만료 판단 기준 시각
     * @return 값 (없으면 empty)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Optional<V> get(K key, Lookup<K, V> lookup, Instant now) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (lookup == null) {
            throw new IllegalArgumentException("lookup cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }

        AtomicReference<V> result = new AtomicReference<>();
        entries.asMap().compute(key, (k, existing) -> {
            if (existing != null && existing.isLive(now)) {
                hits.increment();
                result.set(existing.value());
                return existing;
            }

            misses.increment();
            Optional<V> loaded = lookup.load(k);
            if (loaded == null || loaded.isEmpty()) {
                emptyLoads.increment();
                return existing;
            }

            V value = loaded.get();
            result.set(value);
            log.debug("Cache refreshed for key {} (expires in {})", k, ttl);
            return new CacheEntry<>(value, now.plus(ttl));
        });

        return Optional.ofNullable(result.get());
    }

    /**
     * 키 무효화.
     *
     * @param key 키
     */
    public void invalidate(K key) {
        entries.invalidate(key);
    }

    /**
     * 전체 무효화.
     */
    public void invalidateAll() {
        entries.invalidateAll();
    }

    /**
     * 저장된 엔트리 수 (만료된 엔트리 포함).
     *
     * @return 엔트리 수
     */
    public long size() {
        return entries.asMap().size();
    }

    /**
     * 통계 스냅샷 조회.
     *
     * @return CacheStats
     */
    public CacheStats getStats() {
        return new CacheStats(hits.sum(), misses.sum(), emptyLoads.sum(), size());
    }

    public Duration getTtl() {
        return ttl;
    }
}
