package com.ryuqq.remoteops.core.cache;

import java.util.Optional;

/**
 * 캐시 미스 시 호출되는 원격 조회.
 *
 * <p>값이 없으면 {@link Optional#empty()}를 반환합니다. 빈 결과는 캐시되지 않습니다.
 * 실패는 예외로 전파되며 캐시는 변경되지 않습니다.</p>
 *
 * <p><strong>호출 규약:</strong> 조회는 해당 키의 배타 구간 안에서 실행됩니다.</p>
 * <ul>
 *   <li>조회 안에서 같은 {@link TtlCache}를 다시 호출하면 안 됩니다 (재진입 시 교착 또는 IllegalStateException)</li>
 *   <li>느린 조회는 같은 해시 구간을 공유하는 다른 키의 조회도 잠시 막을 수 있습니다</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Lookup<K, V> {

    Optional<V> load(K key);
}
