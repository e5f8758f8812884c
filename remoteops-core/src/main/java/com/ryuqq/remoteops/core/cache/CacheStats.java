package com.ryuqq.remoteops.core.cache;

/**
 * TTL 캐시 통계 스냅샷.
 *
 * @param hitCount 유효 엔트리로 응답한 횟수
 * @param missCount 조회 함수를 호출한 횟수
 * @param emptyLoadCount 조회 함수가 빈 결과를 반환한 횟수
 * @param size 현재 엔트리 수 (만료된 엔트리 포함)
 */
public record CacheStats(long hitCount, long missCount, long emptyLoadCount, long size) {
}
