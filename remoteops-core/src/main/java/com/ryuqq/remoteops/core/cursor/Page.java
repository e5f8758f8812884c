package com.ryuqq.remoteops.core.cursor;

import java.util.List;

/**
 * 한 번의 페이지 조회 결과.
 *
 * @param items 페이지의 항목 (순서 보존, 빈 목록 가능)
 * @param next 다음 위치 (Continue 또는 Exhausted)
 * @param <T> 항목 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record Page<T>(List<T> items, Cursor next) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException items 또는 next가 null이거나 next가 NotStarted인 경우
     */
    public Page {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cursor cannot be null");
        }
        if (next instanceof Cursor.NotStarted) {
            throw new IllegalArgumentException("next cursor cannot be NotStarted");
        }
        items = List.copyOf(items);
    }

    /**
     * 원격 응답의 다음 토큰으로 Page 생성.
     *
     * @param items 항목
     * @param nextToken 다음 토큰 (null 또는 빈 문자열이면 마지막 페이지)
     * @param <T> 항목 타입
     * @return Page
     */
    public static <T> Page<T> of(List<T> items, String nextToken) {
        return new Page<>(items, Cursor.fromNextToken(nextToken));
    }

    /**
     * 마지막 페이지 생성.
     *
     * @param items 항목
     * @param <T> 항목 타입
     * @return next가 Exhausted인 Page
     */
    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, Cursor.exhausted());
    }

    public boolean isLast() {
        return next.isExhausted();
    }
}
