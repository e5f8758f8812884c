package com.ryuqq.remoteops.core.cursor;

/**
 * 커서 위치에서 한 페이지를 가져오는 원격 호출.
 *
 * <p>구현체는 전송 실패 시 {@code TransportException}을, 결과 집합이 없는 등
 * 형식이 잘못된 응답에는 {@code InvalidResponseException}을 던지거나 null을 반환합니다.</p>
 *
 * @param <T> 항목 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * 페이지 조회.
     *
     * @param cursor 조회 위치 (NotStarted 또는 Continue, Exhausted는 전달되지 않음)
     * @return 조회된 페이지
     */
    Page<T> fetch(Cursor cursor);
}
