package com.ryuqq.remoteops.core.cursor;

import com.ryuqq.remoteops.core.error.RemoteOpsException;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 항목 단위 지연 스트림.
 *
 * <p>{@link PageStream}의 페이지를 순서대로 펼쳐 항목 시퀀스로 제공합니다.
 * 빈 페이지는 건너뛰며, 현재 페이지의 항목이 남아 있는 동안에는 원격 호출이 일어나지 않습니다.</p>
 *
 * <p><strong>오류 원소:</strong> 페이지 조회가 실패하면 해당 위치의 {@link #next()}가
 * 오류를 던지고, 이후 {@link #hasNext()}는 false를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CursorStream<Row> rows = CursorStream.of(cursor -> service.fetchPage(jobId, cursor));
 * rows.stream().forEach(row -> ...);
 * }</pre>
 *
 * @param <T> 항목 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class CursorStream<T> implements Iterator<T> {

    private final PageStream<T> pages;
    private Iterator<T> current = Collections.emptyIterator();

    /**
     * 생성자.
     *
     * @param pages 페이지 스트림
     * @throws IllegalArgumentException pages가 null인 경우
     */
    public CursorStream(PageStream<T> pages) {
        if (pages == null) {
            throw new IllegalArgumentException("pages cannot be null");
        }
        this.pages = pages;
    }

    /**
     * 처음부터 조회하는 CursorStream 생성.
     *
     * @param fetcher 페이지 조회 함수
     * @param <T> 항목 타입
     * @return CursorStream
     */
    public static <T> CursorStream<T> of(PageFetcher<T> fetcher) {
        return new CursorStream<>(new PageStream<>(fetcher));
    }

    /**
     * 오류 하나만 내보내고 끝나는 CursorStream 생성.
     *
     * @param error 전달할 오류
     * @param <T> 항목 타입
     * @return CursorStream
     */
    public static <T> CursorStream<T> failed(RemoteOpsException error) {
        return new CursorStream<>(PageStream.failed(error));
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (!pages.hasNext()) {
                return false;
            }
            if (pages.hasPendingError()) {
                return true;
            }
            current = pages.next().items().iterator();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items");
        }
        if (current.hasNext()) {
            return current.next();
        }
        // 남은 원소는 오류뿐: PageStream.next()가 던진다
        pages.next();
        throw new IllegalStateException("Expected a pending page error");
    }

    /**
     * java.util.stream 형태로 변환.
     *
     * <p>순차 스트림이며, 오류 원소는 종단 연산 중 예외로 전파됩니다.</p>
     *
     * @return 순차 Stream
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * 지금까지 수행한 원격 호출 횟수.
     *
     * @return fetch 호출 횟수
     */
    public int getFetchCount() {
        return pages.getFetchCount();
    }
}
