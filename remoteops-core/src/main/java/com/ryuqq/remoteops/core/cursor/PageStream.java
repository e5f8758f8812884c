package com.ryuqq.remoteops.core.cursor;

import com.ryuqq.remoteops.core.error.InvalidResponseException;
import com.ryuqq.remoteops.core.error.RemoteOpsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 페이지 단위 지연(lazy) 스트림.
 *
 * <p>{@link PageFetcher}를 전진 전용 페이지 시퀀스로 변환합니다.
 * 각 인스턴스는 자신의 커서 상태만 앞으로 움직이며 재시작할 수 없습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>커서가 Exhausted이면 원격 호출 없이 종료</li>
 *   <li>그 외에는 {@code fetch(cursor)}를 정확히 한 번 호출</li>
 *   <li>정상 페이지: 페이지를 반환하고 커서를 page.next()로 이동</li>
 *   <li>잘못된 페이지(null) 또는 원격 오류: 해당 원소 자리에서 오류를 던지고 커서를 Exhausted로 고정</li>
 * </ol>
 *
 * <p>오류 후 강제 소진은 일시적 파싱 실패가 무한 재시도 루프로 바뀌는 것을 막습니다.</p>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다. 동일 인스턴스에 대한
 * 동시 pull은 호출자가 직렬화해야 합니다.</p>
 *
 * @param <T> 항목 타입
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class PageStream<T> implements Iterator<Page<T>> {

    private static final Logger log = LoggerFactory.getLogger(PageStream.class);

    private final PageFetcher<T> fetcher;
    private Cursor cursor;
    private Page<T> pendingPage;
    private RemoteOpsException pendingError;
    private int fetchCount;

    /**
     * 생성자 (처음부터 조회).
     *
     * @param fetcher 페이지 조회 함수
     * @throws IllegalArgumentException fetcher가 null인 경우
     */
    public PageStream(PageFetcher<T> fetcher) {
        this(fetcher, Cursor.notStarted());
    }

    /**
     * 생성자 (지정 위치부터 조회).
     *
     * @param fetcher 페이지 조회 함수
     * @param initialCursor 시작 커서
     * @throws IllegalArgumentException fetcher 또는 initialCursor가 null인 경우
     */
    public PageStream(PageFetcher<T> fetcher, Cursor initialCursor) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (initialCursor == null) {
            throw new IllegalArgumentException("initialCursor cannot be null");
        }
        this.fetcher = fetcher;
        this.cursor = initialCursor;
    }

    /**
     * 첫 원소가 오류인 스트림 생성.
     *
     * <p>오류를 한 번 던진 뒤 종료되며, 원격 호출은 일어나지 않습니다.</p>
     *
     * @param error 전달할 오류
     * @param <T> 항목 타입
     * @return 오류 하나만 가진 PageStream
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <T> PageStream<T> failed(RemoteOpsException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        PageStream<T> stream = new PageStream<>(cursor -> {
            throw new IllegalStateException("failed stream must not fetch");
        }, Cursor.exhausted());
        stream.pendingError = error;
        return stream;
    }

    @Override
    public boolean hasNext() {
        if (pendingPage != null || pendingError != null) {
            return true;
        }
        if (cursor.isExhausted()) {
            return false;
        }
        pull();
        return true;
    }

    @Override
    public Page<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more pages");
        }
        if (pendingError != null) {
            RemoteOpsException error = pendingError;
            pendingError = null;
            throw error;
        }
        Page<T> page = pendingPage;
        pendingPage = null;
        return page;
    }

    /**
     * 현재 커서 조회.
     *
     * @return 다음 pull이 사용할 커서
     */
    public Cursor getCursor() {
        return cursor;
    }

    /**
     * 다음 원소가 오류인지 확인.
     *
     * @return 아직 전달되지 않은 오류가 있으면 true
     */
    boolean hasPendingError() {
        return pendingError != null;
    }

    /**
     * 지금까지 수행한 원격 호출 횟수.
     *
     * @return fetch 호출 횟수
     */
    public int getFetchCount() {
        return fetchCount;
    }

    private void pull() {
        Cursor requested = cursor;
        fetchCount++;
        try {
            Page<T> page = fetcher.fetch(requested);
            if (page == null) {
                throw new InvalidResponseException("result set is missing (cursor: " + requested + ")");
            }
            cursor = page.next();
            pendingPage = page;
            log.debug("Fetched page #{} with {} items, next cursor {}", fetchCount, page.items().size(), cursor);
        } catch (RemoteOpsException e) {
            close(requested, e);
        } catch (RuntimeException e) {
            // 응답 해석 실패 등 분류되지 않은 오류도 재시도하지 않고 스트림을 닫는다
            close(requested, new InvalidResponseException(
                "page could not be read (cursor: " + requested + "): " + e.getMessage(), e));
        }
    }

    private void close(Cursor requested, RemoteOpsException error) {
        cursor = Cursor.exhausted();
        pendingError = error;
        log.warn("Page fetch failed at cursor {}, stream closed: {}", requested, error.getMessage());
    }
}
