package com.ryuqq.remoteops.core.cursor;

/**
 * 페이지 목록 조회의 연속 위치(continuation cursor).
 *
 * <p>세 가지 위치를 명시적으로 구분합니다:</p>
 * <ul>
 *   <li>{@link NotStarted}: 아직 아무 토큰도 발급되지 않음 (첫 페이지 요청)</li>
 *   <li>{@link Continue}: 다음 페이지가 남아 있음 (비어 있지 않은 토큰)</li>
 *   <li>{@link Exhausted}: 더 이상 페이지 없음</li>
 * </ul>
 *
 * <p>"토큰 없음"과 "소진됨"을 문자열의 비어 있음으로 겹쳐 표현하면 목록이 한 페이지로
 * 잘리는 버그가 생기므로, 세 상태를 타입으로 분리합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public sealed interface Cursor permits Cursor.NotStarted, Cursor.Continue, Cursor.Exhausted {

    /**
     * 시작 전 커서.
     *
     * @return NotStarted
     */
    static Cursor notStarted() {
        return NotStarted.INSTANCE;
    }

    /**
     * 다음 페이지 토큰을 가진 커서.
     *
     * @param token 비어 있지 않은 토큰
     * @return Continue
     * @throws IllegalArgumentException token이 null이거나 빈 문자열인 경우
     */
    static Cursor continueFrom(String token) {
        return new Continue(token);
    }

    /**
     * 소진된 커서.
     *
     * @return Exhausted
     */
    static Cursor exhausted() {
        return Exhausted.INSTANCE;
    }

    /**
     * 원격 응답의 다음 토큰을 커서로 변환.
     *
     * <p>토큰이 없거나(null) 비어 있으면 목록의 끝으로 간주합니다.</p>
     *
     * @param nextToken 원격 응답의 다음 토큰 (null 가능)
     * @return Continue 또는 Exhausted
     */
    static Cursor fromNextToken(String nextToken) {
        if (nextToken == null || nextToken.isEmpty()) {
            return exhausted();
        }
        return new Continue(nextToken);
    }

    /**
     * 소진 여부 확인.
     *
     * @return Exhausted이면 true
     */
    default boolean isExhausted() {
        return this instanceof Exhausted;
    }

    /**
     * 원격 요청에 실을 토큰 조회.
     *
     * @return Continue이면 토큰, 그 외에는 null
     */
    default String tokenOrNull() {
        return this instanceof Continue c ? c.token() : null;
    }

    /**
     * 시작 전 위치.
     */
    record NotStarted() implements Cursor {
        private static final NotStarted INSTANCE = new NotStarted();
    }

    /**
     * 다음 페이지 위치.
     *
     * @param token 원격 서비스가 발급한 토큰 (비어 있지 않음)
     */
    record Continue(String token) implements Cursor {
        public Continue {
            if (token == null || token.isEmpty()) {
                throw new IllegalArgumentException("token cannot be null or empty");
            }
        }
    }

    /**
     * 소진 위치.
     */
    record Exhausted() implements Cursor {
        private static final Exhausted INSTANCE = new Exhausted();
    }
}
