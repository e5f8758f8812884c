package com.ryuqq.remoteops.core.statemachine;

import java.util.Locale;

/**
 * 원격 Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>SUBMITTED → QUEUED / RUNNING / UNKNOWN / 종료 상태 (첫 폴링)</li>
 *   <li>QUEUED, RUNNING, UNKNOWN → 임의의 비-SUBMITTED 상태</li>
 *   <li>SUCCEEDED, FAILED, CANCELLED → 전이 불가 (종료 상태)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * SUBMITTED
 *    │
 *    ▼ (첫 폴링)
 * QUEUED ⇄ RUNNING ⇄ UNKNOWN
 *    │
 *    ├─► SUCCEEDED (성공)
 *    ├─► FAILED    (실패, 진단 정보 보존)
 *    └─► CANCELLED (원격 취소)
 * </pre>
 *
 * <p>UNKNOWN은 원격 서비스가 알 수 없는 상태 문자열을 반환한 경우이며,
 * RUNNING과 동일하게 취급됩니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 제출 완료 (아직 폴링 전). 클라이언트 측 초기 상태.
     */
    SUBMITTED,

    /**
     * 원격 큐에서 대기 중.
     */
    QUEUED,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 성공 (종료).
     */
    SUCCEEDED,

    /**
     * 실패 (종료).
     */
    FAILED,

    /**
     * 취소됨 (종료).
     */
    CANCELLED,

    /**
     * 인식할 수 없는 원격 상태 (비종료, RUNNING과 동일하게 취급).
     */
    UNKNOWN;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(SUCCEEDED, FAILED, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return SUCCEEDED, FAILED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * 원격 서비스의 상태 문자열을 JobState로 변환.
     *
     * <p>대소문자를 구분하지 않으며, 인식할 수 없는 값은 {@link #UNKNOWN}으로 매핑됩니다.
     * SUBMITTED는 클라이언트 측 상태이므로 원격 값으로 받으면 UNKNOWN입니다.</p>
     *
     * @param remoteState 원격 상태 문자열 (null 불가)
     * @return 매핑된 JobState
     * @throws IllegalArgumentException remoteState가 null인 경우
     */
    public static JobState fromRemote(String remoteState) {
        if (remoteState == null) {
            throw new IllegalArgumentException("remoteState cannot be null");
        }
        return switch (remoteState.trim().toUpperCase(Locale.ROOT)) {
            case "QUEUED" -> QUEUED;
            case "RUNNING" -> RUNNING;
            case "SUCCEEDED" -> SUCCEEDED;
            case "FAILED" -> FAILED;
            case "CANCELLED", "CANCELED" -> CANCELLED;
            default -> UNKNOWN;
        };
    }
}
