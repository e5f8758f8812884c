package com.ryuqq.remoteops.core.error;

/**
 * 오류 분류.
 *
 * <p>원격 호출 실패, 응답 결함, Job 종료 상태, 클라이언트 측 타임아웃,
 * 로컬 배치 검증 실패를 구분합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 네트워크/프로토콜 실패 (원인 그대로 전달).
     */
    TRANSPORT,

    /**
     * 성공 응답이지만 필수 필드가 없거나 형식이 잘못됨. 재시도하지 않음.
     */
    INVALID,

    /**
     * 원격 Job이 취소 상태로 종료됨.
     */
    CANCELLED,

    /**
     * 원격 Job이 실패 상태로 종료됨.
     */
    FAILED,

    /**
     * 클라이언트 측 대기 기한 초과.
     */
    TIMEOUT,

    /**
     * 단일 엔트리가 허용 크기 이상.
     */
    ENTRY_TOO_LARGE,

    /**
     * 배치의 합계 크기 또는 건수 한도 도달.
     */
    BATCH_FULL,

    /**
     * 배치 구성 규칙 위반 (빈 배치, 건수 초과, 중복 ID).
     */
    INVALID_BATCH;

    /**
     * 원격 호출 전에 로컬에서 발생하는 검증 오류인지 확인.
     *
     * @return 배치 검증 오류이면 true
     */
    public boolean isLocalValidation() {
        return this == ENTRY_TOO_LARGE || this == BATCH_FULL || this == INVALID_BATCH;
    }
}
