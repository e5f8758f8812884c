package com.ryuqq.remoteops.core.model;

/**
 * 원격 Job의 식별자.
 *
 * <p>JobId는 원격 서비스가 제출 시점에 부여하는 불투명(opaque) 값입니다.
 * 클라이언트는 JobId를 생성하지 않으며, 제출 응답에서 받은 값을 그대로 사용합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이 제한 없음 (형식은 원격 서비스가 결정)</li>
 * </ul>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class JobId {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value 원격 서비스가 부여한 Job ID
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * JobId 값 조회.
     *
     * @return JobId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}
