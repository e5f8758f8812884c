package com.ryuqq.remoteops.core.batch;

/**
 * 배치 한도 설정 (불변 record).
 *
 * <p>원격 서비스마다 한도가 다르므로 코어에는 기본값이 없습니다.
 * 호출 측 기본값은 {@code ClientDefaults}에 있습니다.</p>
 *
 * <p><strong>한도 의미:</strong></p>
 * <ul>
 *   <li>singleLimit: 단일 엔트리 크기는 이 값 미만이어야 함 (바이트)</li>
 *   <li>totalLimit: 배치 합계 크기는 이 값 미만이어야 함 (바이트)</li>
 *   <li>recordLimit: 배치 건수 최대값</li>
 * </ul>
 *
 * @param singleLimit 단일 엔트리 크기 한도 (양수)
 * @param totalLimit 합계 크기 한도 (양수)
 * @param recordLimit 최대 건수 (양수)
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record BatchLimits(
    long singleLimit,
    long totalLimit,
    int recordLimit
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchLimits {
        if (singleLimit <= 0) {
            throw new IllegalArgumentException(
                "singleLimit must be positive (current: " + singleLimit + ")"
            );
        }
        if (totalLimit <= 0) {
            throw new IllegalArgumentException(
                "totalLimit must be positive (current: " + totalLimit + ")"
            );
        }
        if (recordLimit <= 0) {
            throw new IllegalArgumentException(
                "recordLimit must be positive (current: " + recordLimit + ")"
            );
        }
    }

    /**
     * singleLimit만 변경한 새 인스턴스 생성.
     */
    public BatchLimits withSingleLimit(long singleLimit) {
        return new BatchLimits(singleLimit, totalLimit, recordLimit);
    }

    /**
     * totalLimit만 변경한 새 인스턴스 생성.
     */
    public BatchLimits withTotalLimit(long totalLimit) {
        return new BatchLimits(singleLimit, totalLimit, recordLimit);
    }

    /**
     * recordLimit만 변경한 새 인스턴스 생성.
     */
    public BatchLimits withRecordLimit(int recordLimit) {
        return new BatchLimits(singleLimit, totalLimit, recordLimit);
    }
}
