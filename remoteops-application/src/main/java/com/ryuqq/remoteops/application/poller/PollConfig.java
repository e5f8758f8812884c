package com.ryuqq.remoteops.application.poller;

import java.time.Duration;

/**
 * JobPoller 대기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeout: 제출 수락 시점부터 종료 상태까지 허용되는 전체 대기 시간</li>
 *   <li>checkInterval: 비종료 상태를 관찰한 뒤 다음 폴링까지의 간격</li>
 * </ul>
 *
 * <p>기본값은 코어가 아닌 {@code ClientDefaults}에서 제공합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 * @param timeout 전체 대기 시간 (양수여야 함)
 * @param checkInterval 폴링 간격 (양수여야 함)
 */
public record PollConfig(
    Duration timeout,
    Duration checkInterval
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollConfig {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (checkInterval == null) {
            throw new IllegalArgumentException("checkInterval cannot be null");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(
                "timeout must be positive (current: " + timeout + ")"
            );
        }
        if (checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException(
                "checkInterval must be positive (current: " + checkInterval + ")"
            );
        }
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public PollConfig withTimeout(Duration timeout) {
        return new PollConfig(timeout, checkInterval);
    }

    /**
     * checkInterval만 변경한 새 인스턴스 생성.
     */
    public PollConfig withCheckInterval(Duration checkInterval) {
        return new PollConfig(timeout, checkInterval);
    }
}
