package com.ryuqq.remoteops.core.batch;

import java.util.List;

/**
 * 배치 제출에 대한 원격 응답.
 *
 * @param accepted 수락된 건수
 * @param failedIds 원격에서 거부된 엔트리 식별자 (빈 목록 가능)
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record BatchAck(int accepted, List<String> failedIds) {

    public BatchAck {
        if (accepted < 0) {
            throw new IllegalArgumentException("accepted must be non-negative (current: " + accepted + ")");
        }
        failedIds = failedIds == null ? List.of() : List.copyOf(failedIds);
    }

    /**
     * 전체 성공 응답 생성.
     */
    public static BatchAck allAccepted(int accepted) {
        return new BatchAck(accepted, List.of());
    }

    public int failedCount() {
        return failedIds.size();
    }

    public boolean hasFailures() {
        return !failedIds.isEmpty();
    }
}
