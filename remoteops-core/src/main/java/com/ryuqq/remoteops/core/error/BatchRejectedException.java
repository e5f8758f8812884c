package com.ryuqq.remoteops.core.error;

/**
 * 로컬 배치 검증 실패.
 *
 * <p>원격 호출 전에 동기적으로 발생하며 전송 계층에 도달하지 않습니다.
 * BATCH_FULL인 경우 호출자는 새 배치를 시작해야 합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class BatchRejectedException extends RemoteOpsException {

    /**
     * 생성자.
     *
     * @param kind ENTRY_TOO_LARGE, BATCH_FULL 또는 INVALID_BATCH
     * @param message 상세 메시지
     * @throws IllegalArgumentException kind가 배치 검증 오류가 아닌 경우
     */
    public BatchRejectedException(ErrorKind kind, String message) {
        super(requireLocal(kind), message);
    }

    private static ErrorKind requireLocal(ErrorKind kind) {
        if (kind == null || !kind.isLocalValidation()) {
            throw new IllegalArgumentException("kind must be a batch validation kind (current: " + kind + ")");
        }
        return kind;
    }

    public static BatchRejectedException entryTooLarge(String message) {
        return new BatchRejectedException(ErrorKind.ENTRY_TOO_LARGE, message);
    }

    public static BatchRejectedException batchFull(String message) {
        return new BatchRejectedException(ErrorKind.BATCH_FULL, message);
    }

    public static BatchRejectedException invalidBatch(String message) {
        return new BatchRejectedException(ErrorKind.INVALID_BATCH, message);
    }
}
