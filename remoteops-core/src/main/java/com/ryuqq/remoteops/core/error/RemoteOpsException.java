package com.ryuqq.remoteops.core.error;

/**
 * RemoteOps 오류의 최상위 타입.
 *
 * <p>모든 하위 타입은 {@link ErrorKind}를 가지며, 호출자는 {@link #getKind()}로
 * 재제출 여부 등을 판단합니다. 코어는 실패/취소/타임아웃된 Job을 자동으로 재시도하지 않습니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public abstract sealed class RemoteOpsException extends RuntimeException
    permits TransportException, InvalidResponseException, JobCancelledException,
            JobFailedException, JobTimeoutException, BatchRejectedException {

    private final ErrorKind kind;

    protected RemoteOpsException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    protected RemoteOpsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * 오류 분류 조회.
     *
     * @return ErrorKind (non-null)
     */
    public ErrorKind getKind() {
        return kind;
    }
}
