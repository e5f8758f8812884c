package com.ryuqq.remoteops.core.error;

/**
 * 성공 응답이지만 구조가 잘못된 경우 (필수 필드 누락 등).
 *
 * <p>구조적으로 깨진 응답은 재시도해도 성공할 수 없으므로 즉시 종료 오류로 취급합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class InvalidResponseException extends RemoteOpsException {

    public InvalidResponseException(String message) {
        super(ErrorKind.INVALID, message);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(ErrorKind.INVALID, message, cause);
    }
}
