package com.ryuqq.remoteops.core.error;

/**
 * 원격 호출 자체의 실패 (네트워크, 프로토콜, 원격 서비스 오류).
 *
 * <p>SPI 구현체가 하부 클라이언트의 예외를 감싸서 던집니다. 원인 예외는 그대로 보존되며
 * 재시도 정책은 하부 전송 계층의 책임입니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class TransportException extends RemoteOpsException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
