package com.ryuqq.remoteops.core.error;

import com.ryuqq.remoteops.core.model.JobId;

import java.time.Duration;

/**
 * 종료 상태에 도달하기 전에 클라이언트 측 대기 기한이 지남.
 *
 * <p>원격 Job은 취소되지 않습니다. 필요한 경우 호출자가 별도로 취소해야 합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class JobTimeoutException extends RemoteOpsException {

    private final JobId jobId;
    private final Duration timeout;

    public JobTimeoutException(JobId jobId, Duration timeout) {
        super(ErrorKind.TIMEOUT, "Job " + jobId + " did not reach a terminal state within " + timeout);
        this.jobId = jobId;
        this.timeout = timeout;
    }

    public JobId getJobId() {
        return jobId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
