package com.ryuqq.remoteops.core.error;

import com.ryuqq.remoteops.core.model.JobId;
import com.ryuqq.remoteops.core.model.JobStatus;

/**
 * 원격 Job이 FAILED 상태로 종료됨.
 *
 * <p>진단을 위해 마지막으로 조회한 {@link JobStatus} 전체를 보존합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class JobFailedException extends RemoteOpsException {

    private final JobStatus status;

    /**
     * 생성자.
     *
     * @param status 실패 시점의 Job 상태 (payload 포함)
     * @throws IllegalArgumentException status가 null인 경우
     */
    public JobFailedException(JobStatus status) {
        super(ErrorKind.FAILED, describe(status));
        this.status = status;
    }

    private static String describe(JobStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return "Job failed: " + status.jobId() + " (payload: " + status.payload() + ")";
    }

    public JobId getJobId() {
        return status.jobId();
    }

    /**
     * 실패 시점의 상태 조회.
     *
     * @return 원격 상태 (payload 포함)
     */
    public JobStatus getStatus() {
        return status;
    }
}
