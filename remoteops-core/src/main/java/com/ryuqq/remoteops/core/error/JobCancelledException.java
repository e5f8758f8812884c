package com.ryuqq.remoteops.core.error;

import com.ryuqq.remoteops.core.model.JobId;

/**
 * 원격 Job이 CANCELLED 상태로 종료됨.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class JobCancelledException extends RemoteOpsException {

    private final JobId jobId;

    public JobCancelledException(JobId jobId) {
        super(ErrorKind.CANCELLED, "Job cancelled: " + jobId);
        this.jobId = jobId;
    }

    public JobId getJobId() {
        return jobId;
    }
}
