package com.ryuqq.remoteops.application.poller;

import com.ryuqq.remoteops.core.model.JobId;

import java.time.Instant;

/**
 * 제출된 원격 Job의 핸들.
 *
 * <p>원격 서비스가 부여한 JobId와 제출이 수락된 시각을 담습니다.
 * 호출자는 이 핸들로 {@link JobPoller#awaitCompletion(JobId, PollConfig)}를 호출해
 * 나중에 완료를 기다릴 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class JobHandle {

    private final JobId jobId;
    private final Instant submittedAt;

    private JobHandle(JobId jobId, Instant submittedAt) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (submittedAt == null) {
            throw new IllegalArgumentException("submittedAt cannot be null");
        }
        this.jobId = jobId;
        this.submittedAt = submittedAt;
    }

    /**
     * JobHandle 생성.
     *
     * @param jobId 원격 Job ID
     * @param submittedAt 제출 수락 시각
     * @return JobHandle 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static JobHandle of(JobId jobId, Instant submittedAt) {
        return new JobHandle(jobId, submittedAt);
    }

    public JobId getJobId() {
        return jobId;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobHandle that = (JobHandle) o;
        return jobId.equals(that.jobId) && submittedAt.equals(that.submittedAt);
    }

    @Override
    public int hashCode() {
        return 31 * jobId.hashCode() + submittedAt.hashCode();
    }

    @Override
    public String toString() {
        return "JobHandle{jobId=" + jobId.getValue() + ", submittedAt=" + submittedAt + '}';
    }
}
