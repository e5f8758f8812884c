package com.ryuqq.remoteops.core.model;

import com.ryuqq.remoteops.core.statemachine.JobState;

/**
 * 원격 Job의 상태 조회 결과.
 *
 * <p>상태 판별값({@link JobState})과 진단용 불투명 페이로드를 함께 담습니다.
 * 실패한 Job의 경우 payload가 그대로 {@code JobFailedException}에 실려 호출자에게 전달됩니다.</p>
 *
 * <p><strong>state가 null인 경우:</strong> 원격 응답에 상태 필드가 없었음을 뜻합니다.
 * 폴러는 이를 잘못된 응답(Invalid)으로 처리하며 재시도하지 않습니다.</p>
 *
 * @param jobId Job ID
 * @param state 상태 (원격 응답에 상태가 없으면 null)
 * @param remoteState 원격 서비스가 보낸 원본 상태 문자열 (null 가능)
 * @param payload 진단용 페이로드 (null 가능)
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record JobStatus(
    JobId jobId,
    JobState state,
    String remoteState,
    String payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null이거나 state가 SUBMITTED인 경우
     */
    public JobStatus {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (state == JobState.SUBMITTED) {
            throw new IllegalArgumentException("SUBMITTED is a client-side state and cannot be reported remotely");
        }
    }

    /**
     * 원격 상태 문자열로부터 JobStatus 생성.
     *
     * <p>remoteState가 null이면 state도 null이 됩니다 (상태 필드 누락).</p>
     *
     * @param jobId Job ID
     * @param remoteState 원격 상태 문자열 (null 가능)
     * @param payload 진단용 페이로드 (null 가능)
     * @return JobStatus 인스턴스
     */
    public static JobStatus fromRemote(JobId jobId, String remoteState, String payload) {
        JobState state = remoteState == null ? null : JobState.fromRemote(remoteState);
        return new JobStatus(jobId, state, remoteState, payload);
    }

    /**
     * 상태만으로 JobStatus 생성.
     *
     * @param jobId Job ID
     * @param state 상태
     * @return JobStatus 인스턴스 (payload 없음)
     */
    public static JobStatus of(JobId jobId, JobState state) {
        return new JobStatus(jobId, state, state == null ? null : state.name(), null);
    }

    /**
     * 상태 필드가 존재하는지 확인.
     *
     * @return state가 non-null이면 true
     */
    public boolean hasState() {
        return state != null;
    }
}
