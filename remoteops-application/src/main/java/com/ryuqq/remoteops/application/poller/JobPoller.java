package com.ryuqq.remoteops.application.poller;

import com.ryuqq.remoteops.core.error.InvalidResponseException;
import com.ryuqq.remoteops.core.error.JobCancelledException;
import com.ryuqq.remoteops.core.error.JobFailedException;
import com.ryuqq.remoteops.core.error.JobTimeoutException;
import com.ryuqq.remoteops.core.model.JobId;
import com.ryuqq.remoteops.core.model.JobStatus;
import com.ryuqq.remoteops.core.spi.JobService;
import com.ryuqq.remoteops.core.statemachine.JobState;
import com.ryuqq.remoteops.core.statemachine.JobStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * 원격 Job 제출 후 종료 상태까지 폴링하는 Poller.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>JobService.submit() 정확히 1회 호출 (JobId 누락 시 InvalidResponseException)</li>
 *   <li>제출 수락 시각 + timeout으로 데드라인 계산</li>
 *   <li>즉시 첫 폴링 (지연 없음)</li>
 *   <li>SUCCEEDED: JobId 반환</li>
 *   <li>CANCELLED: JobCancelledException</li>
 *   <li>FAILED: JobFailedException (마지막 JobStatus 전체 보존)</li>
 *   <li>QUEUED, RUNNING, UNKNOWN: checkInterval 대기 후 재폴링</li>
 *   <li>데드라인 도달 시: 추가 폴링 없이 JobTimeoutException</li>
 * </ol>
 *
 * <p><strong>데드라인 규칙:</strong></p>
 * <ul>
 *   <li>대기 시간은 남은 예산을 넘지 않도록 잘립니다</li>
 *   <li>이미 진행 중인 폴링 요청은 중단하지 않으며, 그 응답이 종료 상태라면 그대로 반영합니다</li>
 *   <li>클라이언트 타임아웃은 원격 Job을 취소하지 않습니다</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 호출 스레드를 블로킹하는 동기 루프이며 폴링 요청은 겹치지 않습니다.
 * 인스턴스 자체는 상태가 없으므로 여러 스레드가 공유할 수 있습니다.</p>
 *
 * <p>응답 구조가 깨진 경우(상태 레코드 또는 상태 필드 누락)는 재시도해도 성공할 수 없으므로
 * 즉시 InvalidResponseException으로 종료합니다.</p>
 *
 * @param <P> 제출 파라미터 타입
 * @param <T> 결과 항목 타입
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class JobPoller<P, T> {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final JobService<P, T> service;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * 생성자 (시스템 시계, Thread.sleep 기반 대기).
     *
     * @param service 원격 Job 서비스
     * @throws IllegalArgumentException service가 null인 경우
     */
    public JobPoller(JobService<P, T> service) {
        this(service, Clock.systemUTC(), Sleeper.threadSleep());
    }

    /**
     * 생성자 (시계와 대기 전략 주입).
     *
     * @param service 원격 Job 서비스
     * @param clock 데드라인 계산용 시계
     * @param sleeper 폴링 간 대기 전략
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JobPoller(JobService<P, T> service, Clock clock, Sleeper sleeper) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.service = service;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Job 제출 후 종료 상태까지 대기.
     *
     * @param params 제출 파라미터
     * @param timeout 전체 대기 시간
     * @param checkInterval 폴링 간격
     * @return 성공한 Job의 ID
     * @throws InvalidResponseException 응답 구조가 깨진 경우
     * @throws JobFailedException Job이 FAILED로 끝난 경우
     * @throws JobCancelledException Job이 CANCELLED로 끝난 경우
     * @throws JobTimeoutException 데드라인 안에 종료 상태에 도달하지 못한 경우
     * @throws com.ryuqq.remoteops.core.error.TransportException 전송 실패 시 (그대로 전파)
     */
    public JobId submitAndWait(P params, Duration timeout, Duration checkInterval) {
        return submitAndWait(params, new PollConfig(timeout, checkInterval));
    }

    /**
     * Job 제출 후 종료 상태까지 대기.
     *
     * @param params 제출 파라미터
     * @param config 대기 설정
     * @return 성공한 Job의 ID
     * @see #submitAndWait(Object, Duration, Duration)
     */
    public JobId submitAndWait(P params, PollConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        JobHandle handle = submit(params);
        return awaitCompletion(handle.getJobId(), config, handle.getSubmittedAt());
    }

    /**
     * Job 제출만 수행 (대기 없음).
     *
     * @param params 제출 파라미터
     * @return 제출 핸들 (JobId + 수락 시각)
     * @throws InvalidResponseException 제출 응답에 JobId가 없는 경우
     */
    public JobHandle submit(P params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        JobId jobId = service.submit(params);
        if (jobId == null) {
            throw new InvalidResponseException("job ID is missing in the submission response");
        }
        Instant submittedAt = clock.instant();
        log.info("Job submitted: {}", jobId.getValue());
        return JobHandle.of(jobId, submittedAt);
    }

    /**
     * 이미 제출된 Job이 종료 상태에 도달할 때까지 대기.
     *
     * <p>데드라인은 이 메서드 호출 시점부터 계산됩니다.</p>
     *
     * @param jobId 대기할 Job ID
     * @param config 대기 설정
     * @return jobId (SUCCEEDED인 경우)
     */
    public JobId awaitCompletion(JobId jobId, PollConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return awaitCompletion(jobId, config, clock.instant());
    }

    private JobId awaitCompletion(JobId jobId, PollConfig config, Instant startedAt) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }

        Instant deadline = deadlineOf(startedAt, config.timeout());
        JobState observed = JobState.SUBMITTED;
        int polls = 0;

        while (true) {
            JobStatus status = service.pollStatus(jobId);
            polls++;
            JobState next = requireState(jobId, status);

            if (next != observed) {
                log.debug("Job {} state {} → {} (poll #{})", jobId.getValue(), observed, next, polls);
            }
            observed = JobStateTransition.transition(observed, next);

            switch (observed) {
                case SUCCEEDED -> {
                    log.info("Job {} succeeded after {} polls", jobId.getValue(), polls);
                    return jobId;
                }
                case CANCELLED -> {
                    log.warn("Job {} was cancelled remotely", jobId.getValue());
                    throw new JobCancelledException(jobId);
                }
                case FAILED -> {
                    log.warn("Job {} failed: {}", jobId.getValue(), status.payload());
                    throw new JobFailedException(status);
                }
                default -> {
                    // QUEUED, RUNNING, UNKNOWN: 계속 폴링
                }
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw timeout(jobId, config, polls);
            }

            sleep(min(config.checkInterval(), remaining));

            if (!clock.instant().isBefore(deadline)) {
                throw timeout(jobId, config, polls);
            }
        }
    }

    /**
     * 폴링 응답 검증.
     *
     * @return 응답의 상태 (non-null)
     * @throws InvalidResponseException Job 레코드 또는 상태 필드가 없는 경우
     */
    private JobState requireState(JobId jobId, JobStatus status) {
        if (status == null) {
            throw new InvalidResponseException("job record is missing for " + jobId.getValue());
        }
        if (!status.hasState()) {
            throw new InvalidResponseException("job state is missing for " + jobId.getValue());
        }
        return status.state();
    }

    private JobTimeoutException timeout(JobId jobId, PollConfig config, int polls) {
        log.warn("Job {} did not finish within {} ({} polls)", jobId.getValue(), config.timeout(), polls);
        return new JobTimeoutException(jobId, config.timeout());
    }

    /**
     * 데드라인 계산.
     *
     * <p>Instant 범위를 넘는 timeout은 Instant.MAX로 포화시킵니다 (사실상 무제한 대기).</p>
     */
    private static Instant deadlineOf(Instant startedAt, Duration timeout) {
        try {
            return startedAt.plus(timeout);
        } catch (DateTimeException | ArithmeticException e) {
            log.debug("Timeout {} exceeds the Instant range, deadline saturated to Instant.MAX", timeout);
            return Instant.MAX;
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * 폴링 간격 대기.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * IllegalStateException으로 래핑하여 던집니다.</p>
     */
    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Polling interrupted", e);
        }
    }
}
