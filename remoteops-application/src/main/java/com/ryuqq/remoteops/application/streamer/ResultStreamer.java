package com.ryuqq.remoteops.application.streamer;

import com.ryuqq.remoteops.application.poller.JobPoller;
import com.ryuqq.remoteops.application.poller.PollConfig;
import com.ryuqq.remoteops.core.cursor.CursorStream;
import com.ryuqq.remoteops.core.error.RemoteOpsException;
import com.ryuqq.remoteops.core.model.JobId;
import com.ryuqq.remoteops.core.spi.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Job 완료 대기와 결과 페이지 순회를 합성하는 Streamer.
 *
 * <p>Job이 SUCCEEDED에 도달한 것이 확인된 뒤에만 결과를 읽습니다.
 * 폴러가 실패(FAILED, CANCELLED, TIMEOUT, INVALID, TRANSPORT)하면
 * 그 오류 하나만 내보내고 끝나는 스트림을 반환하며, 결과 페이지는 조회하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CursorStream&lt;Row&gt; rows = streamer.submitAndStream(query, config);
 * while (rows.hasNext()) {
 *     Row row = rows.next(); // 폴러 오류는 여기서 던져짐
 * }
 * </pre>
 *
 * @param <P> 제출 파라미터 타입
 * @param <T> 결과 항목 타입
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class ResultStreamer<P, T> {

    private static final Logger log = LoggerFactory.getLogger(ResultStreamer.class);

    private final JobService<P, T> service;
    private final JobPoller<P, T> poller;

    /**
     * 생성자 (기본 JobPoller 사용).
     *
     * @param service 원격 Job 서비스
     */
    public ResultStreamer(JobService<P, T> service) {
        this(service, new JobPoller<>(service));
    }

    /**
     * 생성자.
     *
     * @param service 결과 페이지를 조회할 원격 Job 서비스
     * @param poller 완료 대기에 사용할 JobPoller
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResultStreamer(JobService<P, T> service, JobPoller<P, T> poller) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        this.service = service;
        this.poller = poller;
    }

    /**
     * Job 제출, 완료 대기 후 결과 스트림 반환.
     *
     * @param params 제출 파라미터
     * @param config 대기 설정
     * @return 결과 스트림 (폴러 오류 시 그 오류 하나만 담은 스트림)
     */
    public CursorStream<T> submitAndStream(P params, PollConfig config) {
        JobId jobId;
        try {
            jobId = poller.submitAndWait(params, config);
        } catch (RemoteOpsException e) {
            log.warn("Job did not succeed, no results will be fetched: {}", e.getMessage());
            return CursorStream.failed(e);
        }
        return stream(jobId);
    }

    /**
     * Job 제출, 완료 대기 후 결과 스트림 반환.
     *
     * @see #submitAndStream(Object, PollConfig)
     */
    public CursorStream<T> submitAndStream(P params, Duration timeout, Duration checkInterval) {
        return submitAndStream(params, new PollConfig(timeout, checkInterval));
    }

    /**
     * 이미 성공한 Job의 결과 스트림 반환.
     *
     * <p>첫 페이지는 {@code Cursor.notStarted()}로 조회합니다. 스트림은 지연 평가되므로
     * 첫 항목을 요청하기 전까지 원격 호출은 없습니다.</p>
     *
     * @param jobId 성공한 Job ID
     * @return 결과 스트림
     */
    public CursorStream<T> stream(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return CursorStream.of(cursor -> service.fetchPage(jobId, cursor));
    }
}
