package com.ryuqq.remoteops.core.spi;

import com.ryuqq.remoteops.core.cursor.Cursor;
import com.ryuqq.remoteops.core.cursor.Page;
import com.ryuqq.remoteops.core.model.JobId;
import com.ryuqq.remoteops.core.model.JobStatus;

/**
 * Remote job service SPI.
 *
 * <p>A thin adapter over whatever RPC mechanism the target remote service uses. The core
 * depends only on these three calls and never on a wire format.</p>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>Network or protocol failures are raised as {@code TransportException}, cause preserved</li>
 *   <li>A structurally broken response may be raised as {@code InvalidResponseException},
 *       or reported by returning {@code null} / a status without state</li>
 *   <li>Implementations must not retry on behalf of the caller beyond their transport's own policy</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: one instance is shared by every poller, stream and cache</li>
 *   <li>Configuration (endpoint, credentials, timeouts) is injected at construction time;
 *       implementations must not mutate process-wide state</li>
 * </ul>
 *
 * @param <P> submission parameter type
 * @param <T> result item type
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public interface JobService<P, T> {

    /**
     * Submits a job.
     *
     * @param params submission parameters
     * @return the job id assigned by the remote side, or {@code null} if the response carried none
     */
    JobId submit(P params);

    /**
     * Fetches the current status of a job.
     *
     * @param jobId the job id
     * @return the status, or {@code null} if the response carried no job record
     */
    JobStatus pollStatus(JobId jobId);

    /**
     * Fetches one page of a succeeded job's results.
     *
     * @param jobId the job id
     * @param cursor {@code NotStarted} for the first page, {@code Continue} afterwards
     * @return the page, or {@code null} if the response carried no result set
     */
    Page<T> fetchPage(JobId jobId, Cursor cursor);
}
