package com.ryuqq.remoteops.adapter.inmemory.job;

import com.ryuqq.remoteops.core.cursor.Cursor;
import com.ryuqq.remoteops.core.cursor.Page;
import com.ryuqq.remoteops.core.error.TransportException;
import com.ryuqq.remoteops.core.model.JobId;
import com.ryuqq.remoteops.core.model.JobStatus;
import com.ryuqq.remoteops.core.spi.JobService;
import com.ryuqq.remoteops.core.statemachine.JobState;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link JobService} SPI for testing and reference purposes.
 *
 * <p>Every submission takes the next queued {@link JobScript}; when none is queued the job
 * succeeds on its first poll with no results. Job ids are assigned here, the way a remote
 * service would assign them ({@code job-1}, {@code job-2}, ...).</p>
 *
 * <p><strong>Remote behaviour simulated:</strong></p>
 * <ul>
 *   <li><strong>pollStatus:</strong> advances the job's scripted state by one step;
 *       an unknown job id yields no record ({@code null})</li>
 *   <li><strong>fetchPage:</strong> serves {@code pageSize} results per page with the next offset
 *       as continuation token; the last page carries no token</li>
 *   <li><strong>fetchPage before success:</strong> rejected with {@link TransportException}</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> all state lives in concurrent collections; one instance
 * may serve several pollers at once.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryJobService&lt;String, String&gt; service = new InMemoryJobService&lt;&gt;(2);
 * service.enqueue(JobScript.succeeding(List.of("r1", "r2", "r3"), "QUEUED", "RUNNING"));
 *
 * JobId jobId = new JobPoller&lt;&gt;(service).submitAndWait("SELECT 1", timeout, interval);
 * </pre>
 *
 * @param <P> submission parameter type
 * @param <T> result item type
 * @author RemoteOps Team
 * @since 1.0.0
 */
public class InMemoryJobService<P, T> implements JobService<P, T> {

    private static final int DEFAULT_PAGE_SIZE = 100;

    /**
     * Scripts waiting for the next submissions, in order.
     */
    private final Queue<JobScript<T>> pendingScripts = new ConcurrentLinkedQueue<>();

    /**
     * Submitted jobs by id.
     */
    private final Map<JobId, ScriptedJob<T>> jobs = new ConcurrentHashMap<>();

    /**
     * Submission parameters in submission order.
     */
    private final List<P> submissions = new CopyOnWriteArrayList<>();

    private final AtomicInteger sequence = new AtomicInteger();
    private final int pageSize;

    /**
     * Creates a service serving 100 results per page.
     */
    public InMemoryJobService() {
        this(DEFAULT_PAGE_SIZE);
    }

    /**
     * Creates a service with a custom page size.
     *
     * @param pageSize results per page
     * @throws IllegalArgumentException if pageSize is not positive
     */
    public InMemoryJobService(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
        this.pageSize = pageSize;
    }

    /**
     * Queues the script used by the next submission.
     *
     * @param script job behaviour
     * @return this service, for chaining
     */
    public InMemoryJobService<P, T> enqueue(JobScript<T> script) {
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        pendingScripts.add(script);
        return this;
    }

    @Override
    public JobId submit(P params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        JobScript<T> script = pendingScripts.poll();
        if (script == null) {
            script = JobScript.succeeding(List.of());
        }
        JobId jobId = JobId.of("job-" + sequence.incrementAndGet());
        jobs.put(jobId, new ScriptedJob<>(script));
        submissions.add(params);
        return jobId;
    }

    @Override
    public JobStatus pollStatus(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        ScriptedJob<T> job = jobs.get(jobId);
        if (job == null) {
            return null;
        }
        String remoteState = job.script.stateAt(job.polls.getAndIncrement());
        job.lastState = remoteState;
        return JobStatus.fromRemote(jobId, remoteState, job.script.payload());
    }

    @Override
    public Page<T> fetchPage(JobId jobId, Cursor cursor) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (cursor == null || cursor.isExhausted()) {
            throw new IllegalArgumentException("cursor must be NotStarted or Continue (current: " + cursor + ")");
        }
        ScriptedJob<T> job = jobs.get(jobId);
        if (job == null) {
            throw new TransportException("Unknown job: " + jobId.getValue());
        }
        if (job.lastState == null || JobState.fromRemote(job.lastState) != JobState.SUCCEEDED) {
            throw new TransportException("Results are not available for " + jobId.getValue()
                + " (state: " + job.lastState + ")");
        }

        int offset = offsetOf(cursor);
        int pageIndex = offset / pageSize;
        job.fetches.incrementAndGet();
        if (pageIndex == job.script.malformedPageIndex()) {
            return null;
        }

        List<T> results = job.script.results();
        int end = Math.min(offset + pageSize, results.size());
        String nextToken = end < results.size() ? String.valueOf(end) : null;
        return Page.of(results.subList(Math.min(offset, end), end), nextToken);
    }

    private int offsetOf(Cursor cursor) {
        String token = cursor.tokenOrNull();
        if (token == null) {
            return 0;
        }
        try {
            int offset = Integer.parseInt(token);
            if (offset < 0) {
                throw new TransportException("Invalid continuation token: " + token);
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new TransportException("Invalid continuation token: " + token, e);
        }
    }

    /**
     * Number of submissions received.
     */
    public int getSubmitCount() {
        return submissions.size();
    }

    /**
     * Submission parameters in submission order.
     */
    public List<P> getSubmissions() {
        return List.copyOf(submissions);
    }

    /**
     * Number of status polls received for a job (0 for unknown jobs).
     */
    public int getPollCount(JobId jobId) {
        ScriptedJob<T> job = jobs.get(jobId);
        return job == null ? 0 : job.polls.get();
    }

    /**
     * Number of page fetches received for a job (0 for unknown jobs).
     */
    public int getFetchCount(JobId jobId) {
        ScriptedJob<T> job = jobs.get(jobId);
        return job == null ? 0 : job.fetches.get();
    }

    /**
     * Clears all jobs, queued scripts and counters.
     */
    public void clear() {
        pendingScripts.clear();
        jobs.clear();
        submissions.clear();
        sequence.set(0);
    }

    private static final class ScriptedJob<T> {

        private final JobScript<T> script;
        private final AtomicInteger polls = new AtomicInteger();
        private final AtomicInteger fetches = new AtomicInteger();
        private volatile String lastState;

        private ScriptedJob(JobScript<T> script) {
            this.script = script;
        }
    }
}
