package com.ryuqq.remoteops.testkit.contract;

import com.ryuqq.remoteops.adapter.inmemory.job.JobScript;
import com.ryuqq.remoteops.core.cursor.CursorStream;
import com.ryuqq.remoteops.core.error.InvalidResponseException;
import com.ryuqq.remoteops.core.error.JobFailedException;
import com.ryuqq.remoteops.core.error.JobTimeoutException;
import com.ryuqq.remoteops.core.model.JobId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the Result Streamer and Cursor Stream Adapter.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Three-page listing: concatenation in order, then end</li>
 *   <li>Malformed page: one error element, no further fetches</li>
 *   <li>Job not succeeded: single error element, no page fetched</li>
 * </ul>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
class StreamingContractTest extends AbstractContractTest {

    private static final JobId FIRST_JOB = JobId.of("job-1");

    @Test
    void testStreaming_ThreePages_YieldsAllRowsInOrder() {
        // Given: 5 rows, 2 per page → tokens "2" → "4" → exhausted
        givenJob(JobScript.succeeding(rows(5), "RUNNING"));

        // When
        CursorStream<String> stream = streamer.submitAndStream("SELECT *", pollConfig(30, 1));
        List<String> items = stream.stream().collect(Collectors.toList());

        // Then
        assertEquals(rows(5), items);
        assertFalse(stream.hasNext());
        assertFetchCount(FIRST_JOB, 3);
    }

    @Test
    void testStreaming_EmptyResult_SingleFetch() {
        // Given
        givenJob(JobScript.succeeding(List.of()));

        // When
        Drained<String> drained = drain(streamer.submitAndStream("SELECT *", pollConfig(30, 1)));

        // Then
        assertTrue(drained.items().isEmpty());
        assertNull(drained.errorOrNull());
        assertFetchCount(FIRST_JOB, 1);
    }

    @Test
    void testStreaming_MalformedPage_OneErrorThenEnds() {
        // Given: second page has no result set
        givenJob(JobScript.<String>succeeding(rows(6)).withMalformedPage(1));

        // When
        CursorStream<String> stream = streamer.submitAndStream("SELECT *", pollConfig(30, 1));
        Drained<String> drained = drain(stream);

        // Then
        assertEquals(List.of("row-1", "row-2"), drained.items());
        assertInstanceOf(InvalidResponseException.class, drained.errorOrNull());
        assertFalse(stream.hasNext());
        assertFetchCount(FIRST_JOB, 2);
    }

    @Test
    void testStreaming_FailedJob_SingleErrorNoFetch() {
        // Given
        givenJob(JobScript.failing("{\"reason\":\"denied\"}", "QUEUED"));

        // When
        Drained<String> drained = drain(streamer.submitAndStream("SELECT *", pollConfig(30, 1)));

        // Then
        assertTrue(drained.items().isEmpty());
        JobFailedException error = assertInstanceOf(JobFailedException.class, drained.errorOrNull());
        assertEquals("{\"reason\":\"denied\"}", error.getStatus().payload());
        assertFetchCount(FIRST_JOB, 0);
    }

    @Test
    void testStreaming_TimedOutJob_SingleErrorNoFetch() {
        // Given
        givenJob(JobScript.stuck("QUEUED"));

        // When
        Drained<String> drained = drain(streamer.submitAndStream("SELECT *", pollConfig(5, 1)));

        // Then
        assertInstanceOf(JobTimeoutException.class, drained.errorOrNull());
        assertFetchCount(FIRST_JOB, 0);
    }

    @Test
    void testStreaming_StreamIsForwardOnly() {
        // Given
        givenJob(JobScript.succeeding(rows(3)));
        CursorStream<String> stream = streamer.submitAndStream("SELECT *", pollConfig(30, 1));

        // When
        List<String> first = stream.stream().collect(Collectors.toList());
        List<String> second = stream.stream().collect(Collectors.toList());

        // Then
        assertEquals(rows(3), first);
        assertTrue(second.isEmpty());
        assertFetchCount(FIRST_JOB, 2);
    }
}
