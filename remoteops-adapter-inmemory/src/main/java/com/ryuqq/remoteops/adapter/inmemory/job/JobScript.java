package com.ryuqq.remoteops.adapter.inmemory.job;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Scripted behaviour of one remote job served by {@link InMemoryJobService}.
 *
 * <p>Each status poll consumes the next entry of {@code remoteStates}; once the list is
 * exhausted the last entry is repeated. A {@code null} entry models a status response
 * whose state field is missing.</p>
 *
 * <p><strong>Fault injection:</strong> when {@code malformedPageIndex} is non-negative, the
 * fetch of that page (0-based) returns no result set.</p>
 *
 * @param remoteStates remote state strings returned by successive polls (at least one)
 * @param payload diagnostic payload attached to every status (may be null)
 * @param results result items served after the job succeeded
 * @param malformedPageIndex page index answered with a missing result set, or -1
 * @param <T> result item type
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record JobScript<T>(
    List<String> remoteStates,
    String payload,
    List<T> results,
    int malformedPageIndex
) {

    public JobScript {
        if (remoteStates == null || remoteStates.isEmpty()) {
            throw new IllegalArgumentException("remoteStates cannot be null or empty");
        }
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        remoteStates = Collections.unmodifiableList(new ArrayList<>(remoteStates));
        results = List.copyOf(results);
    }

    /**
     * Job passing through the given states and then succeeding with {@code results}.
     */
    public static <T> JobScript<T> succeeding(List<T> results, String... statesBefore) {
        return new JobScript<>(append(statesBefore, "SUCCEEDED"), null, results, -1);
    }

    /**
     * Job passing through the given states and then failing with {@code payload}.
     */
    public static <T> JobScript<T> failing(String payload, String... statesBefore) {
        return new JobScript<>(append(statesBefore, "FAILED"), payload, List.of(), -1);
    }

    /**
     * Job passing through the given states and then cancelled remotely.
     */
    public static <T> JobScript<T> cancelled(String... statesBefore) {
        return new JobScript<>(append(statesBefore, "CANCELLED"), null, List.of(), -1);
    }

    /**
     * Job that never leaves the given state.
     */
    public static <T> JobScript<T> stuck(String state) {
        return new JobScript<>(List.of(state), null, List.of(), -1);
    }

    /**
     * Same script with page {@code pageIndex} answered by a missing result set.
     */
    public JobScript<T> withMalformedPage(int pageIndex) {
        if (pageIndex < 0) {
            throw new IllegalArgumentException("pageIndex must be non-negative (current: " + pageIndex + ")");
        }
        return new JobScript<>(remoteStates, payload, results, pageIndex);
    }

    /**
     * Same script with a different diagnostic payload.
     */
    public JobScript<T> withPayload(String payload) {
        return new JobScript<>(remoteStates, payload, results, malformedPageIndex);
    }

    String stateAt(int pollIndex) {
        return remoteStates.get(Math.min(pollIndex, remoteStates.size() - 1));
    }

    private static List<String> append(String[] statesBefore, String terminal) {
        List<String> states = new ArrayList<>(Arrays.asList(statesBefore));
        states.add(terminal);
        return states;
    }
}
