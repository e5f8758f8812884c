/**
 * Remote job state machine package.
 *
 * <p>This package defines the lifecycle states a poller can observe for a remote job
 * and the rules that govern transitions between them.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteops.core.statemachine.JobState} - Job lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.remoteops.core.statemachine.JobStateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * SUBMITTED → QUEUED | RUNNING | UNKNOWN | SUCCEEDED | FAILED | CANCELLED
 * QUEUED | RUNNING | UNKNOWN → any state except SUBMITTED
 *
 * Forbidden:
 * - SUCCEEDED → * (terminal state)
 * - FAILED → * (terminal state)
 * - CANCELLED → * (terminal state)
 * - * → SUBMITTED
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * JobState state = JobState.SUBMITTED;
 * state = JobStateTransition.transition(state, JobState.fromRemote("RUNNING"));
 * state = JobStateTransition.transition(state, JobState.SUCCEEDED);
 *
 * // This will throw IllegalStateException
 * JobStateTransition.validate(state, JobState.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author RemoteOps Team
 */
package com.ryuqq.remoteops.core.statemachine;
