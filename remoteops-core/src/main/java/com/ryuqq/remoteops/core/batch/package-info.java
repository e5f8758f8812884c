/**
 * Batch accumulators for ingestion-side calls.
 *
 * <ul>
 *   <li>{@link com.ryuqq.remoteops.core.batch.RecordBatchBuilder} - Size and count bounded stream records</li>
 *   <li>{@link com.ryuqq.remoteops.core.batch.MessageBatchBuilder} - Message queue batch enqueue</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RemoteOps Team
 */
package com.ryuqq.remoteops.core.batch;
