/**
 * In-memory JobService adapter implementation package.
 *
 * <p>{@link com.ryuqq.remoteops.adapter.inmemory.job.InMemoryJobService} plays the remote side
 * of a long-running job: it assigns ids, answers status polls from a
 * {@link com.ryuqq.remoteops.adapter.inmemory.job.JobScript} and serves results page by page.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.remoteops.core.spi.JobService
 * @author RemoteOps Team
 * @since 1.0.0
 */
package com.ryuqq.remoteops.adapter.inmemory.job;
