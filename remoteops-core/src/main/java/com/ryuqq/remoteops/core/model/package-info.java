/**
 * Remote job domain model.
 *
 * <ul>
 *   <li>{@link com.ryuqq.remoteops.core.model.JobId} - Opaque job identifier assigned by the remote side</li>
 *   <li>{@link com.ryuqq.remoteops.core.model.JobStatus} - State discriminant plus diagnostic payload</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RemoteOps Team
 */
package com.ryuqq.remoteops.core.model;
