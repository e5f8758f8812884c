/**
 * Error taxonomy package.
 *
 * <p>All errors are unchecked and extend the sealed
 * {@link com.ryuqq.remoteops.core.error.RemoteOpsException}, each carrying an
 * {@link com.ryuqq.remoteops.core.error.ErrorKind}.</p>
 *
 * <h2>Propagation Policy</h2>
 * <ul>
 *   <li><strong>Local validation</strong> (ENTRY_TOO_LARGE, BATCH_FULL, INVALID_BATCH): raised synchronously,
 *       never reaches the transport</li>
 *   <li><strong>Transport and terminal job errors</strong>: propagate unchanged to the caller</li>
 *   <li><strong>No auto-retry:</strong> FAILED, CANCELLED and TIMEOUT require a fresh submission</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RemoteOps Team
 */
package com.ryuqq.remoteops.core.error;
