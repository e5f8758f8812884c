/**
 * Cursor-based pagination adapter package.
 *
 * <p>Turns a paged listing call into a lazy, forward-only sequence.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteops.core.cursor.Cursor} - Three-state continuation cursor</li>
 *   <li>{@link com.ryuqq.remoteops.core.cursor.PageStream} - One remote fetch per pull, page granularity</li>
 *   <li>{@link com.ryuqq.remoteops.core.cursor.CursorStream} - Item granularity, flattens pages</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * <pre>
 * NotStarted ──fetch──► Continue(token) ──fetch──► ... ──fetch──► Exhausted
 *
 * fetch error / malformed page ──► one error element ──► Exhausted
 * </pre>
 *
 * @since 1.0.0
 * @author RemoteOps Team
 */
package com.ryuqq.remoteops.core.cursor;
