/**
 * In-memory BatchSink adapter that records submitted batches.
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteops.adapter.inmemory.sink;
