/**
 * Ingestion-side batch submission.
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteops.application.ingest;
