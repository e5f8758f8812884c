/**
 * Result streaming for jobs that have succeeded.
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteops.application.streamer;
