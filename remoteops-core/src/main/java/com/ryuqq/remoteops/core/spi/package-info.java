/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capability surface the core consumes from a remote transport.
 * Adapter modules provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteops.core.spi.JobService} - submit, poll status, fetch result pages</li>
 *   <li>{@link com.ryuqq.remoteops.core.spi.BatchSink} - submit a validated batch</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Protocol Agnostic:</strong> No wire format or file format is fixed by the core</li>
 *   <li><strong>Explicit Configuration:</strong> Adapters receive endpoint and credentials at construction</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RemoteOps Team
 */
package com.ryuqq.remoteops.core.spi;
