package com.ryuqq.remoteops.core.spi;

import com.ryuqq.remoteops.core.batch.BatchAck;

import java.util.List;

/**
 * Batch submission SPI.
 *
 * <p>Receives entries that already passed local batch validation. Network failures are
 * raised as {@code TransportException}.</p>
 *
 * @param <E> entry type
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public interface BatchSink<E> {

    /**
     * Submits one batch.
     *
     * @param entries validated entries, in order
     * @return the remote acknowledgement
     */
    BatchAck submitBatch(List<E> entries);
}
