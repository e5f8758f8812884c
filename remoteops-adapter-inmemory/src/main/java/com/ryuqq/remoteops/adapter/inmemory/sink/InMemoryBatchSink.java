package com.ryuqq.remoteops.adapter.inmemory.sink;

import com.ryuqq.remoteops.core.batch.BatchAck;
import com.ryuqq.remoteops.core.error.RemoteOpsException;
import com.ryuqq.remoteops.core.error.TransportException;
import com.ryuqq.remoteops.core.spi.BatchSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link BatchSink} SPI that records every accepted batch.
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Batches kept in submission order ({@link CopyOnWriteArrayList})</li>
 *   <li>Per-entry rejection through a predicate, reported as failed ids in the {@link BatchAck}</li>
 *   <li>One-shot failure injection for the next submission</li>
 * </ul>
 *
 * @param <E> entry type
 * @author RemoteOps Team
 * @since 1.0.0
 */
public class InMemoryBatchSink<E> implements BatchSink<E> {

    private final List<List<E>> batches = new CopyOnWriteArrayList<>();
    private final AtomicReference<RemoteOpsException> nextFailure = new AtomicReference<>();
    private volatile Predicate<E> rejected = entry -> false;
    private volatile Function<E, String> idOf = String::valueOf;

    @Override
    public BatchAck submitBatch(List<E> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        RemoteOpsException failure = nextFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        if (entries.isEmpty()) {
            throw new TransportException("Empty batch rejected by remote");
        }

        List<E> accepted = new ArrayList<>();
        List<String> failedIds = new ArrayList<>();
        for (E entry : entries) {
            if (rejected.test(entry)) {
                failedIds.add(idOf.apply(entry));
            } else {
                accepted.add(entry);
            }
        }
        batches.add(List.copyOf(accepted));
        return new BatchAck(accepted.size(), failedIds);
    }

    /**
     * Makes the next {@link #submitBatch(List)} call fail with the given error.
     *
     * @param failure error to raise once
     */
    public void failNext(RemoteOpsException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        nextFailure.set(failure);
    }

    /**
     * Rejects entries matching the predicate; their ids are reported in the ack.
     *
     * @param predicate entries to reject
     * @param idExtractor id reported for a rejected entry
     */
    public void rejectWhen(Predicate<E> predicate, Function<E, String> idExtractor) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (idExtractor == null) {
            throw new IllegalArgumentException("idExtractor cannot be null");
        }
        this.rejected = predicate;
        this.idOf = idExtractor;
    }

    /**
     * Accepted entries of every batch, in submission order.
     */
    public List<List<E>> getBatches() {
        return List.copyOf(batches);
    }

    /**
     * All accepted entries flattened, in submission order.
     */
    public List<E> getEntries() {
        List<E> all = new ArrayList<>();
        batches.forEach(all::addAll);
        return all;
    }

    public int getBatchCount() {
        return batches.size();
    }

    public void clear() {
        batches.clear();
        nextFailure.set(null);
        rejected = entry -> false;
        idOf = String::valueOf;
    }
}
