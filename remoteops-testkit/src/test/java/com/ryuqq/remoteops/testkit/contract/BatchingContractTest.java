package com.ryuqq.remoteops.testkit.contract;

import com.ryuqq.remoteops.adapter.inmemory.sink.InMemoryBatchSink;
import com.ryuqq.remoteops.application.config.ClientDefaults;
import com.ryuqq.remoteops.application.ingest.BatchSubmitter;
import com.ryuqq.remoteops.core.batch.BatchAck;
import com.ryuqq.remoteops.core.batch.BatchLimits;
import com.ryuqq.remoteops.core.batch.BatchRecord;
import com.ryuqq.remoteops.core.batch.MessageBatchBuilder;
import com.ryuqq.remoteops.core.batch.MessageEntry;
import com.ryuqq.remoteops.core.error.BatchRejectedException;
import com.ryuqq.remoteops.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for batch submission over the in-memory sink.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
class BatchingContractTest extends AbstractContractTest {

    @Test
    void testBatching_DefaultLimits_SplitsByRecordCount() {
        // Given: 1,200 small records against the 500-record default
        BatchSubmitter submitter = new BatchSubmitter(sink, ClientDefaults.batchLimits());
        List<BatchRecord> records = new ArrayList<>();
        for (int i = 0; i < 1200; i++) {
            records.add(BatchRecord.of("event-" + i, "user-" + (i % 7)));
        }

        // When
        List<BatchAck> acks = submitter.submitAll(records);

        // Then
        assertEquals(3, sink.getBatchCount());
        assertEquals(List.of(500, 500, 200),
                sink.getBatches().stream().map(List::size).collect(java.util.stream.Collectors.toList()));
        assertEquals(records, sink.getEntries());
        assertEquals(1200, acks.stream().mapToInt(BatchAck::accepted).sum());
    }

    @Test
    void testBatching_EveryBatchStaysUnderLimits() {
        // Given
        BatchLimits limits = new BatchLimits(100, 250, 4);
        BatchSubmitter submitter = new BatchSubmitter(sink, limits);
        List<BatchRecord> records = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            records.add(BatchRecord.of(new byte[(i * 37) % 90], "k" + i, null));
        }

        // When
        submitter.submitAll(records);

        // Then
        assertEquals(records, sink.getEntries());
        for (List<BatchRecord> batch : sink.getBatches()) {
            long total = batch.stream().mapToLong(BatchRecord::size).sum();
            assertTrue(total < limits.totalLimit(), "batch total " + total);
            assertTrue(batch.size() <= limits.recordLimit(), "batch size " + batch.size());
        }
    }

    @Test
    void testBatching_OversizedRecord_NeverReachesRemote() {
        // Given
        BatchSubmitter submitter = new BatchSubmitter(sink, new BatchLimits(10, 100, 10));

        // When
        BatchRejectedException exception = assertThrows(BatchRejectedException.class,
                () -> submitter.submitAll(List.of(BatchRecord.of("ok", "k"), BatchRecord.of("way too large", "k"))));

        // Then
        assertEquals(ErrorKind.ENTRY_TOO_LARGE, exception.getKind());
        assertEquals(0, sink.getBatchCount());
    }

    @Test
    void testBatching_MessageBatch_SubmittedAfterValidation() {
        // Given
        InMemoryBatchSink<MessageEntry> queue = new InMemoryBatchSink<>();
        queue.rejectWhen(entry -> entry.body().isEmpty(), MessageEntry::id);
        List<MessageEntry> entries = new MessageBatchBuilder(ClientDefaults.MESSAGE_BATCH_MAX_ENTRIES)
                .add("m-1", "hello")
                .add(MessageEntry.fifo("m-2", "", "orders", "dedup-2"))
                .add(MessageEntry.delayed("m-3", "later", 15))
                .build();

        // When
        BatchAck ack = queue.submitBatch(entries);

        // Then
        assertEquals(2, ack.accepted());
        assertEquals(List.of("m-2"), ack.failedIds());
    }

    @Test
    void testBatching_MessageBatchOverLimit_RejectedLocally() {
        // Given
        MessageBatchBuilder builder = new MessageBatchBuilder(ClientDefaults.MESSAGE_BATCH_MAX_ENTRIES);
        for (int i = 0; i < 11; i++) {
            builder.add("m-" + i, "body");
        }

        // When
        BatchRejectedException exception = assertThrows(BatchRejectedException.class, builder::build);

        // Then
        assertEquals(ErrorKind.INVALID_BATCH, exception.getKind());
        assertEquals("Batch contains 11 messages, maximum is 10", exception.getMessage());
    }
}
