package com.ryuqq.remoteops.application.ingest;

import com.ryuqq.remoteops.core.batch.BatchAck;
import com.ryuqq.remoteops.core.batch.BatchLimits;
import com.ryuqq.remoteops.core.batch.BatchRecord;
import com.ryuqq.remoteops.core.batch.RecordBatch;
import com.ryuqq.remoteops.core.batch.RecordBatchBuilder;
import com.ryuqq.remoteops.core.error.BatchRejectedException;
import com.ryuqq.remoteops.core.error.ErrorKind;
import com.ryuqq.remoteops.core.spi.BatchSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 레코드 목록을 한도에 맞는 배치로 나누어 전송하는 Submitter.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>모든 레코드를 빈 배치 기준으로 사전 검증 (원격 호출 전에 EntryTooLarge 발생)</li>
 *   <li>RecordBatchBuilder에 순서대로 추가</li>
 *   <li>BatchFull이 보고되면 현재 배치를 전송하고 새 배치에서 이어서 추가</li>
 *   <li>마지막 배치 전송 후 ack 목록을 전송 순서대로 반환</li>
 * </ol>
 *
 * <p>전송 실패(TransportException)는 그대로 전파되며, 이미 전송된 배치는 되돌리지 않습니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class BatchSubmitter {

    private static final Logger log = LoggerFactory.getLogger(BatchSubmitter.class);

    private final BatchSink<BatchRecord> sink;
    private final BatchLimits limits;

    /**
     * 생성자.
     *
     * @param sink 배치 전송 대상
     * @param limits 배치 한도
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BatchSubmitter(BatchSink<BatchRecord> sink, BatchLimits limits) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        this.sink = sink;
        this.limits = limits;
    }

    /**
     * 레코드 전체 전송.
     *
     * @param records 전송할 레코드 (순서 유지)
     * @return 배치별 ack (전송 순서)
     * @throws BatchRejectedException 어떤 배치에도 들어갈 수 없는 레코드가 있는 경우 (원격 호출 없음)
     */
    public List<BatchAck> submitAll(List<BatchRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        for (int i = 0; i < records.size(); i++) {
            validateAlone(i, records.get(i));
        }

        List<BatchAck> acks = new ArrayList<>();
        RecordBatchBuilder builder = new RecordBatchBuilder(limits);
        for (BatchRecord record : records) {
            try {
                builder.add(record);
            } catch (BatchRejectedException e) {
                if (e.getKind() != ErrorKind.BATCH_FULL) {
                    throw e;
                }
                acks.add(flush(builder.build(), acks.size()));
                builder = new RecordBatchBuilder(limits);
                builder.add(record);
            }
        }
        if (!builder.isEmpty()) {
            acks.add(flush(builder.build(), acks.size()));
        }
        return acks;
    }

    public BatchLimits getLimits() {
        return limits;
    }

    /**
     * 빈 배치에도 들어갈 수 없는 레코드를 사전에 거부.
     */
    private void validateAlone(int index, BatchRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null (index: " + index + ")");
        }
        try {
            new RecordBatchBuilder(limits).add(record);
        } catch (BatchRejectedException e) {
            log.warn("Record #{} rejected before submission: {}", index, e.getMessage());
            throw e;
        }
    }

    private BatchAck flush(RecordBatch batch, int sequence) {
        BatchAck ack = sink.submitBatch(batch.records());
        log.info("Batch #{} submitted: {} records, {} bytes, {} failed",
            sequence, batch.size(), batch.totalSize(), ack == null ? 0 : ack.failedCount());
        return ack;
    }
}
