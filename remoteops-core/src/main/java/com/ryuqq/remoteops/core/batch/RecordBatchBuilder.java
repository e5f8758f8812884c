package com.ryuqq.remoteops.core.batch;

import com.ryuqq.remoteops.core.error.BatchRejectedException;

import java.util.ArrayList;
import java.util.List;

/**
 * 크기/건수 한도를 지키는 레코드 배치 누적기.
 *
 * <p><strong>검증 규칙 (엔트리 크기 = 페이로드 길이 + 파티션 키 길이):</strong></p>
 * <ul>
 *   <li>엔트리 크기 &gt;= singleLimit → ENTRY_TOO_LARGE (추가하지 않음)</li>
 *   <li>현재 합계 + 엔트리 크기 &gt;= totalLimit → BATCH_FULL (추가하지 않음)</li>
 *   <li>현재 건수 &gt;= recordLimit → BATCH_FULL (추가하지 않음)</li>
 * </ul>
 *
 * <p>거부 시 상태는 변경되지 않습니다. BATCH_FULL을 받은 호출자는 {@link #build()}로
 * 현재 배치를 확정하고 새 누적기를 시작해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RecordBatchBuilder builder = new RecordBatchBuilder(limits);
 * builder.add(BatchRecord.of(bytes, "key-1", null));
 * RecordBatch batch = builder.build(); // 이후 builder 재사용 불가
 * </pre>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다. 하나의 호출자가 소유합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class RecordBatchBuilder {

    private final BatchLimits limits;
    private final List<BatchRecord> records = new ArrayList<>();
    private long totalSize;
    private boolean built;

    /**
     * 생성자.
     *
     * @param limits 배치 한도
     * @throws IllegalArgumentException limits가 null인 경우
     */
    public RecordBatchBuilder(BatchLimits limits) {
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        this.limits = limits;
    }

    /**
     * 레코드 추가.
     *
     * @param record 추가할 레코드
     * @throws IllegalArgumentException record가 null인 경우
     * @throws IllegalStateException build() 이후 호출된 경우
     * @throws BatchRejectedException 한도를 넘는 경우 (ENTRY_TOO_LARGE, BATCH_FULL)
     */
    public void add(BatchRecord record) {
        ensureNotBuilt();
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }

        long size = record.size();
        if (size >= limits.singleLimit()) {
            throw BatchRejectedException.entryTooLarge(String.format(
                "data size: %d, single_limit: %d", size, limits.singleLimit()));
        }

        if (totalSize + size >= limits.totalLimit() || records.size() >= limits.recordLimit()) {
            throw BatchRejectedException.batchFull(String.format(
                "total size: %d, total_limit: %d, entries: %d, record_limit: %d",
                totalSize + size, limits.totalLimit(), records.size() + 1, limits.recordLimit()));
        }

        records.add(record);
        totalSize += size;
    }

    /**
     * 페이로드만으로 레코드 추가 (파티션 키 자동 생성).
     *
     * @param data 페이로드
     */
    public void add(byte[] data) {
        add(BatchRecord.of(data));
    }

    /**
     * 배치 확정.
     *
     * <p>누적기를 소비합니다. 이후 add/build 호출은 IllegalStateException입니다.</p>
     *
     * @return 확정된 배치
     * @throws IllegalStateException 이미 build()된 경우
     */
    public RecordBatch build() {
        ensureNotBuilt();
        built = true;
        return new RecordBatch(records, totalSize);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public long getTotalSize() {
        return totalSize;
    }

    public BatchLimits getLimits() {
        return limits;
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("RecordBatchBuilder has already been built");
        }
    }
}
