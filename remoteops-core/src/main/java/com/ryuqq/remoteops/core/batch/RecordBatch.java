package com.ryuqq.remoteops.core.batch;

import java.util.List;

/**
 * 확정된 레코드 배치 (불변).
 *
 * <p>{@link RecordBatchBuilder#build()}로만 생성되며, 한 번의 제출 호출에서 소비됩니다.</p>
 *
 * @param records 레코드 (추가 순서 보존)
 * @param totalSize 엔트리 크기 합계
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record RecordBatch(List<BatchRecord> records, long totalSize) {

    public RecordBatch {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        if (totalSize < 0) {
            throw new IllegalArgumentException("totalSize must be non-negative (current: " + totalSize + ")");
        }
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
