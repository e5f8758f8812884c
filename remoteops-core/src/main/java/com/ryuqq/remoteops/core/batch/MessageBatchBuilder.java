package com.ryuqq.remoteops.core.batch;

import com.ryuqq.remoteops.core.error.BatchRejectedException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 메시지 큐 일괄 전송(batch enqueue)용 누적기.
 *
 * <p>엔트리는 자유롭게 추가하고, {@link #build()} 시점에 배치 규칙을 검증합니다:</p>
 * <ul>
 *   <li>빈 배치 불가</li>
 *   <li>건수 &lt;= maxEntries</li>
 *   <li>배치 내 ID 중복 불가</li>
 * </ul>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class MessageBatchBuilder {

    private final int maxEntries;
    private final List<MessageEntry> entries = new ArrayList<>();
    private boolean built;

    /**
     * 생성자.
     *
     * @param maxEntries 배치당 최대 건수 (양수)
     * @throws IllegalArgumentException maxEntries가 양수가 아닌 경우
     */
    public MessageBatchBuilder(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        this.maxEntries = maxEntries;
    }

    /**
     * 엔트리 추가.
     *
     * @param entry 메시지 엔트리
     * @return this (체이닝용)
     * @throws IllegalArgumentException entry가 null인 경우
     * @throws IllegalStateException build() 이후 호출된 경우
     */
    public MessageBatchBuilder add(MessageEntry entry) {
        ensureNotBuilt();
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.add(entry);
        return this;
    }

    /**
     * 기본 메시지 추가.
     */
    public MessageBatchBuilder add(String id, String body) {
        return add(MessageEntry.of(id, body));
    }

    /**
     * 배치 확정 및 검증.
     *
     * @return 검증된 엔트리 목록 (불변)
     * @throws BatchRejectedException 빈 배치, 건수 초과, ID 중복인 경우 (INVALID_BATCH)
     * @throws IllegalStateException 이미 build()된 경우
     */
    public List<MessageEntry> build() {
        ensureNotBuilt();
        built = true;

        if (entries.isEmpty()) {
            throw BatchRejectedException.invalidBatch("Batch cannot be empty");
        }
        if (entries.size() > maxEntries) {
            throw BatchRejectedException.invalidBatch(String.format(
                "Batch contains %d messages, maximum is %d", entries.size(), maxEntries));
        }

        Set<String> seenIds = new HashSet<>();
        for (MessageEntry entry : entries) {
            if (!seenIds.add(entry.id())) {
                throw BatchRejectedException.invalidBatch("Duplicate message ID: " + entry.id());
            }
        }
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("MessageBatchBuilder has already been built");
        }
    }
}
