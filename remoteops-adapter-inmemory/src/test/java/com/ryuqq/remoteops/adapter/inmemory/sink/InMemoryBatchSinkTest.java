package com.ryuqq.remoteops.adapter.inmemory.sink;

import com.ryuqq.remoteops.core.batch.BatchAck;
import com.ryuqq.remoteops.core.error.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryBatchSink 테스트.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
class InMemoryBatchSinkTest {

    private InMemoryBatchSink<String> sink;

    @BeforeEach
    void setUp() {
        sink = new InMemoryBatchSink<>();
    }

    @Test
    void submit_배치를_순서대로_기록함() {
        // when
        BatchAck first = sink.submitBatch(List.of("a", "b"));
        sink.submitBatch(List.of("c"));

        // then
        assertThat(first).isEqualTo(BatchAck.allAccepted(2));
        assertThat(sink.getBatches()).containsExactly(List.of("a", "b"), List.of("c"));
        assertThat(sink.getEntries()).containsExactly("a", "b", "c");
        assertThat(sink.getBatchCount()).isEqualTo(2);
    }

    @Test
    void submit_거부된_엔트리는_실패_ID로_보고함() {
        // given
        sink.rejectWhen(entry -> entry.startsWith("x"), entry -> "id-" + entry);

        // when
        BatchAck ack = sink.submitBatch(List.of("a", "x1", "b"));

        // then
        assertThat(ack.accepted()).isEqualTo(2);
        assertThat(ack.failedIds()).containsExactly("id-x1");
        assertThat(sink.getEntries()).containsExactly("a", "b");
    }

    @Test
    void submit_주입된_실패는_한_번만_발생() {
        // given
        sink.failNext(new TransportException("throttled"));

        // when & then
        assertThatThrownBy(() -> sink.submitBatch(List.of("a")))
            .isInstanceOf(TransportException.class)
            .hasMessage("throttled");
        assertThat(sink.submitBatch(List.of("a")).accepted()).isEqualTo(1);
        assertThat(sink.getBatchCount()).isEqualTo(1);
    }

    @Test
    void submit_빈_배치는_원격이_거부함() {
        assertThatThrownBy(() -> sink.submitBatch(List.of()))
            .isInstanceOf(TransportException.class);
    }
}
