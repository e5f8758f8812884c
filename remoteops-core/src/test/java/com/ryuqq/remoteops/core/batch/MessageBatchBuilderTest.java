package com.ryuqq.remoteops.core.batch;

import com.ryuqq.remoteops.core.error.BatchRejectedException;
import com.ryuqq.remoteops.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageBatchBuilder 테스트.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
class MessageBatchBuilderTest {

    @Test
    void build_추가_순서대로_엔트리를_반환함() {
        // given
        MessageBatchBuilder builder = new MessageBatchBuilder(10)
            .add("1", "first")
            .add(MessageEntry.delayed("2", "second", 30))
            .add(MessageEntry.fifo("3", "third", "group-a", "dedup-3"));

        // when
        List<MessageEntry> entries = builder.build();

        // then
        assertThat(entries).extracting(MessageEntry::id).containsExactly("1", "2", "3");
        assertThat(entries.get(1).delaySeconds()).isEqualTo(30);
        assertThat(entries.get(2).messageGroupId()).isEqualTo("group-a");
    }

    @Test
    void build_빈_배치면_예외() {
        assertThatThrownBy(() -> new MessageBatchBuilder(10).build())
            .isInstanceOf(BatchRejectedException.class)
            .hasMessage("Batch cannot be empty")
            .extracting(e -> ((BatchRejectedException) e).getKind())
            .isEqualTo(ErrorKind.INVALID_BATCH);
    }

    @Test
    void build_엔트리_수_한도_초과면_예외() {
        // given
        MessageBatchBuilder builder = new MessageBatchBuilder(2);
        builder.add("1", "a").add("2", "b").add("3", "c");

        // when & then
        assertThatThrownBy(builder::build)
            .isInstanceOf(BatchRejectedException.class)
            .hasMessage("Batch contains 3 messages, maximum is 2");
    }

    @Test
    void build_중복_ID면_예외() {
        // given
        MessageBatchBuilder builder = new MessageBatchBuilder(10);
        builder.add("1", "a").add("2", "b").add("1", "c");

        // when & then
        assertThatThrownBy(builder::build)
            .isInstanceOf(BatchRejectedException.class)
            .hasMessage("Duplicate message ID: 1");
    }

    @Test
    void build_이후_재사용하면_예외() {
        // given
        MessageBatchBuilder builder = new MessageBatchBuilder(10).add("1", "a");
        builder.build();

        // when & then
        assertThatThrownBy(() -> builder.add("2", "b"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void FIFO_엔트리는_groupId가_필요함() {
        assertThatThrownBy(() -> MessageEntry.fifo("1", "a", " ", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("messageGroupId");
    }

    @Test
    void 엔트리_속성은_복사됨() {
        // given
        java.util.HashMap<String, String> attributes = new java.util.HashMap<>(Map.of("trace", "abc"));

        // when
        MessageEntry entry = MessageEntry.of("1", "a").withAttributes(attributes);
        attributes.put("other", "x");

        // then
        assertThat(entry.attributes()).containsOnlyKeys("trace");
    }

    @Test
    void BatchAck_실패_ID를_보고함() {
        assertThat(BatchAck.allAccepted(3).hasFailures()).isFalse();
        BatchAck ack = new BatchAck(2, List.of("7"));
        assertThat(ack.hasFailures()).isTrue();
        assertThat(ack.failedCount()).isEqualTo(1);
    }
}
