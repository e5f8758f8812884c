package com.ryuqq.remoteops.core.batch;

import com.ryuqq.remoteops.core.error.BatchRejectedException;
import com.ryuqq.remoteops.core.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RecordBatchBuilder 테스트.
 *
 * <p>레코드 크기 = 데이터 길이 + 파티션 키 길이. 아래 테스트는 1바이트 키 "k"를 사용합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
class RecordBatchBuilderTest {

    private RecordBatchBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new RecordBatchBuilder(new BatchLimits(10, 20, 3));
    }

    private static BatchRecord recordOfSize(int size) {
        return BatchRecord.of(new byte[size - 1], "k", null);
    }

    @Test
    void 한도_시나리오_순서대로_검증() {
        // 10바이트: single_limit과 같으므로 거부
        assertThatThrownBy(() -> builder.add(recordOfSize(10)))
            .isInstanceOf(BatchRejectedException.class)
            .extracting(e -> ((BatchRejectedException) e).getKind())
            .isEqualTo(ErrorKind.ENTRY_TOO_LARGE);

        // 9바이트 두 개: 성공
        builder.add(recordOfSize(9));
        builder.add(recordOfSize(9));
        assertThat(builder.getTotalSize()).isEqualTo(18);

        // 세 번째 9바이트: 27 >= 20
        assertThatThrownBy(() -> builder.add(recordOfSize(9)))
            .isInstanceOf(BatchRejectedException.class)
            .extracting(e -> ((BatchRejectedException) e).getKind())
            .isEqualTo(ErrorKind.BATCH_FULL);

        // 1바이트: 19로 성공
        builder.add(recordOfSize(1));
        assertThat(builder.getTotalSize()).isEqualTo(19);

        // 1바이트 하나 더: count == record_limit
        assertThatThrownBy(() -> builder.add(recordOfSize(1)))
            .isInstanceOf(BatchRejectedException.class)
            .hasMessageContaining("record_limit: 3")
            .extracting(e -> ((BatchRejectedException) e).getKind())
            .isEqualTo(ErrorKind.BATCH_FULL);

        RecordBatch batch = builder.build();
        assertThat(batch.size()).isEqualTo(3);
        assertThat(batch.totalSize()).isEqualTo(19);
    }

    @Test
    void 너무_큰_레코드_거부는_상태를_바꾸지_않음() {
        // given
        builder.add(recordOfSize(5));

        // when
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> builder.add(recordOfSize(12)))
                .isInstanceOf(BatchRejectedException.class);
        }

        // then
        assertThat(builder.size()).isEqualTo(1);
        assertThat(builder.getTotalSize()).isEqualTo(5);
    }

    @Test
    void 가득_찬_배치_거부도_상태를_바꾸지_않음() {
        // given
        builder.add(recordOfSize(9));
        builder.add(recordOfSize(9));

        // when
        assertThatThrownBy(() -> builder.add(recordOfSize(3)))
            .isInstanceOf(BatchRejectedException.class);

        // then
        assertThat(builder.size()).isEqualTo(2);
        assertThat(builder.getTotalSize()).isEqualTo(18);
    }

    @Test
    void 무작위_추가에도_한도를_넘지_않음() {
        // given
        Random random = new Random(42);
        BatchLimits limits = new BatchLimits(50, 300, 12);

        for (int round = 0; round < 200; round++) {
            RecordBatchBuilder b = new RecordBatchBuilder(limits);

            // when
            for (int i = 0; i < 40; i++) {
                try {
                    b.add(recordOfSize(1 + random.nextInt(60)));
                } catch (BatchRejectedException e) {
                    assertThat(e.getKind().isLocalValidation()).isTrue();
                }
            }
            RecordBatch batch = b.build();

            // then
            assertThat(batch.totalSize()).isLessThan(limits.totalLimit());
            assertThat(batch.size()).isLessThanOrEqualTo(limits.recordLimit());
            assertThat(batch.records()).allMatch(r -> r.size() < limits.singleLimit());
        }
    }

    @Test
    void build_후_재사용_불가() {
        // given
        builder.add(recordOfSize(2));
        builder.build();

        // when & then
        assertThatThrownBy(() -> builder.add(recordOfSize(2)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already been built");
        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 파티션_키가_없으면_UUID_생성() {
        // when
        BatchRecord record = BatchRecord.of(new byte[]{1, 2, 3});

        // then
        assertThat(record.getPartitionKey()).hasSize(36);
        assertThat(record.size()).isEqualTo(3 + 36);
        assertThat(record.getExplicitHashKeyOrNull()).isNull();
    }

    @Test
    void 레코드_데이터는_방어적으로_복사됨() {
        // given
        byte[] data = {1, 2};
        BatchRecord record = BatchRecord.of(data, "key", "hash");

        // when
        data[0] = 9;
        record.getData()[1] = 9;

        // then
        assertThat(record.getData()).containsExactly(1, 2);
        assertThat(record.getExplicitHashKeyOrNull()).isEqualTo("hash");
    }

    @Test
    void 한도는_양수여야_함() {
        assertThatThrownBy(() -> new BatchLimits(0, 10, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("singleLimit must be positive");
        assertThatThrownBy(() -> new BatchLimits(10, 10, 1).withRecordLimit(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("recordLimit");
    }
}
