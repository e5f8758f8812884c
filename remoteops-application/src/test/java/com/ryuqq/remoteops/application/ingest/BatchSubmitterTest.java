package com.ryuqq.remoteops.application.ingest;

import com.ryuqq.remoteops.core.batch.BatchAck;
import com.ryuqq.remoteops.core.batch.BatchLimits;
import com.ryuqq.remoteops.core.batch.BatchRecord;
import com.ryuqq.remoteops.core.error.BatchRejectedException;
import com.ryuqq.remoteops.core.error.ErrorKind;
import com.ryuqq.remoteops.core.error.TransportException;
import com.ryuqq.remoteops.core.spi.BatchSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * BatchSubmitter 테스트.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BatchSubmitterTest {

    @Mock
    private BatchSink<BatchRecord> sink;

    private BatchSubmitter submitter;

    @BeforeEach
    void setUp() {
        submitter = new BatchSubmitter(sink, new BatchLimits(10, 20, 3));
    }

    private static BatchRecord recordOfSize(int size) {
        return BatchRecord.of(new byte[size - 1], "k", null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void submitAll_배치가_차면_레코드를_분할함() {
        // given
        when(sink.submitBatch(anyList())).thenAnswer(invocation ->
            BatchAck.allAccepted(((List<BatchRecord>) invocation.getArgument(0)).size()));
        List<BatchRecord> records = List.of(
            recordOfSize(9), recordOfSize(9), recordOfSize(9), recordOfSize(1), recordOfSize(1));

        // when
        List<BatchAck> acks = submitter.submitAll(records);

        // then
        ArgumentCaptor<List<BatchRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(sink, times(2)).submitBatch(captor.capture());
        assertThat(captor.getAllValues().get(0)).containsExactly(records.get(0), records.get(1));
        assertThat(captor.getAllValues().get(1)).containsExactly(records.get(2), records.get(3), records.get(4));
        assertThat(acks).extracting(BatchAck::accepted).containsExactly(2, 3);
    }

    @Test
    void submitAll_한도_초과_레코드는_원격_호출_전에_거부() {
        // given
        List<BatchRecord> records = List.of(recordOfSize(3), recordOfSize(10));

        // when & then
        assertThatThrownBy(() -> submitter.submitAll(records))
            .isInstanceOf(BatchRejectedException.class)
            .extracting(e -> ((BatchRejectedException) e).getKind())
            .isEqualTo(ErrorKind.ENTRY_TOO_LARGE);
        verifyNoInteractions(sink);
    }

    @Test
    void submitAll_어떤_배치에도_못_들어가는_레코드는_거부() {
        // given
        BatchSubmitter tight = new BatchSubmitter(sink, new BatchLimits(10, 5, 3));

        // when & then
        assertThatThrownBy(() -> tight.submitAll(List.of(recordOfSize(2), recordOfSize(6))))
            .isInstanceOf(BatchRejectedException.class)
            .extracting(e -> ((BatchRejectedException) e).getKind())
            .isEqualTo(ErrorKind.BATCH_FULL);
        verifyNoInteractions(sink);
    }

    @Test
    void submitAll_빈_목록이면_제출하지_않음() {
        // when
        List<BatchAck> acks = submitter.submitAll(List.of());

        // then
        assertThat(acks).isEmpty();
        verifyNoInteractions(sink);
    }

    @Test
    void submitAll_전송_실패는_그대로_전파() {
        // given
        when(sink.submitBatch(anyList())).thenThrow(new TransportException("stream not found"));

        // when & then
        assertThatThrownBy(() -> submitter.submitAll(List.of(recordOfSize(2))))
            .isInstanceOf(TransportException.class);
    }
}
