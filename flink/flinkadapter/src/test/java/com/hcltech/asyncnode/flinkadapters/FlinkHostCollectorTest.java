package com.hcltech.asyncnode.flinkadapters;

import com.hcltech.asyncnode.common.metrics.InMemoryMetrics;
import com.hcltech.asyncnode.controller.Timestamped;
import org.apache.flink.streaming.api.operators.Output;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class FlinkHostCollectorTest {

    @SuppressWarnings("unchecked")
    private final Output<StreamRecord<String>> output = mock(Output.class);
    private final InMemoryMetrics metrics = new InMemoryMetrics();
    private final FlinkHostCollector<String> collector = new FlinkHostCollector<>(output, metrics);

    @Test
    void emit_writes_value_with_its_timestamp() {
        collector.emit(List.of(new InputHandle(0, 7L)), Timestamped.of(7L, "out"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<StreamRecord<String>> captor = ArgumentCaptor.forClass(StreamRecord.class);
        verify(output).collect(captor.capture());
        assertEquals("out", captor.getValue().getValue());
        assertEquals(7L, captor.getValue().getTimestamp());
    }

    @Test
    void emit_without_timestamp_writes_unstamped_record() {
        collector.emit(List.of(), Timestamped.of(InputHandle.NO_TIMESTAMP, "out"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<StreamRecord<String>> captor = ArgumentCaptor.forClass(StreamRecord.class);
        verify(output).collect(captor.capture());
        assertFalse(captor.getValue().hasTimestamp());
    }

    @Test
    void fail_writes_to_failures_side_output() {
        InputHandle handle = new InputHandle(3, 9L);
        collector.fail(handle, new IllegalStateException("boom"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<StreamRecord<AsyncNodeFailure>> captor = ArgumentCaptor.forClass(StreamRecord.class);
        verify(output).collect(eq(AsyncNodeOperator.FAILURES), captor.capture());
        assertEquals(new AsyncNodeFailure(handle, IllegalStateException.class.getName(), "boom"), captor.getValue().getValue());
        assertEquals(9L, captor.getValue().getTimestamp());
        assertEquals(1L, metrics.counter("asyncnode.flink.failed"));
    }

    @Test
    void ack_and_report_error_are_counted_only() {
        collector.ack(new InputHandle(0, 1L));
        collector.reportError(new RuntimeException("x"));

        verifyNoInteractions(output);
        assertEquals(1L, metrics.counter("asyncnode.flink.acked"));
        assertEquals(1L, metrics.counter("asyncnode.flink.errors"));
    }
}
