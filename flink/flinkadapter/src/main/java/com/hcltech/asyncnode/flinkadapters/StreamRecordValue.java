package com.hcltech.asyncnode.flinkadapters;

import com.hcltech.asyncnode.controller.ReleasableValue;
import com.hcltech.asyncnode.controller.Timestamped;
import org.apache.flink.streaming.runtime.streamrecord.StreamRecord;

/**
 * Hands the payload of a {@link StreamRecord} to the controller and clears it from the record,
 * so the runtime's record does not keep the payload reachable.
 */
final class StreamRecordValue<Raw> implements ReleasableValue<Timestamped<Raw>> {
    private final StreamRecord<Raw> record;
    private boolean consumed;

    StreamRecordValue(StreamRecord<Raw> record) {
        this.record = record;
    }

    @Override
    public Timestamped<Raw> consume() {
        if (consumed) throw new IllegalStateException("StreamRecord value already consumed");
        consumed = true;
        long ts = record.hasTimestamp() ? record.getTimestamp() : InputHandle.NO_TIMESTAMP;
        Raw value = record.getValue();
        record.replace(null);
        return Timestamped.of(ts, value);
    }

    @Override
    public boolean isConsumed() {
        return consumed;
    }
}
