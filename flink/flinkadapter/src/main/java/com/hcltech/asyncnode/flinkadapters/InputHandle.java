package com.hcltech.asyncnode.flinkadapters;

import java.io.Serializable;

/**
 * Source handle for one input record of an {@link AsyncNodeOperator} subtask.
 *
 * @param sequence  arrival order within the subtask
 * @param timestamp event time of the input, or {@link #NO_TIMESTAMP}
 */
public record InputHandle(long sequence, long timestamp) implements Serializable {

    public static final long NO_TIMESTAMP = Long.MIN_VALUE;

    public boolean hasTimestamp() {
        return timestamp != NO_TIMESTAMP;
    }
}
