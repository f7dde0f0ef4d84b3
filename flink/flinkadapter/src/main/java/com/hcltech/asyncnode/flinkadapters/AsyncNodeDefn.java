package com.hcltech.asyncnode.flinkadapters;

import com.hcltech.asyncnode.common.codec.Codec;
import com.hcltech.asyncnode.controller.AsyncProcessingFunction;

import java.io.Serializable;
import java.util.concurrent.ExecutorService;

/**
 * What an {@link AsyncNodeOperator} runs. Shipped with the job graph, so it must be serializable;
 * the non-serializable parts are created per subtask in {@code open()}.
 *
 * @param <Raw> element type of the input stream
 * @param <In>  decoded input
 * @param <Out> element type of the output stream
 */
public interface AsyncNodeDefn<Raw, In, Out> extends Serializable {

    Codec<In, Raw> decoder();

    /**
     * @param ioPool pool owned by the operator for the function's asynchronous work; shut down on close
     */
    AsyncProcessingFunction<InputHandle, In, Out> createFunction(ExecutorService ioPool);

    default int ioThreads() {
        return 4;
    }
}
