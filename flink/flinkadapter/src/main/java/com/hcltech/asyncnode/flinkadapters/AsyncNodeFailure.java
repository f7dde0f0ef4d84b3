package com.hcltech.asyncnode.flinkadapters;

/**
 * Side-output record for an input whose asynchronous processing failed.
 */
public record AsyncNodeFailure(InputHandle handle, String errorClass, String message) {

    public static AsyncNodeFailure of(InputHandle handle, Throwable error) {
        return new AsyncNodeFailure(handle, error.getClass().getName(), error.getMessage());
    }
}
