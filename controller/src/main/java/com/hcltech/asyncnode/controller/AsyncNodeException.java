package com.hcltech.asyncnode.controller;

/** Base of the invocation-level faults the controller raises to its host. */
public class AsyncNodeException extends RuntimeException {

    public AsyncNodeException(String message) {
        super(message);
    }

    public AsyncNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
