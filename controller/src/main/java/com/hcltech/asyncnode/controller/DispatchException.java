package com.hcltech.asyncnode.controller;

/**
 * The processing function (or tick hook) failed outright, before producing its fan-out. Fatal.
 */
public class DispatchException extends AsyncNodeException {

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
