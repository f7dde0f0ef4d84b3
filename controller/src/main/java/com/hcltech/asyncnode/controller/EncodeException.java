package com.hcltech.asyncnode.controller;

import java.util.List;

/** An output could not be encoded for the host. Reported as a failure of its completion group. */
public class EncodeException extends AsyncNodeException {
    private final List<String> errors;

    public EncodeException(List<String> errors) {
        super("Failed to encode output: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
