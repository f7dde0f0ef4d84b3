package com.hcltech.asyncnode.controller;

import java.util.List;

/** The raw input of a record could not be decoded. Fatal for the invocation. */
public class DecodeException extends AsyncNodeException {
    private final List<String> errors;

    public DecodeException(List<String> errors) {
        super("Failed to decode input: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
