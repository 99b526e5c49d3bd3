/*
 * Copyright 2024, AutoMQ CO.,LTD.
 *
 * Use of this software is governed by the Business Source License
 * included in the file BSL.md
 *
 * As of the Change Date specified in that file, in accordance with
 * the Business Source License, use of this software will be governed
 * by the Apache License, Version 2.0
 */

package com.automq.chrono.exception;

/**
 * Thrown when a duration string violates the {@code ([+-]?\d*(ns|us|ms|s|m|h))*} grammar or its value does not fit
 * the target resolution.
 */
public class MalformedDurationException extends IllegalArgumentException {
    private final String input;
    private final int errorIndex;

    public MalformedDurationException(String message, CharSequence input, int errorIndex) {
        super(describe(message, input, errorIndex));
        this.input = input.toString();
        this.errorIndex = errorIndex;
    }

    public MalformedDurationException(String message, CharSequence input, int errorIndex, Throwable cause) {
        super(describe(message, input, errorIndex), cause);
        this.input = input.toString();
        this.errorIndex = errorIndex;
    }

    private static String describe(String message, CharSequence input, int errorIndex) {
        return String.format("%s at index %d of \"%s\"", message, errorIndex, input);
    }

    /**
     * The complete text that failed to parse.
     */
    public String getInput() {
        return input;
    }

    /**
     * Zero-based position in {@link #getInput()} where parsing stopped.
     */
    public int getErrorIndex() {
        return errorIndex;
    }
}
