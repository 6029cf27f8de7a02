package com.cgi.medscrub.exception;

import java.io.Serial;

/**
 * Thrown when the input exceeds the configured size ceiling.
 */
public class InputTooLargeException extends InputRejectedException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int length;
    private final int maxLength;

    public InputTooLargeException(int length, int maxLength) {
        super(String.format("Input rejected: %d characters exceeds the maximum of %d", length, maxLength),
                "INPUT_TOO_LARGE");
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
