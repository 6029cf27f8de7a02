package com.cgi.medscrub.exception;

import java.io.Serial;

/**
 * Thrown when the input contains control characters other than tab, line feed and carriage return.
 */
public class InvalidControlCharactersException extends InputRejectedException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int position;

    public InvalidControlCharactersException(int position, char character) {
        super(String.format("Input rejected: control character U+%04X at position %d", (int) character, position),
                "INVALID_CONTROL_CHARACTERS");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
