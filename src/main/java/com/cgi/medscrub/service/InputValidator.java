package com.cgi.medscrub.service;

import com.cgi.medscrub.exception.InputTooLargeException;
import com.cgi.medscrub.exception.InvalidControlCharactersException;
import org.springframework.stereotype.Component;

/**
 * Rejects oversized or malformed input before any detector runs.
 */
@Component
public class InputValidator {

    /**
     * Validates a document and returns it unchanged.
     *
     * @param text Document text
     * @param maxInputSize Maximum length in UTF-16 code units
     * @return The same text
     * @throws InputTooLargeException if the text is longer than the ceiling
     * @throws InvalidControlCharactersException if the text contains a control character other than tab, LF or CR
     */
    public String validate(String text, int maxInputSize) {
        if (text == null) {
            throw new IllegalArgumentException("Text must not be null");
        }
        if (text.length() > maxInputSize) {
            throw new InputTooLargeException(text.length(), maxInputSize);
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isForbiddenControl(c)) {
                throw new InvalidControlCharactersException(i, c);
            }
        }
        return text;
    }

    // U+0000-U+0008, U+000B, U+000C, U+000E-U+001F
    static boolean isForbiddenControl(char c) {
        return c < 0x20 && c != '\t' && c != '\n' && c != '\r';
    }
}
