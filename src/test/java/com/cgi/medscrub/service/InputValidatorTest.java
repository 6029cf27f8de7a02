package com.cgi.medscrub.service;

import com.cgi.medscrub.exception.InputTooLargeException;
import com.cgi.medscrub.exception.InvalidControlCharactersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Nested
    @DisplayName("Size ceiling")
    class SizeCeiling {

        @Test
        @DisplayName("text at the ceiling is accepted")
        void at_ceiling() {
            String text = "a".repeat(100);
            assertThat(validator.validate(text, 100)).isSameAs(text);
        }

        @Test
        @DisplayName("text one character over the ceiling is rejected with both lengths")
        void over_ceiling() {
            assertThatThrownBy(() -> validator.validate("a".repeat(101), 100))
                    .isInstanceOfSatisfying(InputTooLargeException.class, e -> {
                        assertThat(e.getLength()).isEqualTo(101);
                        assertThat(e.getMaxLength()).isEqualTo(100);
                        assertThat(e.getErrorCode()).isEqualTo("INPUT_TOO_LARGE");
                    });
        }

        @Test
        @DisplayName("empty text is accepted")
        void empty() {
            assertThat(validator.validate("", 10)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Control characters")
    class ControlCharacters {

        @Test
        @DisplayName("tab, line feed and carriage return are allowed")
        void whitespace_controls_allowed() {
            String text = "line one\tcol\r\nline two\n";
            assertThat(validator.validate(text, 1000)).isEqualTo(text);
        }

        @Test
        @DisplayName("bell character is rejected with its position")
        void bell_rejected() {
            assertThatThrownBy(() -> validator.validate("abc\u0007def", 1000))
                    .isInstanceOfSatisfying(InvalidControlCharactersException.class, e -> {
                        assertThat(e.getPosition()).isEqualTo(3);
                        assertThat(e.getErrorCode()).isEqualTo("INVALID_CONTROL_CHARACTERS");
                        assertThat(e.getMessage()).contains("U+0007").doesNotContain("abc");
                    });
        }

        @Test
        @DisplayName("NUL, vertical tab and form feed are forbidden")
        void other_controls_forbidden() {
            assertThat(InputValidator.isForbiddenControl('\u0000')).isTrue();
            assertThat(InputValidator.isForbiddenControl('\u000B')).isTrue();
            assertThat(InputValidator.isForbiddenControl('\u000C')).isTrue();
            assertThat(InputValidator.isForbiddenControl('\u001F')).isTrue();
            assertThat(InputValidator.isForbiddenControl(' ')).isFalse();
        }

        @Test
        @DisplayName("size is checked before content")
        void size_first() {
            assertThatThrownBy(() -> validator.validate("\u0001".repeat(20), 10))
                    .isInstanceOf(InputTooLargeException.class);
        }
    }

    @Test
    @DisplayName("null text is an illegal argument")
    void null_text() {
        assertThatThrownBy(() -> validator.validate(null, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
