package com.phillippitts.audiolink.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewKeepsShortTextAsIs() {
        assertThat(LogSanitizer.preview("Hello")).isEqualTo("Hello");
    }

    @Test
    void previewEscapesLineBreaksAndControlCharacters() {
        assertThat(LogSanitizer.preview("a\nb\r\tc\u0007", 20)).isEqualTo("a\\nb\\r\\tc\\u0007");
    }

    @Test
    void previewMarksCutText() {
        String text = "x".repeat(100);

        assertThat(LogSanitizer.preview(text)).isEqualTo("x".repeat(40) + "...(100 chars)");
    }

    @Test
    void previewFitsOnOneLineForForgedLogEntries() {
        String forged = "ok\n2024-01-01 ERROR fake entry";

        assertThat(LogSanitizer.preview(forged, 200)).doesNotContain("\n");
    }
}
