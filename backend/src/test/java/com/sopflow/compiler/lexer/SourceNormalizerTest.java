package com.sopflow.compiler.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SourceNormalizerTest {

    private final SourceNormalizer normalizer = new SourceNormalizer(4);

    @Test
    void normalize_shouldStripBomAndNormalizeLineEndings() {
        assertEquals("@task a\n    one\ntwo", normalizer.normalize("\uFEFF@task a\r\n    one\rtwo"));
    }

    @Test
    void normalize_shouldExpandTabsToTabStops() {
        assertEquals("    x", normalizer.normalize("\tx"));
        assertEquals("ab  c", normalizer.normalize("ab\tc"));
        assertEquals("        y", normalizer.normalize("  \t  \ty"));
    }

    @Test
    void normalize_shouldRemoveTrailingWhitespaceAndNulCharacters() {
        assertEquals("one\ntwo", normalizer.normalize("one   \ntw\0o\t"));
    }

    @Test
    void normalize_shouldReturnEmptyStringForNull() {
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    void constructor_shouldRejectNonPositiveTabWidth() {
        assertThrows(IllegalArgumentException.class, () -> new SourceNormalizer(0));
    }
}
