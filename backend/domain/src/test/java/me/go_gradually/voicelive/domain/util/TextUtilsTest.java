package me.go_gradually.voicelive.domain.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextUtilsTest {

    @Test
    void truncate_returnsOriginalWhenShortEnough() {
        assertEquals("abc", TextUtils.truncate("abc", 5));
    }

    @Test
    void truncate_cutsAtMaxLength() {
        assertEquals("abcde", TextUtils.truncate("abcdef", 5));
    }

    @Test
    void truncate_returnsEmptyForNull() {
        assertEquals("", TextUtils.truncate(null, 5));
    }

    @Test
    void words_returnsEmptyForBlankText() {
        assertTrue(TextUtils.words("   ").isEmpty());
    }

    @Test
    void words_splitsOnAnyWhitespace() {
        assertEquals(List.of("one", "two", "three"), TextUtils.words(" one\ttwo  three "));
    }

    @Test
    void firstNonBlank_skipsBlankValues() {
        assertEquals("b", TextUtils.firstNonBlank(null, " ", "b"));
        assertNull(TextUtils.firstNonBlank(" ", null));
    }
}
