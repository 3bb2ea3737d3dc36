package me.go_gradually.voicelive.domain.live;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ToolResponseSanitizerTest {

    @Test
    void sanitize_stripsListMarkupAndPhrases() {
        String cleaned = ToolResponseSanitizer.sanitize(
                "Here are the choices: 1. **Savings** account - (best) 2. Fixed deposit");

        assertEquals("the choices Savings account best Fixed deposit", cleaned);
    }

    @Test
    void sanitize_substitutesDefaultForMalformedArgument() {
        assertEquals(ToolResponseSanitizer.DEFAULT_REPLY, ToolResponseSanitizer.sanitize(null));
        assertEquals(ToolResponseSanitizer.DEFAULT_REPLY, ToolResponseSanitizer.sanitize(42));
        assertEquals(ToolResponseSanitizer.DEFAULT_REPLY, ToolResponseSanitizer.sanitize("**"));
    }

    @Test
    void sanitize_capsWordCount() {
        String longText = "word ".repeat(60).trim();

        String cleaned = ToolResponseSanitizer.sanitize(longText);

        assertEquals(40, cleaned.split(" ").length);
    }

    @Test
    void sanitize_addsQuestionMarkToQuestions() {
        assertEquals("kya aapko loan chahiye?", ToolResponseSanitizer.sanitize("kya aapko loan chahiye"));
    }
}
