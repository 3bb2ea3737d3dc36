package me.go_gradually.voicelive.domain.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class TextUtils {
    private TextUtils() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    public static List<String> words(String text) {
        if (isBlank(text)) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(text.trim().split("\\s+")));
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
