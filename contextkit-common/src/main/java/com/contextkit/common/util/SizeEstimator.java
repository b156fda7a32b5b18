package com.contextkit.common.util;

import java.util.regex.Pattern;

/**
 * Heuristic size estimator for prompt fragments.
 * Approximation: 1.5 units per CJK ideograph + 1 unit per ASCII-only word.
 */
public final class SizeEstimator {
    private static final char WIDE_RANGE_START = '\u4e00';
    private static final char WIDE_RANGE_END = '\u9fff';
    private static final double WIDE_CHAR_WEIGHT = 1.5;
    // Unicode white space plus the information separators U+001C..U+001F
    private static final Pattern WHITESPACE = Pattern.compile("(?U)[\\s\\x1C-\\x1F]+");

    private SizeEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.floor(countWideChars(text) * WIDE_CHAR_WEIGHT + countNarrowWords(text));
    }

    public static int countWideChars(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (isWide(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts whitespace-delimited tokens made only of ASCII characters.
     */
    public static int countNarrowWords(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String word : WHITESPACE.split(trimmed)) {
            if (!word.isEmpty() && isAscii(word)) {
                count++;
            }
        }
        return count;
    }

    public static boolean isWide(char c) {
        return c >= WIDE_RANGE_START && c <= WIDE_RANGE_END;
    }

    private static boolean isAscii(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (word.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }
}
