package com.reviewtrack.common;

import java.util.regex.Pattern;

/**
 * Whitespace tokenisation used for word-weighted completion. Null or blank text counts as 0 words.
 */
public final class WordCounter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private WordCounter() {
    }

    public static int count(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }
}
