package com.mapsheet.collection.core.model;

/**
 * Location of a match inside the input string.
 *
 * @param start  index of the first matched character
 * @param length number of matched characters
 */
public record MatchSpan(int start, int length) {

    public MatchSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
    }

    public int end() {
        return start + length;
    }

    /**
     * Extracts the spanned text from the given input.
     */
    public String slice(String input) {
        return input.substring(start, end());
    }
}
