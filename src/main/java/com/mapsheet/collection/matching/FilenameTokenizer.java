package com.mapsheet.collection.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits file names into separator-delimited tokens while keeping character offsets,
 * and builds the contiguous token windows that fuzzy matching compares candidates against.
 */
public final class FilenameTokenizer {

    /**
     * Characters treated as word separators in file names.
     */
    public static final Pattern SEPARATORS = Pattern.compile("[_\\s\\-.]+");

    private static final Pattern TOKEN = Pattern.compile("[^_\\s\\-.]+");

    private FilenameTokenizer() {
    }

    /**
     * A token or a run of adjacent tokens, with its position in the source string.
     */
    public record Segment(String text, int start, int end) {

        public int length() {
            return end - start;
        }
    }

    public static List<Segment> tokenize(String input) {
        List<Segment> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }
        Matcher m = TOKEN.matcher(input);
        while (m.find()) {
            tokens.add(new Segment(m.group(), m.start(), m.end()));
        }
        return tokens;
    }

    public static int countTokens(String input) {
        return tokenize(input).size();
    }

    /**
     * Returns every window of {@code minTokens..maxTokens} adjacent tokens, shortest windows
     * first and left to right within a size. The window text keeps the original separators.
     */
    public static List<Segment> windows(String input, int minTokens, int maxTokens) {
        List<Segment> tokens = tokenize(input);
        List<Segment> windows = new ArrayList<>();
        int from = Math.max(1, minTokens);
        int to = Math.min(maxTokens, tokens.size());
        for (int size = from; size <= to; size++) {
            for (int i = 0; i + size <= tokens.size(); i++) {
                int start = tokens.get(i).start();
                int end = tokens.get(i + size - 1).end();
                windows.add(new Segment(input.substring(start, end), start, end));
            }
        }
        return windows;
    }

    /**
     * Removes separators and folds case, so that {@code Team_317} and {@code team 317}
     * compare as the same string.
     */
    public static String compact(String value, boolean caseSensitive) {
        String stripped = SEPARATORS.matcher(value).replaceAll("");
        return caseSensitive ? stripped : stripped.toLowerCase(Locale.ROOT);
    }

    /**
     * Collapses separator runs to a single underscore, trims leading and trailing separators
     * and folds case.
     */
    public static String canonical(String value, boolean caseSensitive) {
        String collapsed = SEPARATORS.matcher(value.strip()).replaceAll("_");
        int from = 0;
        int to = collapsed.length();
        while (from < to && collapsed.charAt(from) == '_') {
            from++;
        }
        while (to > from && collapsed.charAt(to - 1) == '_') {
            to--;
        }
        String trimmed = collapsed.substring(from, to);
        return caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }
}
