package com.mapsheet.collection.matching;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Date tokens as they appear in submission file names: {@code 20240315},
 * {@code 2024-03-15}, {@code 2024.03.15} or {@code 2024/03/15}.
 * Parsing is strict, so {@code 20240230} is not a date.
 */
public final class DateTokens {

    /**
     * Eight digits, or a dashed/dotted/slashed year-month-day, not embedded in a longer number.
     */
    public static final String DATE_REGEX = "(?<!\\d)(\\d{8}|\\d{4}[-/.]\\d{2}[-/.]\\d{2})(?!\\d)";

    private static final DateTimeFormatter BASIC = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DELIMITED = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private DateTokens() {
    }

    public static List<String> defaultPatterns() {
        return List.of(DATE_REGEX);
    }

    /**
     * Parses a date token, returning empty for anything that is not a real calendar date.
     */
    public static Optional<LocalDate> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            if (token.length() == 8) {
                return Optional.of(LocalDate.parse(token, BASIC));
            }
            if (token.length() == 10) {
                String normalized = token.replace('/', '-').replace('.', '-');
                return Optional.of(LocalDate.parse(normalized, DELIMITED));
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    public static boolean isCalendarDate(String token) {
        return parse(token).isPresent();
    }

    /**
     * Formats a date the way canonical file names and archive folders carry it.
     */
    public static String format(LocalDate date) {
        return BASIC.format(date);
    }
}
