package com.mapsheet.collection.matching;

import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchSpan;
import com.mapsheet.collection.core.model.MatchStrategyType;
import com.mapsheet.collection.core.model.Target;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Exact matching after separator normalization.
 *
 * <p>In {@link Mode#CONTAINS} a candidate matches when it occurs in the input on token
 * boundaries ({@code Team_31} does not match inside {@code Team_317}), or when the whole
 * input occurs within the candidate. In {@link Mode#EQUALS} the normalized input must equal
 * the normalized candidate.</p>
 */
public class ExactMatchStrategy implements MatchStrategy {

    public enum Mode {
        CONTAINS,
        EQUALS
    }

    private final Mode mode;
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public ExactMatchStrategy() {
        this(Mode.CONTAINS);
    }

    public ExactMatchStrategy(Mode mode) {
        this.mode = mode;
    }

    @Override
    public MatchOutcome match(String input, Target target) {
        if (input == null || input.isBlank() || target.getCandidates().isEmpty()) {
            return MatchOutcome.noMatch();
        }
        boolean caseSensitive = target.isCaseSensitive();
        String canonicalInput = FilenameTokenizer.canonical(input, caseSensitive);
        if (canonicalInput.isEmpty()) {
            return MatchOutcome.noMatch();
        }

        for (String candidate : target.getCandidates()) {
            String canonicalCandidate = FilenameTokenizer.canonical(candidate, caseSensitive);
            if (canonicalCandidate.isEmpty()) {
                continue;
            }
            if (mode == Mode.EQUALS) {
                if (canonicalInput.equals(canonicalCandidate)) {
                    return MatchOutcome.exact(candidate, input, new MatchSpan(0, input.length()));
                }
                continue;
            }

            Matcher m = candidatePattern(canonicalCandidate, caseSensitive).matcher(input);
            if (m.find()) {
                return MatchOutcome.exact(candidate, m.group(), new MatchSpan(m.start(), m.end() - m.start()));
            }
            if (containsOnBoundary(canonicalCandidate, canonicalInput)) {
                return MatchOutcome.exact(candidate, input, new MatchSpan(0, input.length()));
            }
        }
        return MatchOutcome.noMatch();
    }

    @Override
    public MatchStrategyType getType() {
        return MatchStrategyType.EXACT;
    }

    public Mode getMode() {
        return mode;
    }

    private Pattern candidatePattern(String canonicalCandidate, boolean caseSensitive) {
        String key = (caseSensitive ? "S:" : "I:") + canonicalCandidate;
        return patternCache.computeIfAbsent(key, k -> {
            String body = List.of(canonicalCandidate.split("_")).stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("[_\\s\\-.]+"));
            int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            return Pattern.compile("(?<![\\p{L}\\p{N}])" + body + "(?![\\p{L}\\p{N}])", flags);
        });
    }

    private static boolean containsOnBoundary(String haystack, String needle) {
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + needle.length();
            boolean leftOk = idx == 0 || haystack.charAt(idx - 1) == '_';
            boolean rightOk = end == haystack.length() || haystack.charAt(end) == '_';
            if (leftOk && rightOk) {
                return true;
            }
            from = idx + 1;
        }
    }
}
