package com.mapsheet.collection.matching;

import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchSpan;
import com.mapsheet.collection.core.model.Target;
import com.mapsheet.collection.core.model.TargetKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts values for pattern-based targets.
 * Patterns are tried in order and each pattern's matches left to right; the first capturing
 * group is the value when the pattern has one. The first value that passes validation wins.
 */
public class PatternExtractor {

    public static final double PATTERN_CONFIDENCE = 0.9;

    public MatchOutcome extract(String input, Target target) {
        if (input == null || input.isEmpty()) {
            return MatchOutcome.noMatch();
        }
        for (Pattern pattern : target.getPatterns()) {
            Matcher m = pattern.matcher(input);
            while (m.find()) {
                boolean grouped = m.groupCount() >= 1 && m.group(1) != null;
                String value = grouped ? m.group(1) : m.group();
                int start = grouped ? m.start(1) : m.start();
                if (isValid(value, target)) {
                    return MatchOutcome.pattern(value, new MatchSpan(start, value.length()), PATTERN_CONFIDENCE);
                }
            }
        }
        return MatchOutcome.noMatch();
    }

    private static boolean isValid(String value, Target target) {
        if (value.isEmpty()) {
            return false;
        }
        if (target.getKind() == TargetKind.DATE && !DateTokens.isCalendarDate(value)) {
            return false;
        }
        return target.accepts(value);
    }
}
