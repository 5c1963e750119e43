package com.mapsheet.collection.matching;

import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchStrategyType;
import com.mapsheet.collection.core.model.Target;

import java.util.Objects;

/**
 * Exact matching first, fuzzy matching only when no candidate occurs exactly.
 * The outcome's kind tells which of the two produced it.
 */
public class HybridMatchStrategy implements MatchStrategy {

    private final ExactMatchStrategy exact;
    private final FuzzyMatchStrategy fuzzy;

    public HybridMatchStrategy(ExactMatchStrategy exact, FuzzyMatchStrategy fuzzy) {
        this.exact = Objects.requireNonNull(exact, "exact is required");
        this.fuzzy = Objects.requireNonNull(fuzzy, "fuzzy is required");
    }

    @Override
    public MatchOutcome match(String input, Target target) {
        MatchOutcome exactOutcome = exact.match(input, target);
        if (exactOutcome.isMatched()) {
            return exactOutcome;
        }
        return fuzzy.match(input, target);
    }

    @Override
    public MatchStrategyType getType() {
        return MatchStrategyType.HYBRID;
    }
}
