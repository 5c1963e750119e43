package com.mapsheet.collection.matching;

import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchStrategyType;
import com.mapsheet.collection.core.model.Target;

/**
 * Decides whether an input string contains one of a target's candidates.
 * Implementations are stateless and safe to share between threads.
 */
public interface MatchStrategy {

    /**
     * Matches the input against the target's candidates, in their supplied order.
     * An empty candidate list yields {@link MatchOutcome#noMatch()}.
     */
    MatchOutcome match(String input, Target target);

    MatchStrategyType getType();
}
