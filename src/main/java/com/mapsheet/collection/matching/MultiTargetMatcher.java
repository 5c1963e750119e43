package com.mapsheet.collection.matching;

import com.mapsheet.collection.core.model.AggregateMatch;
import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchSpan;
import com.mapsheet.collection.core.model.Target;
import com.mapsheet.collection.core.model.TargetKind;
import com.mapsheet.collection.similarity.CompositeSimilarityScorer;
import com.mapsheet.collection.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates a fixed set of {@link Target}s against input strings.
 *
 * <p>Every target is evaluated for every input, so a failed required target never hides the
 * outcomes of the others. The overall score is the weight-normalized sum of the target scores,
 * counting unmatched targets as zero.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class MultiTargetMatcher {
    private static final Logger log = LoggerFactory.getLogger(MultiTargetMatcher.class);

    private static final Pattern EXTENSION = Pattern.compile("\\.([\\p{L}\\p{N}]+)$");

    private final List<Target> targets;
    private final ExactMatchStrategy exact;
    private final ExactMatchStrategy exactEquals;
    private final FuzzyMatchStrategy fuzzy;
    private final HybridMatchStrategy hybrid;
    private final PatternExtractor extractor;

    public MultiTargetMatcher(List<Target> targets) {
        this(targets, new CompositeSimilarityScorer());
    }

    public MultiTargetMatcher(List<Target> targets, SimilarityAlgorithm scorer) {
        Objects.requireNonNull(targets, "targets must not be null");
        Set<String> names = new HashSet<>();
        for (Target target : targets) {
            Objects.requireNonNull(target, "targets must not contain null");
            if (!names.add(target.getName())) {
                throw new IllegalArgumentException("Duplicate target name: " + target.getName());
            }
        }
        this.targets = List.copyOf(targets);
        this.exact = new ExactMatchStrategy(ExactMatchStrategy.Mode.CONTAINS);
        this.exactEquals = new ExactMatchStrategy(ExactMatchStrategy.Mode.EQUALS);
        this.fuzzy = new FuzzyMatchStrategy(scorer);
        this.hybrid = new HybridMatchStrategy(exact, fuzzy);
        this.extractor = new PatternExtractor();
    }

    /**
     * Matches one input against every target.
     */
    public AggregateMatch match(String input) {
        Objects.requireNonNull(input, "input must not be null");
        Map<String, MatchOutcome> outcomes = new LinkedHashMap<>();
        List<String> unmatchedRequired = new ArrayList<>();
        double weightedSum = 0.0;
        double totalWeight = 0.0;

        for (Target target : targets) {
            MatchOutcome outcome = evaluate(input, target);
            outcomes.put(target.getName(), outcome);
            weightedSum += target.getWeight() * outcome.score();
            totalWeight += target.getWeight();
            if (target.isRequired() && !outcome.isMatched()) {
                unmatchedRequired.add(target.getName());
            }
        }

        double overall = totalWeight > 0.0 ? Math.max(0.0, Math.min(1.0, weightedSum / totalWeight)) : 0.0;
        AggregateMatch result = new AggregateMatch(input, outcomes, overall, unmatchedRequired);
        log.debug("match.evaluated input='{}' overallScore={} unmatchedRequired={}",
                input, overall, unmatchedRequired);
        return result;
    }

    /**
     * Matches every input, preserving input order.
     */
    public List<AggregateMatch> matchAll(List<String> inputs) {
        List<AggregateMatch> results = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            results.add(match(input));
        }
        return results;
    }

    /**
     * Returns the aggregates whose overall score reaches {@code minScore}, best first.
     * Equal scores keep their input order.
     */
    public List<AggregateMatch> findBestMatches(List<String> inputs, double minScore) {
        List<AggregateMatch> results = new ArrayList<>();
        for (AggregateMatch aggregate : matchAll(inputs)) {
            if (aggregate.getOverallScore() >= minScore) {
                results.add(aggregate);
            }
        }
        results.sort(Comparator.comparingDouble(AggregateMatch::getOverallScore).reversed());
        return results;
    }

    public List<Target> getTargets() {
        return targets;
    }

    private MatchOutcome evaluate(String input, Target target) {
        if (target.getKind().isPatternBased()) {
            return extractor.extract(input, target);
        }
        if (target.getKind() == TargetKind.EXTENSION) {
            return matchExtension(input, target);
        }
        return strategyFor(target).match(input, target);
    }

    private MatchOutcome matchExtension(String input, Target target) {
        Matcher m = EXTENSION.matcher(input);
        if (!m.find()) {
            return MatchOutcome.noMatch();
        }
        String extension = m.group(1);
        MatchOutcome outcome = exactEquals.match(extension, target);
        if (!outcome.isMatched()) {
            return outcome;
        }
        return MatchOutcome.exact(outcome.matchedValue(), extension, new MatchSpan(m.start(1), extension.length()));
    }

    private MatchStrategy strategyFor(Target target) {
        return switch (target.getStrategy()) {
            case EXACT -> exact;
            case FUZZY -> fuzzy;
            case HYBRID -> hybrid;
        };
    }
}
