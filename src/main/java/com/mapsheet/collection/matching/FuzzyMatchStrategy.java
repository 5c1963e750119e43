package com.mapsheet.collection.matching;

import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchSpan;
import com.mapsheet.collection.core.model.MatchStrategyType;
import com.mapsheet.collection.core.model.Target;
import com.mapsheet.collection.similarity.PrefixBiasedSimilarity;
import com.mapsheet.collection.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Similarity-based matching of candidates against segments of the input.
 *
 * <p>A candidate of {@code k} tokens is compared with every window of {@code k-1..k+1}
 * adjacent input tokens and with the whole input, all in separator-free form. The best score
 * over every candidate and segment wins; ties keep the earlier candidate. A match requires
 * the best score to reach the target's fuzzy threshold.</p>
 *
 * <p>Numbers are never approximated: a segment is only compared with a candidate when both
 * carry the same digit runs, so {@code Team_319} is not a near spelling of {@code Team_317}.</p>
 */
public class FuzzyMatchStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatchStrategy.class);

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    private final SimilarityAlgorithm scorer;
    private final SimilarityAlgorithm prefixScorer;

    public FuzzyMatchStrategy(SimilarityAlgorithm scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.prefixScorer = new PrefixBiasedSimilarity(scorer);
    }

    @Override
    public MatchOutcome match(String input, Target target) {
        if (input == null || input.isBlank() || target.getCandidates().isEmpty()) {
            return MatchOutcome.noMatch();
        }
        boolean caseSensitive = target.isCaseSensitive();
        SimilarityAlgorithm algorithm = target.isPrefixBiased() ? prefixScorer : scorer;
        FilenameTokenizer.Segment whole = new FilenameTokenizer.Segment(input, 0, input.length());

        String bestCandidate = null;
        FilenameTokenizer.Segment bestSegment = null;
        double bestScore = 0.0;

        for (String candidate : target.getCandidates()) {
            String compactCandidate = FilenameTokenizer.compact(candidate, caseSensitive);
            if (compactCandidate.isEmpty()) {
                continue;
            }
            List<String> candidateDigits = digitRuns(candidate);
            for (FilenameTokenizer.Segment segment : segmentsFor(input, candidate, whole)) {
                if (!candidateDigits.equals(digitRuns(segment.text()))) {
                    continue;
                }
                double score = algorithm.compute(compactCandidate,
                        FilenameTokenizer.compact(segment.text(), caseSensitive));
                if (score > bestScore) {
                    bestScore = score;
                    bestCandidate = candidate;
                    bestSegment = segment;
                }
            }
        }

        if (bestCandidate != null && bestScore >= target.getFuzzyThreshold()) {
            log.debug("fuzzy.matched target={} candidate='{}' segment='{}' score={}",
                    target.getName(), bestCandidate, bestSegment.text(), bestScore);
            return MatchOutcome.fuzzy(bestCandidate, bestSegment.text(),
                    new MatchSpan(bestSegment.start(), bestSegment.length()), bestScore);
        }
        log.trace("fuzzy.no_match target={} closest={} threshold={}",
                target.getName(), bestScore, target.getFuzzyThreshold());
        return MatchOutcome.noMatch(bestScore);
    }

    @Override
    public MatchStrategyType getType() {
        return MatchStrategyType.FUZZY;
    }

    static List<String> digitRuns(String value) {
        List<String> runs = new ArrayList<>();
        Matcher matcher = DIGIT_RUN.matcher(value);
        while (matcher.find()) {
            runs.add(matcher.group());
        }
        return runs;
    }

    private static List<FilenameTokenizer.Segment> segmentsFor(String input, String candidate,
                                                               FilenameTokenizer.Segment whole) {
        int candidateTokens = Math.max(1, FilenameTokenizer.countTokens(candidate));
        List<FilenameTokenizer.Segment> segments = new ArrayList<>(
                FilenameTokenizer.windows(input, candidateTokens - 1, candidateTokens + 1));
        segments.add(whole);
        return segments;
    }
}
