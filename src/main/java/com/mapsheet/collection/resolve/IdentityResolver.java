package com.mapsheet.collection.resolve;

import com.mapsheet.collection.cache.SimilarityCache;
import com.mapsheet.collection.core.model.AggregateMatch;
import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.MatchStrategyType;
import com.mapsheet.collection.core.model.Target;
import com.mapsheet.collection.core.model.TargetKind;
import com.mapsheet.collection.core.model.WorkUnitIdentity;
import com.mapsheet.collection.matching.DateTokens;
import com.mapsheet.collection.matching.MultiTargetMatcher;
import com.mapsheet.collection.metrics.MetricsService;
import com.mapsheet.collection.metrics.NoOpMetricsService;
import com.mapsheet.collection.registry.WorkUnitRegistry;
import com.mapsheet.collection.similarity.CachingSimilarityScorer;
import com.mapsheet.collection.similarity.CompositeSimilarityScorer;
import com.mapsheet.collection.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a file name is a valid submission for the active collection period,
 * and for which work unit and category.
 *
 * <p>Four targets are matched against every name: the work unit identifier (every name and
 * alias of every registered unit), the category keyword, the file-name date and the
 * extension. All four are required. When several fail, the rejection reports the first of
 * identifier, category, date, date range, extension.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * IdentityResolver resolver = new IdentityResolver(registry, CategoryVocabulary.defaults(),
 *         ResolverOptions.defaults(), CollectionPeriod.daily(LocalDate.now()));
 * ResolutionResult result = resolver.resolve("MAHROUS_finished_points_and_tracks_20250830.kmz");
 * </pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final String IDENTIFIER_TARGET = "identifier";
    public static final String CATEGORY_TARGET = "category";
    public static final String DATE_TARGET = "date";
    public static final String EXTENSION_TARGET = "extension";

    private final WorkUnitRegistry registry;
    private final CategoryVocabulary vocabulary;
    private final ResolverOptions options;
    private final CollectionPeriod period;
    private final MetricsService metricsService;
    private final Map<String, WorkUnitIdentity> identitiesByName;
    private final MultiTargetMatcher matcher;

    public IdentityResolver(WorkUnitRegistry registry, CategoryVocabulary vocabulary,
                            ResolverOptions options, CollectionPeriod period) {
        this(registry, vocabulary, options, period, NoOpMetricsService.INSTANCE);
    }

    public IdentityResolver(WorkUnitRegistry registry, CategoryVocabulary vocabulary,
                            ResolverOptions options, CollectionPeriod period,
                            MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.period = Objects.requireNonNull(period, "period is required");
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
        this.identitiesByName = indexNames(registry);
        this.matcher = new MultiTargetMatcher(buildTargets(), buildScorer());
    }

    /**
     * Resolves a file against the active collection period.
     */
    public ResolutionResult resolve(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path fileName = path.getFileName();
        return resolve(fileName != null ? fileName.toString() : path.toString(), path, period);
    }

    /**
     * Resolves a bare file name against the active collection period.
     */
    public ResolutionResult resolve(String fileName) {
        return resolve(fileName, null, period);
    }

    /**
     * Resolves a bare file name against another collection period.
     */
    public ResolutionResult resolve(String fileName, CollectionPeriod otherPeriod) {
        return resolve(fileName, null, Objects.requireNonNull(otherPeriod, "period must not be null"));
    }

    /**
     * Recognizes work unit, category and date without checking the date against any period.
     * Files with an unsupported extension are not recognized.
     */
    public Optional<Identification> identify(String fileName) {
        Objects.requireNonNull(fileName, "fileName must not be null");
        ResolutionResult result = decide(fileName, null, matcher.match(fileName), null);
        return result.getResolved()
                .map(file -> new Identification(file.identity(), file.category(), file.fileDate()));
    }

    public WorkUnitRegistry getRegistry() {
        return registry;
    }

    public CollectionPeriod getPeriod() {
        return period;
    }

    public ResolverOptions getOptions() {
        return options;
    }

    private ResolutionResult resolve(String fileName, Path path, CollectionPeriod activePeriod) {
        Objects.requireNonNull(fileName, "fileName must not be null");
        long start = System.nanoTime();
        AggregateMatch match = matcher.match(fileName);
        ResolutionResult result = decide(fileName, path, match, activePeriod);
        metricsService.recordResolutionDuration(Duration.ofNanos(System.nanoTime() - start));

        if (result.isResolved()) {
            ResolvedFile file = result.getResolved().get();
            metricsService.recordFileResolved(file.category());
            log.debug("file.resolved fileName={} workUnit={} category={} date={} via={}",
                    fileName, file.identity().identifier(), file.category(), file.fileDate(),
                    file.identifierMatchKind());
        } else {
            Rejection rejection = result.getRejection().get();
            metricsService.recordFileRejected(rejection.reason());
            log.debug("file.rejected fileName={} reason={} detail={}",
                    fileName, rejection.reason(), rejection.detail());
        }
        return result;
    }

    /**
     * Applies the rejection precedence. A null period skips the date range check.
     */
    private ResolutionResult decide(String fileName, Path path, AggregateMatch match, CollectionPeriod activePeriod) {
        MatchOutcome identifier = outcome(match, IDENTIFIER_TARGET);
        if (!identifier.isMatched()) {
            return reject(RejectionReason.NO_IDENTIFIER_MATCH, String.format(Locale.ROOT,
                    "No registered work unit name in '%s' (closest similarity %.2f, threshold %.2f)",
                    fileName, identifier.closestScore(), options.getFuzzyThreshold()), match);
        }
        WorkUnitIdentity identity = identitiesByName.get(identifier.matchedValue());

        MatchOutcome categoryOutcome = outcome(match, CATEGORY_TARGET);
        if (!categoryOutcome.isMatched()) {
            return reject(RejectionReason.NO_CATEGORY_MATCH, String.format(Locale.ROOT,
                    "No file category keyword in '%s' (closest similarity %.2f)",
                    fileName, categoryOutcome.closestScore()), match);
        }
        FileCategory category = vocabulary.categoryOf(categoryOutcome.matchedValue())
                .orElseThrow(() -> new IllegalStateException(
                        "Keyword without category: " + categoryOutcome.matchedValue()));

        MatchOutcome dateOutcome = outcome(match, DATE_TARGET);
        Optional<LocalDate> fileDate = dateOutcome.value().flatMap(DateTokens::parse);
        if (fileDate.isEmpty()) {
            return reject(RejectionReason.NO_DATE_MATCH,
                    "No calendar date in '" + fileName + "'", match);
        }
        if (activePeriod != null && !activePeriod.accepts(category, fileDate.get())) {
            return reject(RejectionReason.DATE_OUT_OF_RANGE,
                    "File date " + fileDate.get() + " outside accepted range "
                            + activePeriod.rangeFor(category) + " for " + category, match);
        }

        MatchOutcome extension = outcome(match, EXTENSION_TARGET);
        if (!extension.isMatched()) {
            return reject(RejectionReason.UNSUPPORTED_EXTENSION,
                    "Extension of '" + fileName + "' is not one of " + options.getAcceptedExtensions(), match);
        }

        return ResolutionResult.resolved(new ResolvedFile(fileName, path, identity, category, fileDate.get(), match));
    }

    private static ResolutionResult reject(RejectionReason reason, String detail, AggregateMatch match) {
        return ResolutionResult.rejected(new Rejection(reason, detail, match));
    }

    private static MatchOutcome outcome(AggregateMatch match, String target) {
        return match.getOutcome(target).orElseGet(MatchOutcome::noMatch);
    }

    private List<Target> buildTargets() {
        List<Target> targets = new ArrayList<>();
        targets.add(Target.builder(IDENTIFIER_TARGET, TargetKind.IDENTIFIER)
                .candidates(new ArrayList<>(identitiesByName.keySet()))
                .strategy(options.getIdentifierStrategy())
                .fuzzyThreshold(options.getFuzzyThreshold())
                .caseSensitive(options.isCaseSensitive())
                .prefixBiased(options.isPrefixBiased())
                .weight(2.0)
                .build());
        targets.add(Target.builder(CATEGORY_TARGET, TargetKind.FILE_CATEGORY)
                .candidates(vocabulary.allKeywords())
                .strategy(options.getCategoryStrategy())
                .fuzzyThreshold(options.getFuzzyThreshold())
                .caseSensitive(options.isCaseSensitive())
                .build());
        targets.add(Target.builder(DATE_TARGET, TargetKind.DATE)
                .patterns(options.getDatePatterns())
                .build());
        targets.add(Target.builder(EXTENSION_TARGET, TargetKind.EXTENSION)
                .candidates(options.getAcceptedExtensions())
                .strategy(MatchStrategyType.EXACT)
                .weight(0.5)
                .build());
        return targets;
    }

    private SimilarityAlgorithm buildScorer() {
        SimilarityAlgorithm scorer = new CompositeSimilarityScorer(options.getSimilarityWeights());
        if (options.getCacheConfig().enabled()) {
            scorer = new CachingSimilarityScorer(scorer, SimilarityCache.create(options.getCacheConfig()), metricsService);
        }
        return scorer;
    }

    /**
     * Maps every name and alias to its work unit. A name shared by two units belongs to
     * the one listed first.
     */
    private static Map<String, WorkUnitIdentity> indexNames(WorkUnitRegistry registry) {
        Map<String, WorkUnitIdentity> index = new LinkedHashMap<>();
        Map<String, WorkUnitIdentity> seen = new HashMap<>();
        for (WorkUnitIdentity identity : registry.all()) {
            for (String name : identity.allNames()) {
                String key = name.toLowerCase(Locale.ROOT);
                WorkUnitIdentity owner = seen.putIfAbsent(key, identity);
                if (owner == null) {
                    index.put(name, identity);
                } else if (!owner.equals(identity)) {
                    log.warn("registry.alias_conflict name={} keptFor={} ignoredFor={}",
                            name, owner.identifier(), identity.identifier());
                }
            }
        }
        return index;
    }
}
