package com.mapsheet.collection.monitor;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.WorkUnitIdentity;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Completion state of one work unit for the active period.
 *
 * <p>Status is derived from the satisfied categories and can only move forward:
 * PENDING, PARTIALLY_SATISFIED, SATISFIED. Satisfying a category again only replaces the
 * remembered file. A backfilled file never replaces a live one.</p>
 *
 * <p>Not thread-safe. The monitor's dispatch loop is the only writer.</p>
 */
public class WorkUnitState {

    private final WorkUnitIdentity identity;
    private final Set<FileCategory> requiredCategories;
    private final Map<FileCategory, Satisfaction> satisfied = new EnumMap<>(FileCategory.class);
    private Instant lastUpdated;

    public WorkUnitState(WorkUnitIdentity identity) {
        this(identity, EnumSet.allOf(FileCategory.class));
    }

    public WorkUnitState(WorkUnitIdentity identity, Set<FileCategory> requiredCategories) {
        this.identity = Objects.requireNonNull(identity, "identity is required");
        if (requiredCategories == null || requiredCategories.isEmpty()) {
            throw new IllegalArgumentException("At least one required category is needed");
        }
        this.requiredCategories = Collections.unmodifiableSet(EnumSet.copyOf(requiredCategories));
    }

    /**
     * Records the file satisfying a category.
     *
     * @return true if the work unit's status changed
     */
    public boolean markSatisfied(FileCategory category, Satisfaction satisfaction) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(satisfaction, "satisfaction must not be null");
        CollectionStatus before = status();
        Satisfaction existing = satisfied.get(category);
        if (existing != null
                && existing.source() == SatisfactionSource.LIVE
                && satisfaction.source() == SatisfactionSource.BACKFILL) {
            return false;
        }
        satisfied.put(category, satisfaction);
        lastUpdated = satisfaction.at();
        return status() != before;
    }

    public CollectionStatus status() {
        long done = requiredCategories.stream().filter(satisfied::containsKey).count();
        if (done == 0) {
            return CollectionStatus.PENDING;
        }
        return done == requiredCategories.size() ? CollectionStatus.SATISFIED : CollectionStatus.PARTIALLY_SATISFIED;
    }

    public boolean isSatisfied() {
        return status() == CollectionStatus.SATISFIED;
    }

    public boolean isSatisfied(FileCategory category) {
        return satisfied.containsKey(category);
    }

    /**
     * Required categories not yet satisfied, in declaration order.
     */
    public Set<FileCategory> outstanding() {
        EnumSet<FileCategory> outstanding = EnumSet.noneOf(FileCategory.class);
        for (FileCategory category : requiredCategories) {
            if (!satisfied.containsKey(category)) {
                outstanding.add(category);
            }
        }
        return outstanding;
    }

    public Optional<Satisfaction> satisfaction(FileCategory category) {
        return Optional.ofNullable(satisfied.get(category));
    }

    public Optional<String> lastSatisfyingFileName(FileCategory category) {
        return satisfaction(category).map(Satisfaction::fileName);
    }

    public WorkUnitIdentity getIdentity() {
        return identity;
    }

    public Set<FileCategory> getRequiredCategories() {
        return requiredCategories;
    }

    /**
     * Time of the last recorded satisfaction, null while nothing was recorded.
     */
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "WorkUnitState{" + identity.identifier() + ", " + status() + ", outstanding=" + outstanding() + '}';
    }
}
