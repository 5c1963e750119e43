package com.mapsheet.collection.resolve;

import com.mapsheet.collection.core.model.FileCategory;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The active collection period: its date and the file-name dates accepted for each category.
 * Categories without their own range use the default range.
 */
public final class CollectionPeriod {

    public static final int DEFAULT_PLAN_LOOKAHEAD_DAYS = 5;

    private final LocalDate collectionDate;
    private final DateRange defaultRange;
    private final Map<FileCategory, DateRange> categoryRanges;

    public CollectionPeriod(LocalDate collectionDate, DateRange defaultRange,
                            Map<FileCategory, DateRange> categoryRanges) {
        this.collectionDate = Objects.requireNonNull(collectionDate, "collectionDate is required");
        this.defaultRange = Objects.requireNonNull(defaultRange, "defaultRange is required");
        this.categoryRanges = categoryRanges.isEmpty()
                ? new EnumMap<>(FileCategory.class)
                : new EnumMap<>(categoryRanges);
    }

    /**
     * A period accepting only files dated on the collection date.
     */
    public static CollectionPeriod singleDay(LocalDate date) {
        return new CollectionPeriod(date, DateRange.single(date), Map.of());
    }

    /**
     * The daily field-survey period: finished observations are dated on the collection date,
     * planned routes on one of the following {@code planLookaheadDays} days.
     */
    public static CollectionPeriod daily(LocalDate date, int planLookaheadDays) {
        if (planLookaheadDays < 1) {
            throw new IllegalArgumentException("planLookaheadDays must be >= 1");
        }
        Map<FileCategory, DateRange> ranges = new EnumMap<>(FileCategory.class);
        ranges.put(FileCategory.FINISHED_OBSERVATIONS, DateRange.single(date));
        ranges.put(FileCategory.PLANNED_ROUTES, new DateRange(date.plusDays(1), date.plusDays(planLookaheadDays)));
        return new CollectionPeriod(date, DateRange.single(date), ranges);
    }

    public static CollectionPeriod daily(LocalDate date) {
        return daily(date, DEFAULT_PLAN_LOOKAHEAD_DAYS);
    }

    public LocalDate getCollectionDate() {
        return collectionDate;
    }

    public DateRange getDefaultRange() {
        return defaultRange;
    }

    public DateRange rangeFor(FileCategory category) {
        return categoryRanges.getOrDefault(category, defaultRange);
    }

    public boolean accepts(FileCategory category, LocalDate fileDate) {
        return rangeFor(category).contains(fileDate);
    }

    @Override
    public String toString() {
        return "CollectionPeriod{" +
                "collectionDate=" + collectionDate +
                ", defaultRange=" + defaultRange +
                ", categoryRanges=" + categoryRanges +
                '}';
    }
}
