package com.mapsheet.collection.monitor;

import com.mapsheet.collection.core.model.FileCategory;

import java.time.Duration;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Options for a monitoring period: when it ends, how often status is reported, when the
 * status turns urgent, and which categories each work unit owes.
 */
public class MonitorOptions {

    private static final LocalTime DEFAULT_DEADLINE = LocalTime.of(23, 59);
    private static final Duration DEFAULT_STATUS_INTERVAL = Duration.ofMinutes(10);
    private static final LocalTime DEFAULT_URGENT_AFTER = LocalTime.of(19, 0);
    private static final int DEFAULT_URGENT_REMAINING = 5;
    private static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private final LocalTime deadline;
    private final Duration statusInterval;
    private final LocalTime urgentAfter;
    private final int urgentRemaining;
    private final int queueCapacity;
    private final boolean backfillOnDeadline;
    private final Set<FileCategory> requiredCategories;

    private MonitorOptions(Builder builder) {
        this.deadline = builder.deadline;
        this.statusInterval = builder.statusInterval;
        this.urgentAfter = builder.urgentAfter;
        this.urgentRemaining = builder.urgentRemaining;
        this.queueCapacity = builder.queueCapacity;
        this.backfillOnDeadline = builder.backfillOnDeadline;
        this.requiredCategories = EnumSet.copyOf(builder.requiredCategories);
    }

    /**
     * Time of day, on the collection date, at which monitoring stops.
     */
    public LocalTime getDeadline() {
        return deadline;
    }

    public Duration getStatusInterval() {
        return statusInterval;
    }

    public LocalTime getUrgentAfter() {
        return urgentAfter;
    }

    /**
     * Status turns urgent once at most this many work units are outstanding.
     */
    public int getUrgentRemaining() {
        return urgentRemaining;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public boolean isBackfillOnDeadline() {
        return backfillOnDeadline;
    }

    public Set<FileCategory> getRequiredCategories() {
        return EnumSet.copyOf(requiredCategories);
    }

    public static MonitorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalTime deadline = DEFAULT_DEADLINE;
        private Duration statusInterval = DEFAULT_STATUS_INTERVAL;
        private LocalTime urgentAfter = DEFAULT_URGENT_AFTER;
        private int urgentRemaining = DEFAULT_URGENT_REMAINING;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private boolean backfillOnDeadline = true;
        private Set<FileCategory> requiredCategories = EnumSet.allOf(FileCategory.class);

        public Builder deadline(LocalTime deadline) {
            this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
            return this;
        }

        public Builder statusInterval(Duration statusInterval) {
            Objects.requireNonNull(statusInterval, "statusInterval must not be null");
            if (statusInterval.isNegative() || statusInterval.isZero()) {
                throw new IllegalArgumentException("statusInterval must be positive");
            }
            this.statusInterval = statusInterval;
            return this;
        }

        public Builder urgentAfter(LocalTime urgentAfter) {
            this.urgentAfter = Objects.requireNonNull(urgentAfter, "urgentAfter must not be null");
            return this;
        }

        public Builder urgentRemaining(int urgentRemaining) {
            if (urgentRemaining < 0) {
                throw new IllegalArgumentException("urgentRemaining must not be negative");
            }
            this.urgentRemaining = urgentRemaining;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("queueCapacity must be positive");
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder backfillOnDeadline(boolean backfillOnDeadline) {
            this.backfillOnDeadline = backfillOnDeadline;
            return this;
        }

        public Builder requiredCategories(Set<FileCategory> requiredCategories) {
            if (requiredCategories == null || requiredCategories.isEmpty()) {
                throw new IllegalArgumentException("requiredCategories must not be empty");
            }
            this.requiredCategories = requiredCategories;
            return this;
        }

        public MonitorOptions build() {
            return new MonitorOptions(this);
        }
    }
}
