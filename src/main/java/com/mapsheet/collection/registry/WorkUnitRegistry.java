package com.mapsheet.collection.registry;

import com.mapsheet.collection.core.model.WorkUnitIdentity;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable set of the work units expected to submit during a collection period.
 * Order is significant: it breaks ties between equally similar names.
 */
public final class WorkUnitRegistry {

    private final List<WorkUnitIdentity> workUnits;
    private final Map<String, WorkUnitIdentity> byIdentifier;

    public WorkUnitRegistry(List<WorkUnitIdentity> workUnits) {
        Objects.requireNonNull(workUnits, "workUnits must not be null");
        this.workUnits = List.copyOf(workUnits);
        this.byIdentifier = new HashMap<>();
        for (WorkUnitIdentity unit : this.workUnits) {
            if (byIdentifier.putIfAbsent(key(unit.identifier()), unit) != null) {
                throw new IllegalArgumentException("Duplicate work unit identifier: " + unit.identifier());
            }
        }
    }

    public static WorkUnitRegistry of(WorkUnitIdentity... workUnits) {
        return new WorkUnitRegistry(List.of(workUnits));
    }

    public static WorkUnitRegistry empty() {
        return new WorkUnitRegistry(List.of());
    }

    public List<WorkUnitIdentity> all() {
        return workUnits;
    }

    /**
     * Looks up a work unit by identifier, ignoring case.
     */
    public Optional<WorkUnitIdentity> find(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byIdentifier.get(key(identifier)));
    }

    public int size() {
        return workUnits.size();
    }

    public boolean isEmpty() {
        return workUnits.isEmpty();
    }

    private static String key(String identifier) {
        return identifier.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "WorkUnitRegistry{size=" + workUnits.size() + '}';
    }
}
