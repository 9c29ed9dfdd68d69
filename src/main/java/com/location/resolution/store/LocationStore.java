package com.location.resolution.store;

import com.location.resolution.core.model.LocationRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Read-only reference table of curated locations.
 * Records are loaded once and never mutated at query time.
 */
public interface LocationStore {

    /**
     * Returns every record in load order.
     */
    List<LocationRecord> all();

    default int size() {
        return all().size();
    }

    /**
     * Returns the distinct regions of the store, sorted.
     */
    default List<String> regions() {
        TreeSet<String> regions = new TreeSet<>();
        for (LocationRecord record : all()) {
            if (!record.region().isEmpty()) {
                regions.add(record.region());
            }
        }
        return List.copyOf(regions);
    }

    /**
     * Returns the records of a region, largest population first.
     */
    default List<LocationRecord> citiesByRegion(String region) {
        return all().stream()
                .filter(r -> Objects.equals(r.region(), region))
                .sorted(Comparator.comparingLong(LocationRecord::populationOrZero).reversed())
                .toList();
    }
}
