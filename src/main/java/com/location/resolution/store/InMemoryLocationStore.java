package com.location.resolution.store;

import com.location.resolution.core.model.LocationRecord;

import java.util.List;

/**
 * Immutable list-backed {@link LocationStore}.
 */
public class InMemoryLocationStore implements LocationStore {

    private final List<LocationRecord> records;

    public InMemoryLocationStore(List<LocationRecord> records) {
        this.records = List.copyOf(records);
    }

    public static InMemoryLocationStore empty() {
        return new InMemoryLocationStore(List.of());
    }

    @Override
    public List<LocationRecord> all() {
        return records;
    }

    @Override
    public int size() {
        return records.size();
    }
}
