package com.identity.matching.registry;

import com.identity.matching.core.model.IdentityRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, versioned view of the registry at one point in time.
 * Records keep insertion order. Readers hold a snapshot without any lock;
 * writers publish a new snapshot instead of changing this one.
 */
public final class RegistrySnapshot {
    private final long version;
    private final int dimension;
    private final double threshold;
    private final Map<String, IdentityRecord> records;

    private RegistrySnapshot(long version, int dimension, double threshold,
                             LinkedHashMap<String, IdentityRecord> records) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        if (!Double.isFinite(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be a finite non-negative number");
        }
        this.version = version;
        this.dimension = dimension;
        this.threshold = threshold;
        this.records = Collections.unmodifiableMap(records);
    }

    public static RegistrySnapshot empty(int dimension, double threshold) {
        return new RegistrySnapshot(0, dimension, threshold, new LinkedHashMap<>());
    }

    /**
     * Creates a snapshot holding the given records in order.
     *
     * @throws IllegalArgumentException if two records share an identity id
     */
    public static RegistrySnapshot of(int dimension, double threshold, List<IdentityRecord> records) {
        LinkedHashMap<String, IdentityRecord> map = new LinkedHashMap<>();
        for (IdentityRecord record : records) {
            if (map.putIfAbsent(record.getIdentityId(), record) != null) {
                throw new IllegalArgumentException("Duplicate identity id: " + record.getIdentityId());
            }
        }
        return new RegistrySnapshot(0, dimension, threshold, map);
    }

    /**
     * Returns the successor snapshot holding the given records.
     */
    RegistrySnapshot next(LinkedHashMap<String, IdentityRecord> nextRecords) {
        return new RegistrySnapshot(version + 1, dimension, threshold, nextRecords);
    }

    RegistrySnapshot withThreshold(double newThreshold) {
        return new RegistrySnapshot(version, dimension, newThreshold, new LinkedHashMap<>(records));
    }

    LinkedHashMap<String, IdentityRecord> copyRecords() {
        return new LinkedHashMap<>(records);
    }

    public long getVersion() {
        return version;
    }

    public int getDimension() {
        return dimension;
    }

    public double getThreshold() {
        return threshold;
    }

    public List<IdentityRecord> records() {
        return List.copyOf(records.values());
    }

    public Set<String> identityIds() {
        return records.keySet();
    }

    public Optional<IdentityRecord> find(String identityId) {
        return Optional.ofNullable(records.get(identityId));
    }

    public boolean contains(String identityId) {
        return records.containsKey(identityId);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int totalSamples() {
        int total = 0;
        for (IdentityRecord record : records.values()) {
            total += record.sampleCount();
        }
        return total;
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{" +
                "version=" + version +
                ", dimension=" + dimension +
                ", threshold=" + threshold +
                ", identities=" + records.size() +
                '}';
    }
}
