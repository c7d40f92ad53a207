package com.identity.matching.registry;

import com.identity.matching.core.exception.DimensionMismatchException;
import com.identity.matching.core.exception.DuplicateIdentityException;
import com.identity.matching.core.exception.IdentityMatchingException;
import com.identity.matching.core.exception.InsufficientSamplesException;
import com.identity.matching.core.exception.MalformedRegistryException;
import com.identity.matching.core.exception.RegistryPersistenceException;
import com.identity.matching.core.exception.UnknownIdentityException;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.core.model.IdentitySummary;
import com.identity.matching.lock.LockAcquisitionException;
import com.identity.matching.lock.LockConfig;
import com.identity.matching.validation.EmbeddingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory collection of identity records with a fixed embedding dimension.
 *
 * <h2>Concurrency</h2>
 * <p>Reads return an immutable {@link RegistrySnapshot} without locking. Every mutation takes
 * a single registry-wide writer lock, builds the next snapshot, saves it through the
 * {@link RegistryStore} and only then publishes it. A failed save leaves the published
 * snapshot untouched, so callers never observe an unpersisted mutation and a concurrent
 * reader never sees a partially replaced record.</p>
 */
public class IdentityRegistry {
    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    public static final int DEFAULT_DIMENSION = 128;
    public static final double DEFAULT_THRESHOLD = 0.6;

    private static final AtomicLong INSTANCES = new AtomicLong();

    private final RegistryStore store;
    private final LockConfig lockConfig;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
    private final long instanceId = INSTANCES.incrementAndGet();
    private volatile RegistrySnapshot snapshot;

    private IdentityRegistry(RegistrySnapshot initial, RegistryStore store, LockConfig lockConfig) {
        this.snapshot = initial;
        this.store = store;
        this.lockConfig = lockConfig;
    }

    /**
     * Creates an empty registry backed by an {@link InMemoryRegistryStore}.
     */
    public static IdentityRegistry create(int dimension, double threshold) {
        return open(new InMemoryRegistryStore(), dimension, threshold, LockConfig.defaults());
    }

    /**
     * Opens a registry, hydrating it from the store when a snapshot was saved before.
     * The loaded data is validated and rejected on schema drift; the configured threshold
     * replaces the stored one.
     *
     * @throws DimensionMismatchException  if the stored dimension differs from {@code dimension}
     * @throws MalformedRegistryException  if a stored record violates the registry invariants
     */
    public static IdentityRegistry open(RegistryStore store, int dimension, double threshold,
                                        LockConfig lockConfig) {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(lockConfig, "lockConfig is required");

        RegistrySnapshot initial;
        Optional<RegistrySnapshot> loaded = loadFrom(store);
        if (loaded.isPresent()) {
            RegistrySnapshot stored = loaded.get();
            if (stored.getDimension() != dimension) {
                throw new DimensionMismatchException(dimension, stored.getDimension());
            }
            for (IdentityRecord record : stored.records()) {
                validateStored(record, dimension);
            }
            initial = stored.withThreshold(threshold);
            log.info("Registry loaded: identities={}, samples={}, dimension={}",
                    initial.size(), initial.totalSamples(), dimension);
        } else {
            initial = RegistrySnapshot.empty(dimension, threshold);
            log.info("Registry created empty: dimension={}, threshold={}", dimension, threshold);
        }
        return new IdentityRegistry(initial, store, lockConfig);
    }

    // ========== Reads ==========

    /**
     * Process-unique number of this registry. Snapshot versions restart at zero for every
     * registry; this id tells their snapshots apart.
     */
    public long getInstanceId() {
        return instanceId;
    }

    /**
     * Returns the current snapshot. Never blocks.
     */
    public RegistrySnapshot snapshot() {
        return snapshot;
    }

    public Optional<IdentityRecord> find(String identityId) {
        return snapshot.find(identityId);
    }

    public boolean contains(String identityId) {
        return snapshot.contains(identityId);
    }

    /**
     * Lists all identities in insertion order.
     */
    public List<IdentitySummary> list() {
        return snapshot.records().stream()
                .map(IdentityRecord::summary)
                .toList();
    }

    public int size() {
        return snapshot.size();
    }

    public int getDimension() {
        return snapshot.getDimension();
    }

    public double getThreshold() {
        return snapshot.getThreshold();
    }

    // ========== Writes ==========

    /**
     * Inserts a record, or replaces an existing one wholesale when {@code overwrite} is set.
     *
     * @throws DuplicateIdentityException   if the id exists and overwrite is false
     * @throws InsufficientSamplesException if the record has no samples
     * @throws DimensionMismatchException   if a sample has the wrong dimension
     */
    public IdentityRecord insert(IdentityRecord record, boolean overwrite) {
        Objects.requireNonNull(record, "record is required");
        String identityId = record.getIdentityId();
        EmbeddingValidator.validateIdentityId(identityId);
        if (!record.isEnrolled()) {
            throw new InsufficientSamplesException(identityId, 0, 1);
        }
        validateSamples(record.getSamples());

        acquire();
        try {
            RegistrySnapshot current = snapshot;
            boolean exists = current.contains(identityId);
            if (exists && !overwrite) {
                throw new DuplicateIdentityException(identityId);
            }
            LinkedHashMap<String, IdentityRecord> next = current.copyRecords();
            next.put(identityId, record);
            publish(current.next(next), exists ? RegistryChange.REPLACED : RegistryChange.INSERTED, identityId);
            return record;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Appends embeddings to an existing identity without resetting its counters.
     *
     * @throws UnknownIdentityException if the identity is absent
     */
    public IdentityRecord appendSamples(String identityId, List<Embedding> embeddings) {
        Objects.requireNonNull(embeddings, "embeddings is required");
        if (embeddings.isEmpty()) {
            throw new IllegalArgumentException("At least one embedding is required");
        }
        validateSamples(embeddings);

        acquire();
        try {
            RegistrySnapshot current = snapshot;
            IdentityRecord existing = current.find(identityId)
                    .orElseThrow(() -> new UnknownIdentityException(identityId));
            IdentityRecord updated = existing.withAppendedSamples(embeddings);
            LinkedHashMap<String, IdentityRecord> next = current.copyRecords();
            next.put(identityId, updated);
            publish(current.next(next), RegistryChange.SAMPLES_APPENDED, identityId);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Marks a successful verification: sets {@code lastMatchedAt} and increments the match count.
     * Callers invoke this only for accepted match results.
     *
     * @throws UnknownIdentityException if the identity is absent
     */
    public IdentityRecord recordSuccessfulMatch(String identityId, Instant at) {
        Objects.requireNonNull(at, "at is required");
        acquire();
        try {
            RegistrySnapshot current = snapshot;
            IdentityRecord existing = current.find(identityId)
                    .orElseThrow(() -> new UnknownIdentityException(identityId));
            IdentityRecord updated = existing.withSuccessfulMatch(at);
            LinkedHashMap<String, IdentityRecord> next = current.copyRecords();
            next.put(identityId, updated);
            publish(current.next(next), RegistryChange.MATCH_RECORDED, identityId);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes an identity.
     *
     * @return the removed record
     * @throws UnknownIdentityException if the identity is absent
     */
    public IdentityRecord remove(String identityId) {
        acquire();
        try {
            RegistrySnapshot current = snapshot;
            LinkedHashMap<String, IdentityRecord> next = current.copyRecords();
            IdentityRecord removed = next.remove(identityId);
            if (removed == null) {
                throw new UnknownIdentityException(identityId);
            }
            publish(current.next(next), RegistryChange.REMOVED, identityId);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes every identity.
     *
     * @return the number of identities removed
     */
    public int clear() {
        acquire();
        try {
            RegistrySnapshot current = snapshot;
            int removed = current.size();
            publish(current.next(new LinkedHashMap<>()), RegistryChange.CLEARED, null);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public void addListener(RegistryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }

    // ========== Internal ==========

    private void acquire() {
        try {
            if (!writeLock.tryLock(lockConfig.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire registry write lock within " + lockConfig.timeoutMs() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring registry write lock", e);
        }
    }

    private void publish(RegistrySnapshot next, RegistryChange change, String identityId) {
        try {
            store.save(next);
        } catch (IdentityMatchingException e) {
            log.error("registry.save.failed change={} identityId={} error={}", change, identityId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("registry.save.failed change={} identityId={} error={}", change, identityId, e.getMessage());
            throw new RegistryPersistenceException("Failed to persist registry change " + change, e);
        }
        snapshot = next;
        log.debug("registry.published change={} identityId={} version={} identities={}",
                change, identityId, next.getVersion(), next.size());

        for (RegistryListener listener : listeners) {
            try {
                listener.onRegistryChanged(change, identityId, next.getVersion());
            } catch (RuntimeException e) {
                log.warn("registry.listener.failed listener={} change={}",
                        listener.getClass().getSimpleName(), change, e);
            }
        }
    }

    private void validateSamples(List<Embedding> embeddings) {
        int dimension = snapshot.getDimension();
        for (Embedding embedding : embeddings) {
            EmbeddingValidator.validate(embedding, dimension);
        }
    }

    private static Optional<RegistrySnapshot> loadFrom(RegistryStore store) {
        try {
            return store.load();
        } catch (IdentityMatchingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RegistryPersistenceException("Failed to load registry", e);
        }
    }

    private static void validateStored(IdentityRecord record, int dimension) {
        try {
            EmbeddingValidator.validateIdentityId(record.getIdentityId());
        } catch (IllegalArgumentException e) {
            throw new MalformedRegistryException("Stored identity has an invalid id: " + e.getMessage(), e);
        }
        if (!record.isEnrolled()) {
            throw new MalformedRegistryException(
                    "Stored identity '" + record.getIdentityId() + "' has no samples");
        }
        for (Embedding embedding : record.getSamples()) {
            if (embedding.dimension() != dimension) {
                throw new MalformedRegistryException("Stored identity '" + record.getIdentityId()
                        + "' has a sample of dimension " + embedding.dimension() + ", expected " + dimension);
            }
            for (int i = 0; i < dimension; i++) {
                if (!Double.isFinite(embedding.component(i))) {
                    throw new MalformedRegistryException("Stored identity '" + record.getIdentityId()
                            + "' has a non-finite sample value at index " + i);
                }
            }
        }
    }
}
