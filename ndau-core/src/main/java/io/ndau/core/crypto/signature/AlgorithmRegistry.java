// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.ndau.core.DebugLogger;
import io.ndau.core.error.KeyException;

/**
 * Maps the one-byte algorithm ids used on the wire to {@link Algorithm} implementations.
 *
 * <p>
 * Every registry starts with the built-ins: {@code 0} {@link NullAlgorithm},
 * {@code 1} {@link Ed25519Algorithm} and {@code 2} {@link Secp256k1Algorithm}. Ids below
 * {@value #FIRST_EXTENSION_ID} are reserved; callers may bind their own algorithms to ids
 * from {@value #FIRST_EXTENSION_ID} to 255. Id {@code 0} always denotes the null
 * algorithm.
 *
 * <p>
 * A name-to-id index is rebuilt on each registration. When one name is bound to several
 * ids, the lowest id wins.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Lookups take the read lock and registrations the write lock, so a registry may be
 * extended while other threads decode keys.
 *
 * @since 0.1.0
 */
public final class AlgorithmRegistry {

    /** Lowest id callers may register. */
    public static final int FIRST_EXTENSION_ID = 128;

    private static final AlgorithmRegistry DEFAULT = new AlgorithmRegistry();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Integer, Algorithm> byId = new TreeMap<>();
    private Map<String, Integer> idByName = Collections.emptyMap();

    /**
     * Creates a registry holding only the built-in algorithms.
     */
    public AlgorithmRegistry() {
        bind(0, NullAlgorithm.INSTANCE);
        bind(1, Ed25519Algorithm.INSTANCE);
        bind(2, Secp256k1Algorithm.INSTANCE);
    }

    /**
     * Returns the process-wide registry used by the decoding methods that take none.
     *
     * @return the default registry
     */
    public static AlgorithmRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Returns whether two algorithms are the same named algorithm.
     *
     * @param a first algorithm
     * @param b second algorithm
     * @return {@code true} if both have the same {@link Algorithm#name()}
     */
    public static boolean sameAlgorithm(final Algorithm a, final Algorithm b) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        return a.name().equals(b.name());
    }

    /**
     * Binds an extension algorithm to an id.
     *
     * <p>
     * Registering an algorithm under an id that already holds an algorithm of the same name
     * is a no-op.
     *
     * @param id        id from {@value #FIRST_EXTENSION_ID} to 255
     * @param algorithm the algorithm
     * @throws IllegalArgumentException if the id is reserved, out of range, or bound to a
     *                                  differently named algorithm
     */
    public void register(final int id, final Algorithm algorithm) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        if (id < FIRST_EXTENSION_ID || id > 0xFF) {
            throw new IllegalArgumentException(
                    "algorithm ids below " + FIRST_EXTENSION_ID + " are reserved and ids above 255 do not exist: " + id);
        }

        lock.writeLock().lock();
        try {
            final Algorithm existing = byId.get(id);
            if (existing != null && !sameAlgorithm(existing, algorithm)) {
                throw new IllegalArgumentException(
                        "algorithm id " + id + " is already bound to " + existing.name());
            }
            bind(id, algorithm);
        } finally {
            lock.writeLock().unlock();
        }
        DebugLogger.logKeys("[REGISTER] algorithm=%s id=%d", algorithm.name(), id);
    }

    /**
     * Returns the algorithm bound to an id.
     *
     * @param id the wire id
     * @return the algorithm
     * @throws KeyException with kind UNKNOWN_ALGORITHM if nothing is bound to the id
     */
    public Algorithm byId(final int id) {
        if (id == 0) {
            return NullAlgorithm.INSTANCE;
        }
        lock.readLock().lock();
        try {
            final Algorithm algorithm = byId.get(id);
            if (algorithm == null) {
                throw KeyException.unknownAlgorithm(id);
            }
            return algorithm;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the id an algorithm is bound to.
     *
     * @param algorithm the algorithm
     * @return its id, or empty if no id holds an algorithm of that name
     */
    public OptionalInt idOf(final Algorithm algorithm) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        lock.readLock().lock();
        try {
            final Integer id = idByName.get(algorithm.name());
            return id == null ? OptionalInt.empty() : OptionalInt.of(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the id an algorithm is bound to, failing if there is none.
     *
     * @param algorithm the algorithm
     * @return its id
     * @throws KeyException with kind UNKNOWN_ALGORITHM if the algorithm is not registered
     */
    public int requireId(final Algorithm algorithm) {
        final OptionalInt id = idOf(algorithm);
        if (id.isEmpty()) {
            throw KeyException.unknownAlgorithm(algorithm.name());
        }
        return id.getAsInt();
    }

    /**
     * Returns the name of the algorithm bound to an id.
     *
     * @param id the wire id
     * @return the algorithm name
     * @throws KeyException with kind UNKNOWN_ALGORITHM if nothing is bound to the id
     */
    public String nameOf(final int id) {
        return byId(id).name();
    }

    // Caller holds the write lock, or is the constructor.
    private void bind(final int id, final Algorithm algorithm) {
        byId.put(id, algorithm);

        final Map<String, Integer> index = new HashMap<>();
        for (final Map.Entry<Integer, Algorithm> entry : byId.entrySet()) {
            index.putIfAbsent(entry.getValue().name(), entry.getKey());
        }
        idByName = Collections.unmodifiableMap(index);
    }
}
