package com.autonomous.dogwalker.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared key-value/list store every worker process sees the same view of.
 * All mutations are single atomic operations; callers never read a value,
 * change it locally and write it back.
 *
 * Implementations throw {@link com.autonomous.dogwalker.exception.StoreUnavailableException}
 * when the backing store cannot be reached.
 */
public interface CoordinationStore {

    void ping();

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Writes every entry with the same TTL if and only if none of the keys exist.
     */
    boolean setAllIfAbsent(Map<String, String> entries, Duration ttl);

    /** @return true if the key existed */
    boolean delete(String key);

    long increment(String key, Duration ttl);

    /** Decrements, never going below zero. Returns the new value. */
    long decrementFloorZero(String key);

    long getLong(String key);

    /** Appends to the tail of a list and returns the list's new length. */
    long append(String key, String value, Duration ttl);

    long length(String key);

    /** Elements {@code from} through {@code to}, both inclusive and zero-based. */
    List<String> range(String key, long from, long to);

    /**
     * Moves a numeric cursor forward to {@code value}. A cursor never moves back.
     *
     * @return true if the cursor was advanced
     */
    boolean advance(String key, long value, Duration ttl);
}
