package com.autonomous.dogwalker.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-process store with per-key expiry. Every operation holds the
 * store's monitor, which gives the same atomicity the shared store offers.
 */
public class InMemoryCoordinationStore implements CoordinationStore {

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();

    public InMemoryCoordinationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Entry entry = live(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.scalar);
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        entries.put(key, Entry.scalar(value, expiry(ttl)));
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (live(key) != null) {
            return false;
        }
        entries.put(key, Entry.scalar(value, expiry(ttl)));
        return true;
    }

    @Override
    public synchronized boolean setAllIfAbsent(Map<String, String> values, Duration ttl) {
        for (String key : values.keySet()) {
            if (live(key) != null) {
                return false;
            }
        }
        Instant expiresAt = expiry(ttl);
        values.forEach((key, value) -> entries.put(key, Entry.scalar(value, expiresAt)));
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        boolean existed = live(key) != null;
        entries.remove(key);
        return existed;
    }

    @Override
    public synchronized long increment(String key, Duration ttl) {
        long next = getLong(key) + 1;
        entries.put(key, Entry.scalar(Long.toString(next), expiry(ttl)));
        return next;
    }

    @Override
    public synchronized long decrementFloorZero(String key) {
        Entry entry = live(key);
        if (entry == null) {
            return 0;
        }
        long next = Math.max(0, Long.parseLong(entry.scalar) - 1);
        entry.scalar = Long.toString(next);
        return next;
    }

    @Override
    public synchronized long getLong(String key) {
        Entry entry = live(key);
        return entry == null ? 0 : Long.parseLong(entry.scalar);
    }

    @Override
    public synchronized long append(String key, String value, Duration ttl) {
        Entry entry = live(key);
        if (entry == null) {
            entry = Entry.list(expiry(ttl));
            entries.put(key, entry);
        } else {
            entry.expiresAt = expiry(ttl);
        }
        entry.list.add(value);
        return entry.list.size();
    }

    @Override
    public synchronized long length(String key) {
        Entry entry = live(key);
        return entry == null ? 0 : entry.list.size();
    }

    @Override
    public synchronized List<String> range(String key, long from, long to) {
        Entry entry = live(key);
        if (entry == null || from >= entry.list.size() || from > to) {
            return List.of();
        }
        int end = (int) Math.min(to + 1, entry.list.size());
        return List.copyOf(entry.list.subList((int) from, end));
    }

    @Override
    public synchronized boolean advance(String key, long value, Duration ttl) {
        if (getLong(key) >= value) {
            return false;
        }
        entries.put(key, Entry.scalar(Long.toString(value), expiry(ttl)));
        return true;
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry != null && entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private static final class Entry {
        private String scalar;
        private List<String> list;
        private Instant expiresAt;

        static Entry scalar(String value, Instant expiresAt) {
            Entry entry = new Entry();
            entry.scalar = value;
            entry.expiresAt = expiresAt;
            return entry;
        }

        static Entry list(Instant expiresAt) {
            Entry entry = new Entry();
            entry.list = new ArrayList<>();
            entry.expiresAt = expiresAt;
            return entry;
        }
    }
}
