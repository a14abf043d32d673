package com.fintech.papertrading.marketdata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Insertion-ordered history for many assets with a per-asset capacity.
 *
 * <p>Eviction is scoped per asset: appending to a full asset drops that asset's
 * oldest entry only, so a quiet asset never loses history to a noisy one.
 *
 * <p>Not thread-safe. Guarded by the {@code TradingState} lock.
 *
 * @param <T> entry type
 */
public class BoundedSeries<T> {

    private final int capacity;
    private final Function<T, String> assetOf;
    private final Map<String, Deque<T>> entries = new HashMap<>();

    public BoundedSeries(int capacity, Function<T, String> assetOf) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.assetOf = assetOf;
    }

    /**
     * Appends an entry, evicting the oldest entry of the same asset when over capacity.
     *
     * @return the evicted entry, if any
     */
    public Optional<T> append(T entry) {
        Deque<T> series = entries.computeIfAbsent(assetOf.apply(entry), k -> new ArrayDeque<>());
        series.addLast(entry);
        if (series.size() > capacity) {
            return Optional.of(series.removeFirst());
        }
        return Optional.empty();
    }

    public Optional<T> latest(String asset) {
        Deque<T> series = entries.get(asset);
        return series == null ? Optional.empty() : Optional.ofNullable(series.peekLast());
    }

    /**
     * Returns the last {@code limit} entries for an asset, oldest first.
     * Returns fewer when history is short and an empty list for unknown assets.
     */
    public List<T> last(String asset, int limit) {
        Deque<T> series = entries.get(asset);
        if (series == null || limit <= 0) {
            return Collections.emptyList();
        }
        int count = Math.min(limit, series.size());
        List<T> result = new ArrayList<>(count);
        Iterator<T> newestFirst = series.descendingIterator();
        for (int i = 0; i < count; i++) {
            result.add(newestFirst.next());
        }
        Collections.reverse(result);
        return result;
    }

    public int size(String asset) {
        Deque<T> series = entries.get(asset);
        return series == null ? 0 : series.size();
    }

    public int capacity() {
        return capacity;
    }

    public Set<String> assets() {
        return Collections.unmodifiableSet(entries.keySet());
    }
}
