package com.syntaxis.generator.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable sorted index answering "which keys start with this text?".
 *
 * Keys sharing a prefix are contiguous in sorted order, so every lookup is a single
 * range view over the backing map.
 *
 * @param <V> value stored against each key
 */
public final class PrefixIndex<V> {

    private final NavigableMap<String, V> entries;

    public PrefixIndex(Map<String, V> entries) {
        this.entries = Collections.unmodifiableNavigableMap(new TreeMap<>(entries));
    }

    public PrefixMatch<V> lookup(String query) {
        if (query == null || query.isEmpty()) {
            return PrefixMatch.notFound(query);
        }

        V exact = entries.get(query);
        if (exact != null) {
            return PrefixMatch.exact(query, exact);
        }

        SortedMap<String, V> range = entries.subMap(query, query + Character.MAX_VALUE);
        if (range.isEmpty()) {
            return PrefixMatch.notFound(query);
        }
        if (range.size() == 1) {
            Map.Entry<String, V> only = range.entrySet().iterator().next();
            return PrefixMatch.unique(query, only.getKey(), only.getValue());
        }
        return PrefixMatch.ambiguous(query, new ArrayList<>(range.keySet()));
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
