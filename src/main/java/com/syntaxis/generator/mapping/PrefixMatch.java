package com.syntaxis.generator.mapping;

import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a {@link PrefixIndex} lookup.
 *
 * @param <V> value stored against each key
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PrefixMatch<V> {

    public enum Kind {
        /** The query is itself a key. */
        EXACT,
        /** The query is a prefix of exactly one key. */
        UNIQUE,
        /** The query is a prefix of several keys. */
        AMBIGUOUS,
        /** No key starts with the query. */
        NOT_FOUND
    }

    Kind kind;
    String query;
    String key;
    V value;
    List<String> candidates;

    static <V> PrefixMatch<V> exact(String query, V value) {
        return new PrefixMatch<>(Kind.EXACT, query, query, value, List.of(query));
    }

    static <V> PrefixMatch<V> unique(String query, String key, V value) {
        return new PrefixMatch<>(Kind.UNIQUE, query, key, value, List.of(key));
    }

    static <V> PrefixMatch<V> ambiguous(String query, List<String> candidates) {
        return new PrefixMatch<>(Kind.AMBIGUOUS, query, null, null, List.copyOf(candidates));
    }

    static <V> PrefixMatch<V> notFound(String query) {
        return new PrefixMatch<>(Kind.NOT_FOUND, query, null, null, List.of());
    }

    public boolean isResolved() {
        return kind == Kind.EXACT || kind == Kind.UNIQUE;
    }

    public Optional<V> toOptional() {
        return Optional.ofNullable(value);
    }
}
