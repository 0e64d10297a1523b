/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.schema;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * A get-or-compute cache which coalesces concurrent computations of the same
 * key: the first caller computes, and everyone else asking for that key in
 * the meantime waits for and receives the same result.
 *
 * <p>Entries live until they are explicitly invalidated, so failed results
 * should be values rather than exceptions if they are to be cached.
 *
 * @param <K> Type of key
 * @param <V> Type of value
 */
final class SchemaCache<K, V> {
    private final Map<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();

    /**
     * @param key The key to get the value of
     * @param compute Computes the value if it isn't cached or in flight
     * @return The cached or computed value
     */
    V getOrCompute(K key, Function<K, V> compute) {
        CompletableFuture<V> created = new CompletableFuture<>();
        CompletableFuture<V> existing = entries.putIfAbsent(key, created);
        if (existing != null) {
            return existing.join();
        }

        try {
            V value = compute.apply(key);
            created.complete(value);
            return value;
        } catch (RuntimeException e) {
            entries.remove(key, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * @param key The key to check
     * @return Whether a value for the key is cached or in flight
     */
    boolean contains(K key) {
        return entries.containsKey(key);
    }

    /**
     * @param key The key to drop
     */
    void invalidate(K key) {
        entries.remove(key);
    }

    /**
     * Drops every entry for which {@code predicate} returns true. Entries
     * still being computed are checked with a {@code null} value.
     *
     * @param predicate Decides whether to drop an entry
     */
    void invalidateIf(BiPredicate<K, V> predicate) {
        entries.entrySet().removeIf(entry -> predicate.test(entry.getKey(), entry.getValue().getNow(null)));
    }

    void clear() {
        entries.clear();
    }
}
