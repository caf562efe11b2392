package com.graphol.index.util;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Get-or-create and remove-then-prune helpers for two-level maps.
 *
 * Every removal drops the inner container once it becomes empty, so callers
 * never observe empty buckets.
 */
public class NestedMapUtil {

    private NestedMapUtil() {
        // Utility class
    }

    /**
     * Puts value under outer/inner, creating the inner map when missing.
     *
     * @return false if outer/inner was already mapped (the existing value is kept)
     */
    public static <K, I, V> boolean putIfAbsent(Map<K, Map<I, V>> map, K outer, I inner, V value) {
        return map.computeIfAbsent(outer, k -> new LinkedHashMap<>()).putIfAbsent(inner, value) == null;
    }

    /**
     * Adds value to the set under key, creating the set when missing.
     *
     * @return true if the set did not already contain value
     */
    public static <K, V> boolean addToBucket(Map<K, Set<V>> map, K key, V value) {
        return map.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
    }

    /**
     * Adds value to the set at outer/inner, creating the inner map and the set when missing.
     *
     * @return true if the set did not already contain value
     */
    public static <K, I, V> boolean addToNestedBucket(Map<K, Map<I, Set<V>>> map, K outer, I inner, V value) {
        return addToBucket(map.computeIfAbsent(outer, k -> new LinkedHashMap<>()), inner, value);
    }

    /**
     * Removes outer/inner and drops the inner map if it becomes empty.
     *
     * @return the removed value, or null if nothing was mapped
     */
    public static <K, I, V> V removeAndPrune(Map<K, Map<I, V>> map, K outer, I inner) {
        Map<I, V> bucket = map.get(outer);
        if (bucket == null) {
            return null;
        }
        V removed = bucket.remove(inner);
        if (bucket.isEmpty()) {
            map.remove(outer);
        }
        return removed;
    }

    /**
     * Removes value from the set under key and drops the set if it becomes empty.
     *
     * @return true if the value was present
     */
    public static <K, V> boolean removeFromBucket(Map<K, Set<V>> map, K key, V value) {
        Set<V> bucket = map.get(key);
        if (bucket == null) {
            return false;
        }
        boolean removed = bucket.remove(value);
        if (bucket.isEmpty()) {
            map.remove(key);
        }
        return removed;
    }

    /**
     * Removes value from the set at outer/inner, pruning the set and then the inner map
     * when they become empty.
     *
     * @return true if the value was present
     */
    public static <K, I, V> boolean removeFromNestedBucket(Map<K, Map<I, Set<V>>> map, K outer, I inner, V value) {
        Map<I, Set<V>> bucket = map.get(outer);
        if (bucket == null) {
            return false;
        }
        boolean removed = removeFromBucket(bucket, inner, value);
        if (bucket.isEmpty()) {
            map.remove(outer);
        }
        return removed;
    }
}
