package com.fleetwarden.autoscaler.redis;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * TTL-capable key-value store used by the flag and audit stores (Dependency Inversion Principle).
 * <p>
 * Enables testing with in-memory implementations and future Redis client swaps.
 * No operation spans keys transactionally.
 * </p>
 */
public interface IKeyValueStore {

    String OK = "OK";

    /**
     * Reads a value; empty when the key is absent or expired.
     */
    Mono<String> get(String key);

    /**
     * Writes a value with an expiry.
     *
     * @return the store's reply, {@link #OK} on success
     */
    Mono<String> setEx(String key, String value, long ttlSeconds);

    /**
     * Pipelines one write per entry, all with the same expiry.
     * Entries may be applied partially if the batch fails midway.
     *
     * @return the store's replies in entry iteration order
     */
    Mono<List<String>> setAllEx(Map<String, String> values, long ttlSeconds);

    /**
     * Resets the expiry of an existing key without touching its value.
     *
     * @return false when the key does not exist
     */
    Mono<Boolean> expire(String key, long ttlSeconds);

    /**
     * Fetches one page of keys matching a glob-style pattern.
     *
     * @param cursor {@link ScanPage#INITIAL_CURSOR} to start, then the cursor of the previous page
     * @param count  page size hint
     */
    Mono<ScanPage> scan(String cursor, String match, int count);

    /**
     * Batched read. Keys without a value are left out; the map keeps the order of {@code keys}.
     */
    Mono<Map<String, String>> getAll(List<String> keys);

    /**
     * Closes the underlying connection.
     */
    void close();
}
