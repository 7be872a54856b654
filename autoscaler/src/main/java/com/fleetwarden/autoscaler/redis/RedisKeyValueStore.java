package com.fleetwarden.autoscaler.redis;

import com.fleetwarden.autoscaler.config.AutoscalerConfig;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reactive Redis store backing shutdown flags, stats blobs and the audit trail.
 * <p>
 * All operations are non-blocking using Lettuce reactive API; commands issued
 * concurrently on the shared connection are pipelined by the client.
 * </p>
 */
public class RedisKeyValueStore implements IKeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisKeyValueStore(AutoscalerConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<String> get(String key) {
        return commands.get(key)
            .doOnError(err -> log.error("Failed to get {}", key, err));
    }

    @Override
    public Mono<String> setEx(String key, String value, long ttlSeconds) {
        return commands.set(key, value, SetArgs.Builder.ex(ttlSeconds))
            .doOnError(err -> log.error("Failed to set {}", key, err));
    }

    @Override
    public Mono<List<String>> setAllEx(Map<String, String> values, long ttlSeconds) {
        return Flux.fromIterable(values.entrySet())
            .flatMapSequential(entry -> setEx(entry.getKey(), entry.getValue(), ttlSeconds))
            .collectList();
    }

    @Override
    public Mono<Boolean> expire(String key, long ttlSeconds) {
        return commands.expire(key, ttlSeconds);
    }

    @Override
    public Mono<ScanPage> scan(String cursor, String match, int count) {
        ScanArgs args = ScanArgs.Builder.matches(match).limit(count);
        return commands.scan(ScanCursor.of(cursor), args)
            .map(this::toPage)
            .doOnError(err -> log.error("Failed to scan {} at cursor {}", match, cursor, err));
    }

    private ScanPage toPage(KeyScanCursor<String> scanCursor) {
        String next = scanCursor.isFinished() ? ScanPage.INITIAL_CURSOR : scanCursor.getCursor();
        return new ScanPage(next, List.copyOf(scanCursor.getKeys()));
    }

    @Override
    public Mono<Map<String, String>> getAll(List<String> keys) {
        if (keys.isEmpty()) {
            return Mono.just(Map.of());
        }
        return commands.mget(keys.toArray(String[]::new))
            .filter(KeyValue::hasValue)
            .collect(LinkedHashMap<String, String>::new, (map, kv) -> map.put(kv.getKey(), kv.getValue()))
            .map(map -> (Map<String, String>) map)
            .doOnError(err -> log.error("Failed to fetch {} keys", keys.size(), err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
