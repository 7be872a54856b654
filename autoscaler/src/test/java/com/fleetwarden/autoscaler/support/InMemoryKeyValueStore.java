package com.fleetwarden.autoscaler.support;

import com.fleetwarden.autoscaler.redis.IKeyValueStore;
import com.fleetwarden.autoscaler.redis.ScanPage;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory store with TTLs driven by a test clock and SCAN pagination over the sorted key set.
 * <p>
 * The cursor is the index of the next key to examine; {@code count} keys are examined per page,
 * so a page may come back with fewer matches (or none) before the scan finishes.
 * </p>
 */
public class InMemoryKeyValueStore implements IKeyValueStore {

    private final Clock clock;
    private final TreeMap<String, Entry> entries = new TreeMap<>();
    private final List<String> scannedPatterns = new ArrayList<>();
    private int scanCalls;
    private boolean repeatLastKeyOnNextPage;
    private final List<String> fetchedKeys = new ArrayList<>();
    private String setReply = OK;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    private record Entry(String value, long expiresAtMs) {
    }

    /**
     * Makes every subsequent write answer with the given reply instead of storing the value.
     */
    public void failWritesWith(String reply) {
        this.setReply = reply;
    }

    public synchronized void put(String key, String value, long ttlSeconds) {
        entries.put(key, new Entry(value, clock.millis() + ttlSeconds * 1000));
    }

    /**
     * Remaining time to live in seconds, empty when the key is absent or expired.
     */
    public synchronized Optional<Long> ttl(String key) {
        return live(key).map(entry -> (entry.expiresAtMs() - clock.millis()) / 1000);
    }

    public synchronized Optional<String> value(String key) {
        return live(key).map(Entry::value);
    }

    public synchronized List<String> keys(String match) {
        Pattern pattern = globToRegex(match);
        return entries.keySet().stream()
            .filter(key -> live(key).isPresent())
            .filter(key -> pattern.matcher(key).matches())
            .collect(Collectors.toList());
    }

    /**
     * Makes every page after the first re-examine the last key of the previous page, the way a real
     * SCAN may return a key twice while the keyspace is rehashed.
     */
    public void repeatLastKeyOnNextPage() {
        this.repeatLastKeyOnNextPage = true;
    }

    /**
     * Every key requested through {@link #getAll(List)}, in request order.
     */
    public synchronized List<String> getFetchedKeys() {
        return List.copyOf(fetchedKeys);
    }

    public int getScanCalls() {
        return scanCalls;
    }

    public List<String> getScannedPatterns() {
        return scannedPatterns;
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= clock.millis()) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> value(key).orElse(null));
    }

    @Override
    public Mono<String> setEx(String key, String value, long ttlSeconds) {
        return Mono.fromCallable(() -> {
            if (OK.equals(setReply)) {
                put(key, value, ttlSeconds);
            }
            return setReply;
        });
    }

    @Override
    public Mono<List<String>> setAllEx(Map<String, String> values, long ttlSeconds) {
        return Mono.fromCallable(() -> {
            List<String> replies = new ArrayList<>();
            for (Map.Entry<String, String> value : values.entrySet()) {
                if (OK.equals(setReply)) {
                    put(value.getKey(), value.getValue(), ttlSeconds);
                }
                replies.add(setReply);
            }
            return replies;
        });
    }

    @Override
    public Mono<Boolean> expire(String key, long ttlSeconds) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Optional<Entry> entry = live(key);
                entry.ifPresent(e -> entries.put(key, new Entry(e.value(), clock.millis() + ttlSeconds * 1000)));
                return entry.isPresent();
            }
        });
    }

    @Override
    public Mono<ScanPage> scan(String cursor, String match, int count) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                scanCalls++;
                scannedPatterns.add(match);
                Pattern pattern = globToRegex(match);
                List<String> allKeys = new ArrayList<>(entries.keySet());
                int start = Integer.parseInt(cursor);
                int end = Math.min(start + count, allKeys.size());
                int from = repeatLastKeyOnNextPage && start > 0 ? start - 1 : start;
                List<String> matched = allKeys.subList(from, end).stream()
                    .filter(key -> pattern.matcher(key).matches())
                    .collect(Collectors.toList());
                String next = end >= allKeys.size() ? ScanPage.INITIAL_CURSOR : String.valueOf(end);
                return new ScanPage(next, matched);
            }
        });
    }

    @Override
    public Mono<Map<String, String>> getAll(List<String> keys) {
        return Mono.fromCallable(() -> {
            Map<String, String> result = new LinkedHashMap<>();
            synchronized (this) {
                fetchedKeys.addAll(keys);
            }
            for (String key : keys) {
                value(key).ifPresent(value -> result.put(key, value));
            }
            return result;
        });
    }

    @Override
    public void close() {
        // Nothing to release
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        char[] chars = glob.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c == '\\' && i + 1 < chars.length) {
                regex.append(Pattern.quote(String.valueOf(chars[++i])));
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
