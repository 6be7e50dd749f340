package com.claude.budgetoptimizer.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * TTL 기반 캐시. 장부 시트와 리포트 조회 결과를 run 사이에 짧게 재사용한다.
 *
 * loader 는 락 밖에서 호출되므로 같은 키에 대한 동시 로딩이 드물게 중복될 수 있다.
 * 마지막에 끝난 값이 남는다.
 */
public class TimedCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public TimedCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public V get(K key, Function<K, V> loader) {
        Instant now = clock.instant();
        Entry<V> entry = entries.get(key);
        if (entry != null && entry.isValidAt(now)) {
            return entry.value;
        }
        V value = loader.apply(key);
        entries.put(key, new Entry<>(value, now.plus(ttl)));
        return value;
    }

    public Optional<V> getIfPresent(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null || !entry.isValidAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !e.getValue().isValidAt(now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isValidAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
