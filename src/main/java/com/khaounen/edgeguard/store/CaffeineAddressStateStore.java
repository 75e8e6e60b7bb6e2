package com.khaounen.edgeguard.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Predicate;

public class CaffeineAddressStateStore<V> implements AddressStateStore<V> {

    private final String name;
    private final Cache<String, V> cache;

    public CaffeineAddressStateStore(String name) {
        this(name, Caffeine.newBuilder().executor(Runnable::run).build());
    }

    public CaffeineAddressStateStore(String name, Cache<String, V> cache) {
        this.name = name;
        this.cache = cache;
    }

    public String getName() {
        return name;
    }

    @Override
    public V get(String address) {
        return cache.getIfPresent(address);
    }

    @Override
    public void put(String address, V value) {
        cache.put(address, value);
    }

    @Override
    public V delete(String address) {
        return cache.asMap().remove(address);
    }

    @Override
    public V update(String address, BiFunction<String, V, V> remapping) {
        return cache.asMap().compute(address, remapping);
    }

    @Override
    public boolean removeIf(String address, Predicate<V> condition) {
        AtomicBoolean removed = new AtomicBoolean();
        cache.asMap().computeIfPresent(address, (key, existing) -> {
            if (condition.test(existing)) {
                removed.set(true);
                return null;
            }
            return existing;
        });
        return removed.get();
    }

    @Override
    public Map<String, V> snapshot() {
        return Map.copyOf(cache.asMap());
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }
}
