package com.khaounen.edgeguard.store;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * {@link #update} and {@link #removeIf} are atomic per key. Nothing is evicted implicitly.
 */
public interface AddressStateStore<V> {

    V get(String address);

    void put(String address, V value);

    V delete(String address);

    V update(String address, BiFunction<String, V, V> remapping);

    boolean removeIf(String address, Predicate<V> condition);

    Map<String, V> snapshot();

    long size();
}
