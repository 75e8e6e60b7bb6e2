package com.khaounen.edgeguard.store;

import java.time.Instant;

@FunctionalInterface
public interface IdleEvictable {

    int evictIdle(Instant cutoff);
}
