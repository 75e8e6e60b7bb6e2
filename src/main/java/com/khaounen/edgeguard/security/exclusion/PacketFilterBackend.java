package com.khaounen.edgeguard.security.exclusion;

import java.util.Set;

/**
 * All operations are idempotent.
 */
public interface PacketFilterBackend {

    void block(String address);

    void unblock(String address);

    Set<String> listBlocked();
}
