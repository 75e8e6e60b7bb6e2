package com.khaounen.edgeguard.security.exclusion;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;

@Slf4j
public class NoOpPacketFilterBackend implements PacketFilterBackend {

    @Override
    public void block(String address) {
        log.debug("packet filter disabled, {} excluded in-process only", address);
    }

    @Override
    public void unblock(String address) {
        log.debug("packet filter disabled, nothing to unblock for {}", address);
    }

    @Override
    public Set<String> listBlocked() {
        return Set.of();
    }
}
