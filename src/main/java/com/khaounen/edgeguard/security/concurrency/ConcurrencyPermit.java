package com.khaounen.edgeguard.security.concurrency;

import java.util.concurrent.atomic.AtomicBoolean;

public final class ConcurrencyPermit implements AutoCloseable {

    public enum Scope {
        GLOBAL,
        PER_ADDRESS
    }

    private static final ConcurrencyPermit UNTRACKED = new ConcurrencyPermit(null, null, null);

    private final ConcurrencyGate gate;
    private final String address;
    private final Scope deniedScope;
    private final AtomicBoolean released = new AtomicBoolean();

    private ConcurrencyPermit(ConcurrencyGate gate, String address, Scope deniedScope) {
        this.gate = gate;
        this.address = address;
        this.deniedScope = deniedScope;
    }

    static ConcurrencyPermit granted(ConcurrencyGate gate, String address) {
        return new ConcurrencyPermit(gate, address, null);
    }

    static ConcurrencyPermit denied(String address, Scope scope) {
        return new ConcurrencyPermit(null, address, scope);
    }

    public static ConcurrencyPermit untracked() {
        return UNTRACKED;
    }

    public boolean isGranted() {
        return deniedScope == null;
    }

    public Scope getDeniedScope() {
        return deniedScope;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public void close() {
        if (gate == null || !released.compareAndSet(false, true)) {
            return;
        }
        gate.release(address);
    }
}
