package com.khaounen.edgeguard.security.exclusion;

public class PacketFilterException extends RuntimeException {

    private final boolean unavailable;

    public PacketFilterException(String message, boolean unavailable) {
        super(message);
        this.unavailable = unavailable;
    }

    public PacketFilterException(String message, boolean unavailable, Throwable cause) {
        super(message, cause);
        this.unavailable = unavailable;
    }

    public boolean isUnavailable() {
        return unavailable;
    }
}
