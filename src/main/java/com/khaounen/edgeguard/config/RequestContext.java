package com.khaounen.edgeguard.config;

public final class RequestContext {

    private static final ThreadLocal<Client> CURRENT = new ThreadLocal<>();

    private RequestContext() {}

    public record Client(String address, String userAgent) {
    }

    public static void set(Client client) {
        CURRENT.set(client);
    }

    public static Client current() {
        return CURRENT.get();
    }

    public static String getIp() {
        Client client = CURRENT.get();
        return client == null ? null : client.address();
    }

    public static String getUserAgent() {
        Client client = CURRENT.get();
        return client == null ? null : client.userAgent();
    }

    public static void clear() {
        CURRENT.remove();
    }
}
