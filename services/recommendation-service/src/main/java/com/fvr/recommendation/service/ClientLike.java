package com.fvr.recommendation.service;

/**
 * A like reported by the client as {@code (uuid, host)}.
 */
public class ClientLike {
    private final String uuid;
    private final String host;

    public ClientLike(String uuid, String host) {
        this.uuid = uuid;
        this.host = host;
    }

    public String getUuid() {
        return uuid;
    }

    public String getHost() {
        return host;
    }
}
