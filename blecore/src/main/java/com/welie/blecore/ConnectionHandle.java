package com.welie.blecore;

import com.welie.blecore.adapter.ConnectionToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * State of the connection the application asked for. Only the central's queue thread mutates it.
 */
final class ConnectionHandle {

    @NotNull
    private final String address;

    private final long generation;

    @Nullable
    private volatile ConnectionToken token;

    @NotNull
    private volatile ServiceMap serviceMap = ServiceMap.EMPTY;

    ConnectionHandle(@NotNull String address, long generation) {
        this.address = Objects.requireNonNull(address, "no valid address provided");
        this.generation = generation;
    }

    @NotNull
    String getAddress() {
        return address;
    }

    long getGeneration() {
        return generation;
    }

    @Nullable
    ConnectionToken getToken() {
        return token;
    }

    void setToken(@Nullable ConnectionToken token) {
        this.token = token;
    }

    @NotNull
    ServiceMap getServiceMap() {
        return serviceMap;
    }

    void setServiceMap(@NotNull ServiceMap serviceMap) {
        this.serviceMap = Objects.requireNonNull(serviceMap, "no valid service map provided");
    }

    @Override
    public String toString() {
        return String.format("ConnectionHandle{%s, generation=%d, token=%s}", address, generation, token);
    }
}
