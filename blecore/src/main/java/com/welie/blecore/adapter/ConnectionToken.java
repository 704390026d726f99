package com.welie.blecore.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identity of one physical link. Every successful connect yields a new token, even for
 * the same peripheral.
 */
public final class ConnectionToken {

    private static final AtomicLong serials = new AtomicLong();

    @NotNull
    private final String deviceId;

    private final long serial;

    public ConnectionToken(@NotNull String deviceId) {
        this.deviceId = Objects.requireNonNull(deviceId, "no valid device id provided");
        this.serial = serials.incrementAndGet();
    }

    public @NotNull String getDeviceId() {
        return deviceId;
    }

    public long getSerial() {
        return serial;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionToken)) return false;
        return serial == ((ConnectionToken) o).serial;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(serial);
    }

    @Override
    public String toString() {
        return String.format("ConnectionToken{%s#%d}", deviceId, serial);
    }
}
