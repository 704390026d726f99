package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * What is known about a discovered peripheral. Immutable; the {@link DeviceRegistry} replaces the
 * record on every advertisement.
 */
public final class DeviceRecord {

    @NotNull
    private final String address;

    @Nullable
    private final String name;

    private final long lastSeen;

    private final int rssi;

    @NotNull
    private final List<UUID> serviceUuids;

    public DeviceRecord(@NotNull String address, @Nullable String name, long lastSeen, int rssi, @NotNull List<UUID> serviceUuids) {
        this.address = Objects.requireNonNull(address, "no valid address provided");
        this.name = name;
        this.lastSeen = lastSeen;
        this.rssi = rssi;
        this.serviceUuids = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(serviceUuids, "no valid service UUIDs provided")));
    }

    public @NotNull String getAddress() {
        return address;
    }

    public @Nullable String getName() {
        return name;
    }

    /**
     * @return time of the last advertisement in milliseconds since the epoch
     */
    public long getLastSeen() {
        return lastSeen;
    }

    public int getRssi() {
        return rssi;
    }

    public @NotNull List<UUID> getServiceUuids() {
        return serviceUuids;
    }

    public boolean advertises(@NotNull UUID serviceUuid) {
        return serviceUuids.contains(serviceUuid);
    }

    @Override
    public String toString() {
        return String.format("DeviceRecord{address='%s', name='%s', rssi=%d, lastSeen=%d, services=%s}", address, name, rssi, lastSeen, serviceUuids);
    }
}
