package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Restricts which advertisements are reported while scanning. A filter with no criteria matches
 * every advertisement. When several kinds of criteria are set, names are checked first, then
 * addresses, then services.
 */
public final class ScanFilter {

    public static final ScanFilter ALL = new ScanFilter(Collections.emptySet(), Collections.emptySet(), Collections.emptySet());

    @NotNull
    private final Set<UUID> serviceUuids;

    @NotNull
    private final Set<String> names;

    @NotNull
    private final Set<String> addresses;

    private ScanFilter(@NotNull Set<UUID> serviceUuids, @NotNull Set<String> names, @NotNull Set<String> addresses) {
        this.serviceUuids = Collections.unmodifiableSet(serviceUuids);
        this.names = Collections.unmodifiableSet(names);
        this.addresses = Collections.unmodifiableSet(addresses);
    }

    @NotNull
    public static ScanFilter withServices(@NotNull final UUID[] serviceUUIDs) {
        Objects.requireNonNull(serviceUUIDs, "no service UUIDs supplied");
        if (serviceUUIDs.length == 0) {
            throw new IllegalArgumentException("at least one service UUID must be supplied");
        }
        return new ScanFilter(new LinkedHashSet<>(Arrays.asList(serviceUUIDs)), Collections.emptySet(), Collections.emptySet());
    }

    /**
     * Match peripherals whose advertised name contains one of the given names.
     */
    @NotNull
    public static ScanFilter withNames(@NotNull final String[] peripheralNames) {
        Objects.requireNonNull(peripheralNames, "no peripheral names supplied");
        if (peripheralNames.length == 0) {
            throw new IllegalArgumentException("at least one peripheral name must be supplied");
        }
        return new ScanFilter(Collections.emptySet(), new LinkedHashSet<>(Arrays.asList(peripheralNames)), Collections.emptySet());
    }

    @NotNull
    public static ScanFilter withAddresses(@NotNull final String[] peripheralAddresses) {
        Objects.requireNonNull(peripheralAddresses, "no peripheral addresses supplied");
        if (peripheralAddresses.length == 0) {
            throw new IllegalArgumentException("at least one peripheral address must be supplied");
        }
        return new ScanFilter(Collections.emptySet(), Collections.emptySet(), new LinkedHashSet<>(Arrays.asList(peripheralAddresses)));
    }

    public @NotNull Set<UUID> getServiceUuids() {
        return serviceUuids;
    }

    public @NotNull Set<String> getNames() {
        return names;
    }

    public @NotNull Set<String> getAddresses() {
        return addresses;
    }

    public boolean isEmpty() {
        return serviceUuids.isEmpty() && names.isEmpty() && addresses.isEmpty();
    }

    public boolean matches(@NotNull ScanResult scanResult) {
        return matches(scanResult.getName(), scanResult.getAddress(), scanResult.getUuids());
    }

    public boolean matches(@NotNull DeviceRecord record) {
        return matches(record.getName(), record.getAddress(), record.getServiceUuids());
    }

    private boolean matches(@Nullable String name, @NotNull String address, @NotNull Collection<UUID> uuids) {
        if (!names.isEmpty()) {
            if (name == null) return false;
            for (String wanted : names) {
                if (name.contains(wanted)) return true;
            }
            return false;
        }

        if (!addresses.isEmpty()) {
            return addresses.contains(address);
        }

        if (!serviceUuids.isEmpty()) {
            for (UUID uuid : serviceUuids) {
                if (uuids.contains(uuid)) return true;
            }
            return false;
        }

        // No filter set
        return true;
    }

    @Override
    public String toString() {
        if (isEmpty()) return "ScanFilter{all}";
        return "ScanFilter{" +
                "services=" + serviceUuids +
                ", names=" + names +
                ", addresses=" + addresses +
                '}';
    }
}
