package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single advertisement as received from the adapter while scanning.
 */
public final class ScanResult {
    private final String name;
    private final String address;
    private final @NotNull List<UUID> uuids;
    private final int rssi;
    private final Map<@NotNull Integer, byte[]> manufacturerData;
    private final Map<@NotNull String, byte[]> serviceData;

    public ScanResult(@Nullable String deviceName, @NotNull String deviceAddress, @NotNull List<@NotNull UUID> uuids, int rssi) {
        this(deviceName, deviceAddress, uuids, rssi, Collections.emptyMap(), Collections.emptyMap());
    }

    public ScanResult(@Nullable String deviceName, @NotNull String deviceAddress, @NotNull List<@NotNull UUID> uuids, int rssi, @NotNull Map<@NotNull Integer, byte[]> manufacturerData, @NotNull Map<@NotNull String, byte[]> serviceData) {
        this.name = deviceName;
        this.address = Objects.requireNonNull(deviceAddress, "no valid address supplied");
        this.uuids = Collections.unmodifiableList(Objects.requireNonNull(uuids, "no valid uuids supplied"));
        this.rssi = rssi;
        this.manufacturerData = Collections.unmodifiableMap(Objects.requireNonNull(manufacturerData, "no valid manufacturer data supplied"));
        this.serviceData = Collections.unmodifiableMap(Objects.requireNonNull(serviceData, "no valid service data supplied"));
    }

    /**
     * Get name of the peripheral
     *
     * @return the name of the peripheral or null if the peripheral does not advertise a name
     */
    public @Nullable String getName() {
        return name;
    }

    public @NotNull String getAddress() {
        return address;
    }

    public int getRssi() {
        return rssi;
    }

    /**
     * Get the list of advertised service UUIDs
     * @return list of service UUIDs
     */
    public @NotNull List<UUID> getUuids() {
        return uuids;
    }

    public @NotNull Map<Integer, byte[]> getManufacturerData() {
        return manufacturerData;
    }

    public @NotNull Map<String, byte[]> getServiceData() {
        return serviceData;
    }

    @Override
    public String toString() {
        return "ScanResult{" +
                "name='" + name + '\'' +
                ", address='" + address + '\'' +
                ", uuids=" + uuids +
                ", rssi=" + rssi +
                ", manufacturerData=" + manufacturerDataToString() +
                ", serviceData=" + serviceDataToString() +
                '}';
    }

    private String manufacturerDataToString() {
        if (manufacturerData.isEmpty()) return "[]";
        StringBuilder result = new StringBuilder("[");
        manufacturerData.forEach((code, bytes) -> result.append(String.format("0x%04x->0x%s,", code, toHex(bytes))));
        result.deleteCharAt(result.length() - 1);
        result.append("]");
        return result.toString();
    }

    private String serviceDataToString() {
        if (serviceData.isEmpty()) return "[]";
        StringBuilder result = new StringBuilder("[");
        serviceData.forEach((uuid, bytes) -> result.append(String.format("%s->0x%s,", uuid, toHex(bytes))));
        result.deleteCharAt(result.length() - 1);
        result.append("]");
        return result.toString();
    }

    @NotNull
    static String toHex(@Nullable byte[] bytes) {
        if (bytes == null) return "";
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02X", b));
        }
        return sb.toString();
    }
}
