package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The services and characteristics discovered for one connection. Built once when discovery
 * completes and never changed afterwards.
 */
public final class ServiceMap {

    public static final ServiceMap EMPTY = new ServiceMap(Collections.emptyList());

    @NotNull
    private final Map<UUID, BluetoothGattService> services;

    public ServiceMap(@NotNull List<BluetoothGattService> services) {
        Objects.requireNonNull(services, "no valid services provided");
        final Map<UUID, BluetoothGattService> map = new LinkedHashMap<>();
        for (BluetoothGattService service : services) {
            final BluetoothGattService copy = new BluetoothGattService(service.getUuid());
            for (BluetoothGattCharacteristic characteristic : service.getCharacteristics()) {
                copy.addCharacteristic(characteristic);
            }
            map.putIfAbsent(service.getUuid(), copy);
        }
        this.services = Collections.unmodifiableMap(map);
    }

    @NotNull
    public List<BluetoothGattService> getServices() {
        return Collections.unmodifiableList(new ArrayList<>(services.values()));
    }

    @Nullable
    public BluetoothGattService getService(@NotNull UUID serviceUuid) {
        Objects.requireNonNull(serviceUuid, "no valid service UUID provided");
        return services.get(serviceUuid);
    }

    @Nullable
    public BluetoothGattCharacteristic getCharacteristic(@NotNull CharacteristicId characteristicId) {
        Objects.requireNonNull(characteristicId, "no valid characteristic id provided");
        final BluetoothGattService service = services.get(characteristicId.getServiceUuid());
        if (service == null) return null;
        return service.getCharacteristic(characteristicId.getCharacteristicUuid());
    }

    public boolean contains(@NotNull CharacteristicId characteristicId) {
        return getCharacteristic(characteristicId) != null;
    }

    public int size() {
        return services.size();
    }

    @Override
    public String toString() {
        return "ServiceMap" + services.keySet();
    }
}
