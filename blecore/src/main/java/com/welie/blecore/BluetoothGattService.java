package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Represents a Bluetooth Gatt service
 */
public class BluetoothGattService {

    @NotNull
    private final UUID uuid;

    /**
     * Characteristics in the order the peripheral reported them.
     */
    private final List<BluetoothGattCharacteristic> characteristics = new ArrayList<>();

    public BluetoothGattService(@NotNull UUID uuid) {
        this.uuid = Objects.requireNonNull(uuid, "no valid UUID supplied");
    }

    /**
     * Add a characteristic to this service.
     *
     * @param characteristic The characteristics to be added
     * @return this service, so calls can be chained
     */
    @NotNull
    public BluetoothGattService addCharacteristic(@NotNull BluetoothGattCharacteristic characteristic) {
        Objects.requireNonNull(characteristic, "no valid characteristic supplied");
        characteristics.add(characteristic);
        return this;
    }

    public @NotNull UUID getUuid() {
        return uuid;
    }

    public @NotNull List<BluetoothGattCharacteristic> getCharacteristics() {
        return Collections.unmodifiableList(characteristics);
    }

    /**
     * Returns a characteristic with a given UUID out of the list of
     * characteristics offered by this service.
     *
     * <p>If a remote service offers multiple characteristics with the same
     * UUID, the first instance of a characteristic with the given UUID
     * is returned.
     *
     * @param uuid the UUID of the characteristic
     * @return GATT characteristic object or null if no characteristic with the given UUID was
     * found.
     */
    public @Nullable BluetoothGattCharacteristic getCharacteristic(@NotNull UUID uuid) {
        Objects.requireNonNull(uuid, "no valid uuid supplied");

        for (BluetoothGattCharacteristic characteristic : characteristics) {
            if (uuid.equals(characteristic.getUuid())) {
                return characteristic;
            }
        }
        return null;
    }
}
