package com.welie.blecore;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * A characteristic as discovered on a connected peripheral.
 *
 * <p>The properties bit mask tells which operations the peripheral allows on it. The
 * {@link CommandQueue} checks these before sending a command to the adapter.
 */
public class BluetoothGattCharacteristic {

    /**
     * Characteristic property: Characteristic is broadcastable.
     */
    public static final int PROPERTY_BROADCAST = 0x01;

    /**
     * Characteristic property: Characteristic is readable.
     */
    public static final int PROPERTY_READ = 0x02;

    /**
     * Characteristic property: Characteristic can be written without response.
     */
    public static final int PROPERTY_WRITE_NO_RESPONSE = 0x04;

    /**
     * Characteristic property: Characteristic can be written.
     */
    public static final int PROPERTY_WRITE = 0x08;

    /**
     * Characteristic property: Characteristic supports notification
     */
    public static final int PROPERTY_NOTIFY = 0x10;

    /**
     * Characteristic property: Characteristic supports indication
     */
    public static final int PROPERTY_INDICATE = 0x20;

    /**
     * Characteristic property: Characteristic supports write with signature
     */
    public static final int PROPERTY_SIGNED_WRITE = 0x40;

    /**
     * Characteristic property: Characteristic has extended properties
     */
    public static final int PROPERTY_EXTENDED_PROPS = 0x80;

    public enum WriteType {
        /**
         * Write with response (aka write request)
         */
        WITH_RESPONSE,

        /**
         * Write without response (aka write command)
         */
        WITHOUT_RESPONSE
    }

    @NotNull
    private final UUID uuid;

    private final int properties;

    /**
     * Create a new BluetoothGattCharacteristic.
     *
     * @param uuid The UUID for this characteristic
     * @param properties Bit mask of PROPERTY_* flags
     */
    public BluetoothGattCharacteristic(@NotNull UUID uuid, int properties) {
        this.uuid = Objects.requireNonNull(uuid, "no valid UUID supplied");
        this.properties = properties;
    }

    public @NotNull UUID getUuid() {
        return uuid;
    }

    /**
     * Returns the properties of this characteristic.
     *
     * <p>The properties contain a bit mask of property flags indicating
     * the features of this characteristic.
     *
     * @return Properties of this characteristic
     */
    public int getProperties() {
        return properties;
    }

    public boolean supportsReading() {
        return (properties & PROPERTY_READ) > 0;
    }

    public boolean supportsWritingWithResponse() {
        return (properties & PROPERTY_WRITE) > 0;
    }

    public boolean supportsWritingWithoutResponse() {
        return (properties & PROPERTY_WRITE_NO_RESPONSE) > 0;
    }

    public boolean supportsNotifying() {
        return (((properties & PROPERTY_NOTIFY) > 0) || ((properties & PROPERTY_INDICATE) > 0));
    }

    public boolean supportsWriteType(@NotNull WriteType writeType) {
        Objects.requireNonNull(writeType, "no valid write type provided");
        switch (writeType) {
            case WITH_RESPONSE:
                return supportsWritingWithResponse();
            case WITHOUT_RESPONSE:
                return supportsWritingWithoutResponse();
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return String.format("%s (properties 0x%02X)", uuid, properties);
    }
}
