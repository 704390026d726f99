package com.welie.blecore;

import com.welie.blecore.BluetoothGattCharacteristic.WriteType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A GATT request to be executed by the {@link CommandQueue}. Immutable; write payloads are copied
 * when the operation is created.
 */
public final class GattOperation {

    public enum Type {
        READ,
        WRITE,
        SUBSCRIBE,
        UNSUBSCRIBE
    }

    private static final byte[] NO_VALUE = new byte[0];

    @NotNull
    private final Type type;

    @NotNull
    private final CharacteristicId characteristicId;

    @NotNull
    private final byte[] value;

    @Nullable
    private final WriteType writeType;

    /**
     * Zero means the configured command timeout applies.
     */
    private final long timeoutMillis;

    private GattOperation(@NotNull Type type, @NotNull CharacteristicId characteristicId, @NotNull byte[] value, @Nullable WriteType writeType, long timeoutMillis) {
        this.type = type;
        this.characteristicId = Objects.requireNonNull(characteristicId, "no valid characteristic id provided");
        this.value = value;
        this.writeType = writeType;
        this.timeoutMillis = timeoutMillis;
    }

    @NotNull
    public static GattOperation read(@NotNull CharacteristicId characteristicId) {
        return new GattOperation(Type.READ, characteristicId, NO_VALUE, null, 0);
    }

    @NotNull
    public static GattOperation write(@NotNull CharacteristicId characteristicId, @NotNull byte[] value, @NotNull WriteType writeType) {
        Objects.requireNonNull(value, "no valid value provided");
        Objects.requireNonNull(writeType, "no valid write type provided");
        if (value.length == 0) {
            throw new IllegalArgumentException("value byte array is empty");
        }
        return new GattOperation(Type.WRITE, characteristicId, Arrays.copyOf(value, value.length), writeType, 0);
    }

    @NotNull
    public static GattOperation subscribe(@NotNull CharacteristicId characteristicId) {
        return new GattOperation(Type.SUBSCRIBE, characteristicId, NO_VALUE, null, 0);
    }

    @NotNull
    public static GattOperation unsubscribe(@NotNull CharacteristicId characteristicId) {
        return new GattOperation(Type.UNSUBSCRIBE, characteristicId, NO_VALUE, null, 0);
    }

    /**
     * @param timeoutMillis deadline for this operation, counted from the moment it is sent to the adapter
     * @return a copy of this operation with its own deadline
     */
    @NotNull
    public GattOperation withTimeout(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return new GattOperation(type, characteristicId, value, writeType, timeoutMillis);
    }

    public @NotNull Type getType() {
        return type;
    }

    public @NotNull CharacteristicId getCharacteristicId() {
        return characteristicId;
    }

    /**
     * @return a copy of the payload, empty for anything but writes
     */
    public @NotNull byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    public @Nullable WriteType getWriteType() {
        return writeType;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    boolean isWriteWithoutResponse() {
        return type == Type.WRITE && writeType == WriteType.WITHOUT_RESPONSE;
    }

    @Override
    public String toString() {
        if (type == Type.WRITE) {
            return String.format("%s %s <%s> (%s)", type, characteristicId, ScanResult.toHex(value), writeType);
        }
        return String.format("%s %s", type, characteristicId);
    }
}
