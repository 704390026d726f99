package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Failure of a connection attempt, a disconnect or a GATT command. Futures returned by
 * {@link BluetoothCentralManager} complete exceptionally with this exception.
 */
public class BluetoothException extends Exception {

    private static final long serialVersionUID = 1L;

    @NotNull
    private final BluetoothCommandStatus status;

    public BluetoothException(@NotNull BluetoothCommandStatus status) {
        this(status, status.name(), null);
    }

    public BluetoothException(@NotNull BluetoothCommandStatus status, @NotNull String message) {
        this(status, message, null);
    }

    public BluetoothException(@NotNull BluetoothCommandStatus status, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.status = Objects.requireNonNull(status, "no valid status provided");
    }

    @NotNull
    public BluetoothCommandStatus getStatus() {
        return status;
    }
}
