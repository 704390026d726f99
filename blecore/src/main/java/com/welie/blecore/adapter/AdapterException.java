package com.welie.blecore.adapter;

import com.welie.blecore.BluetoothCommandStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Failure reported by a {@link BluetoothAdapter}. Carries an ATT or library status when the
 * radio stack provides one.
 */
public class AdapterException extends Exception {

    private static final long serialVersionUID = 1L;

    @NotNull
    private final BluetoothCommandStatus status;

    public AdapterException(@NotNull String message) {
        this(message, BluetoothCommandStatus.ADAPTER_ERROR, null);
    }

    public AdapterException(@NotNull String message, @NotNull BluetoothCommandStatus status) {
        this(message, status, null);
    }

    public AdapterException(@NotNull String message, @NotNull BluetoothCommandStatus status, @Nullable Throwable cause) {
        super(message, cause);
        this.status = Objects.requireNonNull(status, "no valid status provided");
    }

    @NotNull
    public BluetoothCommandStatus getStatus() {
        return status;
    }
}
