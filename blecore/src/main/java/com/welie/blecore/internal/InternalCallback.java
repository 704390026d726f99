package com.welie.blecore.internal;

import com.welie.blecore.BluetoothCentralManager;
import com.welie.blecore.BluetoothCommandStatus;
import com.welie.blecore.ConnectionState;
import com.welie.blecore.ServiceMap;
import org.jetbrains.annotations.NotNull;

/**
 * Interface between {@link BluetoothCentralManager} and its connection state machine.
 *
 * The state machine reports every lifecycle change through this interface. All methods are
 * called on the central's queue thread.
 */
public interface InternalCallback {

    /**
     * The connection state changed.
     *
     * @param state the new state
     */
    void stateChanged(@NotNull final ConnectionState state);

    /**
     * A new connection generation started. Everything belonging to earlier generations is stale.
     *
     * @param generation the new generation
     */
    void generationChanged(final long generation);

    /**
     * The peripheral is connected and its services are discovered.
     *
     * @param address address of the peripheral
     * @param serviceMap the discovered services
     */
    void connected(@NotNull final String address, @NotNull final ServiceMap serviceMap);

    /**
     * A connection attempt, including a reconnect attempt, has failed.
     *
     * @param address address of the peripheral
     * @param status the reason
     */
    void connectFailed(@NotNull final String address, @NotNull final BluetoothCommandStatus status);

    /**
     * The connection is gone and will not be re-established automatically.
     *
     * @param address address of the peripheral
     * @param status the reason
     */
    void disconnected(@NotNull final String address, @NotNull final BluetoothCommandStatus status);
}
