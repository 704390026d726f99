package com.welie.blecore.adapter;

import com.welie.blecore.BluetoothGattCharacteristic.WriteType;
import com.welie.blecore.BluetoothGattService;
import com.welie.blecore.CharacteristicId;
import com.welie.blecore.ScanFilter;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Platform radio stack as seen by the central. One implementation exists per platform and the
 * host picks it at startup.
 *
 * <p>All methods may be called from the central's own threads and must not block. Results are
 * reported through the returned futures, which may complete on any thread. Unsolicited events
 * are reported to the {@link AdapterCallback} set with {@link #setCallback(AdapterCallback)}.
 * A future that fails should fail with an {@link AdapterException}; any other exception is
 * treated as a generic adapter error.
 */
public interface BluetoothAdapter {

    void setCallback(@NotNull AdapterCallback callback);

    /**
     * Start delivering advertisements to {@link AdapterCallback#onAdvertisement}.
     *
     * @param filter hint for the radio; the central filters advertisements itself as well
     * @throws AdapterException if scanning could not be started
     */
    void startScan(@NotNull ScanFilter filter) throws AdapterException;

    void stopScan() throws AdapterException;

    /**
     * Establish a link to a peripheral.
     *
     * @param deviceId the address of the peripheral
     * @param timeoutMillis the time the radio may spend before giving up
     * @return future with the token identifying the link
     */
    @NotNull
    CompletableFuture<ConnectionToken> connect(@NotNull String deviceId, long timeoutMillis);

    @NotNull
    CompletableFuture<List<BluetoothGattService>> discoverServices(@NotNull ConnectionToken token);

    @NotNull
    CompletableFuture<byte[]> read(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId);

    /**
     * Write a value. For {@link WriteType#WITHOUT_RESPONSE} the future completes when the value
     * has been handed to the radio.
     */
    @NotNull
    CompletableFuture<Void> write(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId, @NotNull byte[] value, @NotNull WriteType writeType);

    @NotNull
    CompletableFuture<Void> subscribe(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId);

    @NotNull
    CompletableFuture<Void> unsubscribe(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId);

    @NotNull
    CompletableFuture<Void> disconnect(@NotNull ConnectionToken token);
}
