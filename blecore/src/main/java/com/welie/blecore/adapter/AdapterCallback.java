package com.welie.blecore.adapter;

import com.welie.blecore.CharacteristicId;
import com.welie.blecore.ScanResult;
import org.jetbrains.annotations.NotNull;

/**
 * Unsolicited events coming from the radio. Implementations are called from the adapter's own
 * threads and must return quickly.
 */
public interface AdapterCallback {

    void onAdvertisement(@NotNull ScanResult scanResult);

    void onCharacteristicChanged(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId, @NotNull byte[] value);

    /**
     * The link identified by the token went down. Fires at most once per token.
     */
    void onDisconnected(@NotNull ConnectionToken token);
}
