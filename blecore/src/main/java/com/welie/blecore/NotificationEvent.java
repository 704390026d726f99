package com.welie.blecore;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * A value pushed by the peripheral for a subscribed characteristic.
 */
public final class NotificationEvent {

    @NotNull
    private final CharacteristicId characteristicId;

    @NotNull
    private final byte[] value;

    private final long generation;

    public NotificationEvent(@NotNull CharacteristicId characteristicId, @NotNull byte[] value, long generation) {
        this.characteristicId = Objects.requireNonNull(characteristicId, "no valid characteristic id provided");
        Objects.requireNonNull(value, "no valid value provided");
        this.value = Arrays.copyOf(value, value.length);
        this.generation = generation;
    }

    public @NotNull CharacteristicId getCharacteristicId() {
        return characteristicId;
    }

    public @NotNull byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * @return the generation of the connection the value was received on
     */
    public long getGeneration() {
        return generation;
    }

    @Override
    public String toString() {
        return String.format("NotificationEvent{%s, value=%s, generation=%d}", characteristicId, ScanResult.toHex(value), generation);
    }
}
