package com.welie.blecore;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies a characteristic by the service it belongs to and its own UUID.
 */
public final class CharacteristicId {

    @NotNull
    private final UUID serviceUuid;

    @NotNull
    private final UUID characteristicUuid;

    public CharacteristicId(@NotNull UUID serviceUuid, @NotNull UUID characteristicUuid) {
        this.serviceUuid = Objects.requireNonNull(serviceUuid, "no valid service UUID provided");
        this.characteristicUuid = Objects.requireNonNull(characteristicUuid, "no valid characteristic UUID provided");
    }

    @NotNull
    public static CharacteristicId of(@NotNull UUID serviceUuid, @NotNull UUID characteristicUuid) {
        return new CharacteristicId(serviceUuid, characteristicUuid);
    }

    public @NotNull UUID getServiceUuid() {
        return serviceUuid;
    }

    public @NotNull UUID getCharacteristicUuid() {
        return characteristicUuid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacteristicId)) return false;
        CharacteristicId that = (CharacteristicId) o;
        return serviceUuid.equals(that.serviceUuid) && characteristicUuid.equals(that.characteristicUuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceUuid, characteristicUuid);
    }

    @Override
    public String toString() {
        return String.format("%s/%s", serviceUuid, characteristicUuid);
    }
}
