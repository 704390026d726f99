package com.welie.blecore;

import org.junit.jupiter.api.*;

import java.util.UUID;

import static com.welie.blecore.BluetoothGattCharacteristic.WriteType.WITHOUT_RESPONSE;
import static com.welie.blecore.BluetoothGattCharacteristic.WriteType.WITH_RESPONSE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GattOperationTest {

    private static final CharacteristicId RACP = CharacteristicId.of(
            UUID.fromString("00001810-0000-1000-8000-00805f9b34fb"),
            UUID.fromString("00002A52-0000-1000-8000-00805f9b34fb"));

    @Test
    void When_creating_a_write_then_the_value_is_copied() {
        byte[] value = new byte[]{0x01, 0x01};
        GattOperation operation = GattOperation.write(RACP, value, WITH_RESPONSE);

        value[0] = 0x07;
        operation.getValue()[1] = 0x07;

        assertArrayEquals(new byte[]{0x01, 0x01}, operation.getValue());
        assertEquals(GattOperation.Type.WRITE, operation.getType());
        assertEquals(WITH_RESPONSE, operation.getWriteType());
        assertFalse(operation.isWriteWithoutResponse());
    }

    @Test
    void When_creating_a_write_with_invalid_arguments_then_an_exception_is_thrown() {
        assertThrows(IllegalArgumentException.class, () -> GattOperation.write(RACP, new byte[0], WITH_RESPONSE));
        assertThrows(NullPointerException.class, () -> GattOperation.write(RACP, null, WITH_RESPONSE));
        assertThrows(NullPointerException.class, () -> GattOperation.write(RACP, new byte[]{0x01}, null));
        assertThrows(NullPointerException.class, () -> GattOperation.read(null));
    }

    @Test
    void When_writing_without_response_then_it_is_flagged_as_such() {
        assertTrue(GattOperation.write(RACP, new byte[]{0x01}, WITHOUT_RESPONSE).isWriteWithoutResponse());
        assertFalse(GattOperation.read(RACP).isWriteWithoutResponse());
    }

    @Test
    void When_setting_a_timeout_then_a_copy_with_that_timeout_is_returned() {
        GattOperation operation = GattOperation.read(RACP);

        GattOperation withTimeout = operation.withTimeout(750);

        assertEquals(0, operation.getTimeoutMillis());
        assertEquals(750, withTimeout.getTimeoutMillis());
        assertEquals(RACP, withTimeout.getCharacteristicId());
        assertThrows(IllegalArgumentException.class, () -> operation.withTimeout(0));
    }
}
