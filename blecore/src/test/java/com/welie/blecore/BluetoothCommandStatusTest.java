package com.welie.blecore;

import org.junit.jupiter.api.*;

import java.util.Collections;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BluetoothCommandStatusTest {

    @Test
    void When_looking_up_a_known_value_then_the_matching_status_is_returned() {
        assertEquals(BluetoothCommandStatus.COMMAND_SUCCESS, BluetoothCommandStatus.fromValue(0x00));
        assertEquals(BluetoothCommandStatus.INSUFFICIENT_AUTHENTICATION, BluetoothCommandStatus.fromValue(0x05));
        assertEquals(BluetoothCommandStatus.TIMEOUT, BluetoothCommandStatus.fromValue(BluetoothCommandStatus.TIMEOUT.getValue()));
    }

    @Test
    void When_looking_up_an_unknown_value_then_unknown_status_is_returned() {
        assertEquals(BluetoothCommandStatus.UNKNOWN_STATUS, BluetoothCommandStatus.fromValue(0x7E));
    }

    @Test
    void Given_a_BluetoothException_then_it_carries_its_status() {
        BluetoothException exception = new BluetoothException(BluetoothCommandStatus.BUSY, "busy");

        assertEquals(BluetoothCommandStatus.BUSY, exception.getStatus());
        assertEquals("busy", exception.getMessage());
    }

    @Test
    void Given_a_scan_result_with_advertisement_data_then_it_is_printed_as_hex() {
        ScanResult scanResult = new ScanResult("Beurer BM57", "12:34:56:65:43:21", Collections.emptyList(), -60,
                Collections.singletonMap(0x0157, new byte[]{0x01, (byte) 0xAB}),
                Collections.singletonMap("00001810-0000-1000-8000-00805f9b34fb", new byte[]{0x02}));

        String text = scanResult.toString();

        assertTrue(text.contains("0x0157->0x01AB"));
        assertTrue(text.contains("00001810-0000-1000-8000-00805f9b34fb->0x02"));
        assertEquals(1, scanResult.getManufacturerData().size());
        assertEquals(1, scanResult.getServiceData().size());
        assertTrue(scanResult.getUuids().isEmpty());
        assertNotNull(UUID.fromString(scanResult.getServiceData().keySet().iterator().next()));
    }
}
