package com.welie.blecore;

import org.junit.jupiter.api.*;

import java.util.Collections;
import java.util.UUID;

import static com.welie.blecore.BluetoothGattCharacteristic.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BluetoothGattCharacteristicTest {

    private static final UUID BLP_SERVICE_UUID = UUID.fromString("00001810-0000-1000-8000-00805f9b34fb");
    private static final UUID BLOOD_PRESSURE_MEASUREMENT_CHARACTERISTIC_UUID = UUID.fromString("00002A35-0000-1000-8000-00805f9b34fb");
    private static final UUID RACP_CHARACTERISTIC_UUID = UUID.fromString("00002A52-0000-1000-8000-00805f9b34fb");

    @Test
    void Given_properties_then_the_supported_operations_follow_them() {
        BluetoothGattCharacteristic measurement = new BluetoothGattCharacteristic(BLOOD_PRESSURE_MEASUREMENT_CHARACTERISTIC_UUID, PROPERTY_INDICATE);
        BluetoothGattCharacteristic racp = new BluetoothGattCharacteristic(RACP_CHARACTERISTIC_UUID, PROPERTY_WRITE | PROPERTY_INDICATE);

        assertTrue(measurement.supportsNotifying());
        assertFalse(measurement.supportsReading());
        assertFalse(measurement.supportsWriteType(WriteType.WITH_RESPONSE));
        assertTrue(racp.supportsWriteType(WriteType.WITH_RESPONSE));
        assertFalse(racp.supportsWriteType(WriteType.WITHOUT_RESPONSE));
    }

    @Test
    void Given_a_service_map_then_characteristics_are_found_by_service_and_characteristic() {
        BluetoothGattService service = new BluetoothGattService(BLP_SERVICE_UUID)
                .addCharacteristic(new BluetoothGattCharacteristic(BLOOD_PRESSURE_MEASUREMENT_CHARACTERISTIC_UUID, PROPERTY_INDICATE));
        ServiceMap serviceMap = new ServiceMap(Collections.singletonList(service));

        assertEquals(1, serviceMap.size());
        assertEquals(Collections.singletonList(service), serviceMap.getServices());
        assertSame(service, serviceMap.getService(BLP_SERVICE_UUID));
        assertTrue(serviceMap.contains(CharacteristicId.of(BLP_SERVICE_UUID, BLOOD_PRESSURE_MEASUREMENT_CHARACTERISTIC_UUID)));
        assertFalse(serviceMap.contains(CharacteristicId.of(BLP_SERVICE_UUID, RACP_CHARACTERISTIC_UUID)));
        assertFalse(serviceMap.contains(CharacteristicId.of(RACP_CHARACTERISTIC_UUID, BLOOD_PRESSURE_MEASUREMENT_CHARACTERISTIC_UUID)));
        assertThrows(UnsupportedOperationException.class, () -> service.getCharacteristics().clear());
    }
}
