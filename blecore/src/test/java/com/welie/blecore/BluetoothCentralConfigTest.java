package com.welie.blecore;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BluetoothCentralConfigTest {

    @Test
    void When_using_the_defaults_then_all_values_are_the_documented_ones() {
        BluetoothCentralConfig config = BluetoothCentralConfig.defaults();

        assertEquals(BluetoothCentralConfig.DEFAULT_CONNECT_TIMEOUT, config.getConnectTimeoutMillis());
        assertEquals(BluetoothCentralConfig.DEFAULT_DISCOVERY_TIMEOUT, config.getDiscoveryTimeoutMillis());
        assertEquals(BluetoothCentralConfig.DEFAULT_COMMAND_TIMEOUT, config.getCommandTimeoutMillis());
        assertEquals(BluetoothCentralConfig.DEFAULT_DISCONNECT_TIMEOUT, config.getDisconnectTimeoutMillis());
        assertEquals(BluetoothCentralConfig.DEFAULT_STALENESS_WINDOW, config.getStalenessWindowMillis());
        assertEquals(BluetoothCentralConfig.DEFAULT_NOTIFICATION_BUFFER_SIZE, config.getNotificationBufferSize());
        assertEquals(BluetoothCentralConfig.DEFAULT_RSSI_THRESHOLD, config.getRssiThreshold());
        assertTrue(config.getScanOptions().isEmpty());
        assertSame(ReconnectPolicy.NONE, config.getReconnectPolicy());
    }

    @Test
    void When_loading_a_properties_resource_then_every_key_is_applied() throws IOException {
        BluetoothCentralConfig config = BluetoothCentralConfig.load("blecore-test.properties");

        assertEquals(15000, config.getConnectTimeoutMillis());
        assertEquals(8000, config.getDiscoveryTimeoutMillis());
        assertEquals(2500, config.getCommandTimeoutMillis());
        assertEquals(1000, config.getDisconnectTimeoutMillis());
        assertEquals(20000, config.getStalenessWindowMillis());
        assertEquals(4000, config.getPruneIntervalMillis());
        assertEquals(16, config.getNotificationBufferSize());
        assertEquals(-70, config.getRssiThreshold());
        assertTrue(config.getScanOptions().contains(BluetoothCentralManager.SCANOPTION_NO_NULL_NAMES));

        ReconnectPolicy policy = config.getReconnectPolicy();
        assertEquals(3, policy.getMaxAttempts());
        assertEquals(500, policy.getInitialDelayMillis());
        assertEquals(2.0, policy.getMultiplier());
        assertEquals(8000, policy.getMaxDelayMillis());
        assertEquals(0.1, policy.getJitterFactor());
    }

    @Test
    void When_loading_a_missing_resource_then_an_IOException_is_thrown() {
        assertThrows(IOException.class, () -> BluetoothCentralConfig.load("does-not-exist.properties"));
    }

    @Test
    void Given_partial_properties_then_missing_keys_keep_their_defaults() {
        Properties properties = new Properties();
        properties.setProperty("blecore.command.timeout.ms", "750");
        properties.setProperty("blecore.reconnect.max.attempts", "2");

        BluetoothCentralConfig config = BluetoothCentralConfig.fromProperties(properties);

        assertEquals(750, config.getCommandTimeoutMillis());
        assertEquals(BluetoothCentralConfig.DEFAULT_CONNECT_TIMEOUT, config.getConnectTimeoutMillis());
        assertEquals(2, config.getReconnectPolicy().getMaxAttempts());
        assertEquals(1000, config.getReconnectPolicy().getInitialDelayMillis());
        assertEquals(30000, config.getReconnectPolicy().getMaxDelayMillis());
    }

    @Test
    void Given_a_malformed_value_then_an_IllegalArgumentException_names_the_key() {
        Properties properties = new Properties();
        properties.setProperty("blecore.connect.timeout.ms", "soon");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> BluetoothCentralConfig.fromProperties(properties));
        assertTrue(exception.getMessage().contains("blecore.connect.timeout.ms"));
    }

    @Test
    void Given_a_non_positive_timeout_then_the_builder_rejects_it() {
        assertThrows(IllegalArgumentException.class, () -> BluetoothCentralConfig.builder().connectTimeout(0));
        assertThrows(IllegalArgumentException.class, () -> BluetoothCentralConfig.builder().commandTimeout(-5));
        assertThrows(IllegalArgumentException.class, () -> BluetoothCentralConfig.builder().notificationBufferSize(0));
        assertThrows(IllegalArgumentException.class, () -> BluetoothCentralConfig.builder().rssiThreshold(-128));
        assertThrows(NullPointerException.class, () -> BluetoothCentralConfig.builder().reconnectPolicy(null));
    }
}
