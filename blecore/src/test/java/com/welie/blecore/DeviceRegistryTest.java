package com.welie.blecore;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DeviceRegistryTest {

    private static final long STALENESS_WINDOW = 30000L;

    private static final UUID HRS_SERVICE_UUID = UUID.fromString("0000180D-0000-1000-8000-00805f9b34fb");
    private static final UUID BLP_SERVICE_UUID = UUID.fromString("00001810-0000-1000-8000-00805f9b34fb");

    private static final String DUMMY_MAC_ADDRESS_HRS = "12:34:56:65:43:21";
    private static final String DUMMY_MAC_ADDRESS_BLP = "00:11:22:33:44:55";

    @Mock
    Clock clock;

    private DeviceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DeviceRegistry(clock, STALENESS_WINDOW);
    }

    @Test
    void Constructor_rejects_invalid_arguments() {
        assertThrows(NullPointerException.class, () -> new DeviceRegistry(null, STALENESS_WINDOW));
        assertThrows(IllegalArgumentException.class, () -> new DeviceRegistry(clock, 0));
    }

    @Test
    void When_an_advertisement_is_received_then_a_record_is_created() {
        // Given
        when(clock.millis()).thenReturn(1000L);

        // When
        DeviceRecord record = registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.singletonList(HRS_SERVICE_UUID), -60));

        // Then
        assertEquals(DUMMY_MAC_ADDRESS_HRS, record.getAddress());
        assertEquals("Polar H10", record.getName());
        assertEquals(1000L, record.getLastSeen());
        assertEquals(-60, record.getRssi());
        assertTrue(record.advertises(HRS_SERVICE_UUID));
        assertEquals(1, registry.size());
        assertSame(record, registry.get(DUMMY_MAC_ADDRESS_HRS));
    }

    @Test
    void Given_a_known_peripheral_when_it_advertises_again_then_its_record_is_updated_in_place() {
        // Given
        when(clock.millis()).thenReturn(1000L, 2000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.singletonList(HRS_SERVICE_UUID), -60));

        // When
        DeviceRecord record = registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.singletonList(HRS_SERVICE_UUID), -45));

        // Then
        assertEquals(1, registry.size());
        assertEquals(2000L, record.getLastSeen());
        assertEquals(-45, record.getRssi());
    }

    @Test
    void Given_a_named_peripheral_when_it_advertises_without_a_name_then_the_name_is_kept() {
        // Given
        when(clock.millis()).thenReturn(1000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), -60));

        // When
        DeviceRecord record = registry.onAdvertisement(new ScanResult(null, DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), -60));

        // Then
        assertEquals("Polar H10", record.getName());
    }

    @Test
    void Given_a_record_older_than_the_staleness_window_then_it_is_not_listed_or_returned() {
        // Given
        when(clock.millis()).thenReturn(1000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), -60));

        // When
        when(clock.millis()).thenReturn(1000L + STALENESS_WINDOW + 1);

        // Then
        assertTrue(registry.list(null).isEmpty());
        assertNull(registry.get(DUMMY_MAC_ADDRESS_HRS));
        assertEquals(1, registry.size());
    }

    @Test
    void Given_a_record_exactly_at_the_staleness_window_then_it_is_still_listed() {
        // Given
        when(clock.millis()).thenReturn(1000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), -60));

        // When
        when(clock.millis()).thenReturn(1000L + STALENESS_WINDOW);

        // Then
        assertEquals(1, registry.list(null).size());
    }

    @Test
    void Given_stale_and_fresh_records_when_pruning_then_only_stale_records_are_removed() {
        // Given
        when(clock.millis()).thenReturn(1000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), -60));
        when(clock.millis()).thenReturn(20000L);
        registry.onAdvertisement(new ScanResult("Beurer BM57", DUMMY_MAC_ADDRESS_BLP, Collections.emptyList(), -60));

        // When
        when(clock.millis()).thenReturn(40000L);
        int removed = registry.prune();

        // Then
        assertEquals(1, removed);
        assertEquals(1, registry.size());
        assertNotNull(registry.get(DUMMY_MAC_ADDRESS_BLP));
    }

    @Test
    void When_listing_with_a_service_filter_then_only_peripherals_advertising_it_are_returned_sorted_by_address() {
        // Given
        when(clock.millis()).thenReturn(1000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Arrays.asList(HRS_SERVICE_UUID, BLP_SERVICE_UUID), -60));
        registry.onAdvertisement(new ScanResult("Beurer BM57", DUMMY_MAC_ADDRESS_BLP, Collections.singletonList(BLP_SERVICE_UUID), -60));

        // When
        List<DeviceRecord> blp = registry.list(BLP_SERVICE_UUID);
        List<DeviceRecord> hrs = registry.list(HRS_SERVICE_UUID);

        // Then
        assertEquals(2, blp.size());
        assertEquals(DUMMY_MAC_ADDRESS_BLP, blp.get(0).getAddress());
        assertEquals(DUMMY_MAC_ADDRESS_HRS, blp.get(1).getAddress());
        assertEquals(1, hrs.size());
    }

    @Test
    void Given_a_listed_snapshot_when_the_registry_changes_then_the_snapshot_is_unaffected() {
        // Given
        when(clock.millis()).thenReturn(1000L);
        registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), -60));
        List<DeviceRecord> snapshot = registry.list(null);

        // When
        registry.onAdvertisement(new ScanResult("Beurer BM57", DUMMY_MAC_ADDRESS_BLP, Collections.emptyList(), -60));
        registry.clear();

        // Then
        assertEquals(1, snapshot.size());
        assertEquals(0, registry.size());
    }

    @Test
    void Given_concurrent_advertisements_for_one_peripheral_then_a_single_record_remains() throws InterruptedException {
        // Given
        when(clock.millis()).thenReturn(1000L);
        List<Thread> threads = new ArrayList<>();

        // When
        for (int i = 0; i < 8; i++) {
            final int rssi = -40 - i;
            Thread thread = new Thread(() -> {
                for (int j = 0; j < 100; j++) {
                    registry.onAdvertisement(new ScanResult("Polar H10", DUMMY_MAC_ADDRESS_HRS, Collections.emptyList(), rssi));
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertEquals(1, registry.size());
        assertEquals(1, registry.list(null).size());
    }
}
