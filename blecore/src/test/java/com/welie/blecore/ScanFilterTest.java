package com.welie.blecore;

import org.junit.jupiter.api.*;

import java.util.Collections;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ScanFilterTest {

    private static final UUID BLP_SERVICE_UUID = UUID.fromString("00001810-0000-1000-8000-00805f9b34fb");
    private static final UUID HTS_SERVICE_UUID = UUID.fromString("00001809-0000-1000-8000-00805f9b34fb");

    private static final ScanResult BLP = new ScanResult("Beurer BM57", "12:34:56:65:43:21", Collections.singletonList(BLP_SERVICE_UUID), -60);
    private static final ScanResult NAMELESS = new ScanResult(null, "00:11:22:33:44:55", Collections.emptyList(), -60);

    @Test
    void Given_the_empty_filter_then_everything_matches() {
        assertTrue(ScanFilter.ALL.isEmpty());
        assertTrue(ScanFilter.ALL.matches(BLP));
        assertTrue(ScanFilter.ALL.matches(NAMELESS));
    }

    @Test
    void Given_a_service_filter_then_only_peripherals_advertising_one_of_the_services_match() {
        ScanFilter filter = ScanFilter.withServices(new UUID[]{HTS_SERVICE_UUID, BLP_SERVICE_UUID});

        assertTrue(filter.matches(BLP));
        assertFalse(filter.matches(NAMELESS));
    }

    @Test
    void Given_a_name_filter_then_partial_names_match_and_nameless_peripherals_do_not() {
        ScanFilter filter = ScanFilter.withNames(new String[]{"BM57"});
        assertEquals(Collections.singleton("BM57"), filter.getNames());
        assertTrue(filter.getAddresses().isEmpty());

        assertTrue(filter.matches(BLP));
        assertFalse(filter.matches(NAMELESS));
    }

    @Test
    void Given_an_address_filter_then_only_exact_addresses_match() {
        ScanFilter filter = ScanFilter.withAddresses(new String[]{"00:11:22:33:44:55"});

        assertTrue(filter.matches(NAMELESS));
        assertFalse(filter.matches(BLP));
    }

    @Test
    void Given_a_filter_then_device_records_are_matched_the_same_way() {
        ScanFilter filter = ScanFilter.withServices(new UUID[]{BLP_SERVICE_UUID});
        DeviceRecord record = new DeviceRecord("12:34:56:65:43:21", "Beurer BM57", 1000L, -60, Collections.singletonList(BLP_SERVICE_UUID));

        assertTrue(filter.matches(record));
    }

    @Test
    void When_creating_a_filter_from_an_empty_array_then_an_exception_is_thrown() {
        assertThrows(IllegalArgumentException.class, () -> ScanFilter.withServices(new UUID[0]));
        assertThrows(NullPointerException.class, () -> ScanFilter.withNames(null));
    }
}
