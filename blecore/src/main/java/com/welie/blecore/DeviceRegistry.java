package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of peripherals seen while scanning, keyed by address.
 *
 * <p>Safe to use from any thread. Reads return snapshots, so callers can iterate while
 * advertisements keep coming in.
 */
public class DeviceRegistry {
    private static final String TAG = DeviceRegistry.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    @NotNull
    private final Map<String, DeviceRecord> records = new ConcurrentHashMap<>();

    @NotNull
    private final Clock clock;

    private final long stalenessWindowMillis;

    public DeviceRegistry(@NotNull Clock clock, long stalenessWindowMillis) {
        this.clock = Objects.requireNonNull(clock, "no valid clock provided");
        if (stalenessWindowMillis <= 0) {
            throw new IllegalArgumentException("staleness window must be positive");
        }
        this.stalenessWindowMillis = stalenessWindowMillis;
    }

    /**
     * Insert or update the record for the advertising peripheral.
     *
     * @param scanResult the advertisement
     * @return the record as now stored
     */
    @NotNull
    public DeviceRecord onAdvertisement(@NotNull ScanResult scanResult) {
        Objects.requireNonNull(scanResult, "no valid scan result provided");
        return records.compute(scanResult.getAddress(), (address, previous) -> {
            String name = scanResult.getName();
            // Many peripherals alternate between advertising packets with and without a name
            if (name == null && previous != null) {
                name = previous.getName();
            }
            return new DeviceRecord(address, name, clock.millis(), scanResult.getRssi(), scanResult.getUuids());
        });
    }

    /**
     * Get the non-stale records, sorted by address.
     *
     * @param serviceFilter if not null, only records advertising this service are returned
     * @return a snapshot of the matching records
     */
    @NotNull
    public List<DeviceRecord> list(@Nullable UUID serviceFilter) {
        final long now = clock.millis();
        final List<DeviceRecord> result = new ArrayList<>();
        for (DeviceRecord record : records.values()) {
            if (isStale(record, now)) continue;
            if (serviceFilter != null && !record.advertises(serviceFilter)) continue;
            result.add(record);
        }
        result.sort(Comparator.comparing(DeviceRecord::getAddress));
        return result;
    }

    @Nullable
    public DeviceRecord get(@NotNull String address) {
        Objects.requireNonNull(address, "no valid address provided");
        final DeviceRecord record = records.get(address);
        if (record == null || isStale(record, clock.millis())) return null;
        return record;
    }

    /**
     * Remove every record that has not been seen within the staleness window.
     *
     * @return the number of removed records
     */
    public int prune() {
        final long now = clock.millis();
        int removed = 0;
        for (DeviceRecord record : records.values()) {
            if (isStale(record, now) && records.remove(record.getAddress(), record)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug(String.format("pruned %d stale peripheral(s), %d remaining", removed, records.size()));
        }
        return removed;
    }

    public void clear() {
        records.clear();
    }

    public int size() {
        return records.size();
    }

    private boolean isStale(@NotNull DeviceRecord record, long now) {
        return now - record.getLastSeen() > stalenessWindowMillis;
    }
}
