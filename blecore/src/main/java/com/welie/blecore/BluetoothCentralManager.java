package com.welie.blecore;

import com.welie.blecore.BluetoothGattCharacteristic.WriteType;
import com.welie.blecore.adapter.AdapterCallback;
import com.welie.blecore.adapter.AdapterException;
import com.welie.blecore.adapter.BluetoothAdapter;
import com.welie.blecore.adapter.ConnectionToken;
import com.welie.blecore.internal.InternalCallback;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

import static com.welie.blecore.BluetoothCommandStatus.*;

/**
 * Represents a Bluetooth Central object
 *
 * <p>Scans for peripherals, manages one connection at a time and executes GATT operations on it.
 * All public methods are thread-safe and return immediately; results are delivered through the
 * returned futures and through {@link BluetoothCentralManagerCallback}.
 */
public class BluetoothCentralManager {
    private static final String TAG = BluetoothCentralManager.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    /**
     * Scan option: only report peripherals that advertise a name.
     */
    public static final String SCANOPTION_NO_NULL_NAMES = "ScanOption.NoNullNames";

    private static final String NO_VALID_PERIPHERAL_ADDRESS_PROVIDED = "no valid peripheral address provided";
    private static final String NO_VALID_CHARACTERISTIC_PROVIDED = "no valid characteristic provided";
    private static final String CENTRAL_MANAGER_IS_SHUT_DOWN = "central manager is shut down";

    @NotNull
    private final BluetoothAdapter adapter;

    @NotNull
    private final BluetoothCentralManagerCallback bluetoothCentralManagerCallback;

    @NotNull
    private final BluetoothCentralConfig config;

    @NotNull
    private final Handler callBackHandler = new Handler("Central-callback");

    @NotNull
    private final Handler queueHandler = new Handler("Central-queue");

    @NotNull
    private final Handler signalHandler = new Handler("Central-signal");

    @NotNull
    private final ResultDelivery delivery = new ResultDelivery(callBackHandler);

    @NotNull
    private final DeviceRegistry registry;

    @NotNull
    private final NotificationFanout notificationFanout;

    @NotNull
    private final ConnectionStateMachine connection;

    @NotNull
    private final CommandQueue commandQueue;

    private final Set<CompletableFuture<List<DeviceRecord>>> pendingDiscoveries = ConcurrentHashMap.newKeySet();

    protected volatile boolean isScanning = false;
    private volatile boolean isShutdown = false;
    private volatile int rssiThreshold;
    private volatile @NotNull ScanFilter scanFilter = ScanFilter.ALL;

    private final InternalCallback internalCallback = new InternalCallback() {
        @Override
        public void stateChanged(@NotNull ConnectionState state) {
            if (state == ConnectionState.DISCONNECTED || state == ConnectionState.RECONNECTING) {
                commandQueue.cancelAll(CANCELLED);
                notificationFanout.deactivateAll();
            }
            postCallback(() -> bluetoothCentralManagerCallback.onConnectionStateChanged(state));
        }

        @Override
        public void generationChanged(long generation) {
            commandQueue.cancelAll(CANCELLED);
            notificationFanout.deactivateAll();
            notificationFanout.setGeneration(generation);
        }

        @Override
        public void connected(@NotNull String address, @NotNull ServiceMap serviceMap) {
            postCallback(() -> bluetoothCentralManagerCallback.onReady(address, serviceMap));
            commandQueue.nextCommand();
        }

        @Override
        public void connectFailed(@NotNull String address, @NotNull BluetoothCommandStatus status) {
            postCallback(() -> bluetoothCentralManagerCallback.onConnectionFailed(address, status));
        }

        @Override
        public void disconnected(@NotNull String address, @NotNull BluetoothCommandStatus status) {
            postCallback(() -> bluetoothCentralManagerCallback.onDisconnectedPeripheral(address, status));
        }
    };

    private final AdapterCallback adapterCallback = new AdapterCallback() {
        @Override
        public void onAdvertisement(@NotNull ScanResult scanResult) {
            signalHandler.post(() -> handleAdvertisement(scanResult));
        }

        @Override
        public void onCharacteristicChanged(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId, @NotNull byte[] value) {
            final byte[] copy = Arrays.copyOf(value, value.length);
            queueHandler.post(() -> handleNotification(token, characteristicId, copy));
        }

        @Override
        public void onDisconnected(@NotNull ConnectionToken token) {
            queueHandler.post(() -> connection.onLinkLost(token));
        }
    };

    /**
     * Construct a new BluetoothCentralManager object with the default configuration
     *
     * @param bluetoothCentralManagerCallback the callback to call for updates
     * @param adapter the radio stack to use
     */
    public BluetoothCentralManager(@NotNull BluetoothCentralManagerCallback bluetoothCentralManagerCallback, @NotNull BluetoothAdapter adapter) {
        this(bluetoothCentralManagerCallback, adapter, BluetoothCentralConfig.defaults());
    }

    /**
     * Construct a new BluetoothCentralManager object
     *
     * @param bluetoothCentralManagerCallback the callback to call for updates
     * @param adapter the radio stack to use
     * @param config timeouts, reconnect policy and scan settings
     */
    public BluetoothCentralManager(@NotNull BluetoothCentralManagerCallback bluetoothCentralManagerCallback, @NotNull BluetoothAdapter adapter, @NotNull BluetoothCentralConfig config) {
        this(bluetoothCentralManagerCallback, adapter, config, Clock.systemUTC(), new Random());
    }

    BluetoothCentralManager(@NotNull BluetoothCentralManagerCallback bluetoothCentralManagerCallback, @NotNull BluetoothAdapter adapter, @NotNull BluetoothCentralConfig config, @NotNull Clock clock, @NotNull Random random) {
        this.bluetoothCentralManagerCallback = Objects.requireNonNull(bluetoothCentralManagerCallback, "no valid bluetoothCentralManagerCallback provided");
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.config = Objects.requireNonNull(config, "no valid config provided");
        Objects.requireNonNull(clock, "no valid clock provided");
        Objects.requireNonNull(random, "no valid random provided");

        this.rssiThreshold = config.getRssiThreshold();
        this.registry = new DeviceRegistry(clock, config.getStalenessWindowMillis());
        this.notificationFanout = new NotificationFanout(config.getNotificationBufferSize());
        this.connection = new ConnectionStateMachine(adapter, config, queueHandler, delivery, internalCallback, random);
        this.commandQueue = new CommandQueue(adapter, connection, notificationFanout, queueHandler, delivery, config.getCommandTimeoutMillis());

        logger.info(String.format("using configuration %s", config));
        adapter.setCallback(adapterCallback);
        schedulePrune();
    }

    /*
     * Scanning
     */

    /**
     * Scan for any peripheral that is advertising.
     */
    public void scanForPeripherals() {
        startScan(ScanFilter.ALL);
    }

    /**
     * Scan for peripherals that advertise at least one of the specified service UUIDs.
     *
     * @param serviceUUIDs an array of service UUIDs
     */
    public void scanForPeripheralsWithServices(@NotNull final UUID[] serviceUUIDs) {
        startScan(ScanFilter.withServices(serviceUUIDs));
    }

    /**
     * Scan for peripherals with advertisement names containing any of the specified peripheral names.
     *
     * @param peripheralNames array of partial peripheral names
     */
    public void scanForPeripheralsWithNames(@NotNull final String[] peripheralNames) {
        startScan(ScanFilter.withNames(peripheralNames));
    }

    /**
     * Scan for peripherals that have any of the specified peripheral mac addresses.
     *
     * @param peripheralAddresses array of peripheral mac addresses to scan for
     */
    public void scanForPeripheralsWithAddresses(@NotNull final String[] peripheralAddresses) {
        startScan(ScanFilter.withAddresses(peripheralAddresses));
    }

    /**
     * Start scanning. A scan that is already running is restarted with the new filter.
     *
     * @param filter the filter to apply to advertisements
     */
    public void startScan(@NotNull final ScanFilter filter) {
        Objects.requireNonNull(filter, "no valid scan filter provided");
        signalHandler.post(() -> startScanning(filter));
    }

    /**
     * Stop scanning for peripherals.
     */
    public void stopScan() {
        signalHandler.post(this::stopScanning);
    }

    /**
     * Scan for a limited time and report what was found.
     *
     * @param filter the filter to apply to advertisements
     * @param durationMillis how long to scan
     * @return future with the peripherals matching the filter, sorted by address
     */
    @NotNull
    public CompletableFuture<List<DeviceRecord>> discover(@NotNull final ScanFilter filter, long durationMillis) {
        Objects.requireNonNull(filter, "no valid scan filter provided");
        if (durationMillis <= 0) {
            throw new IllegalArgumentException("duration must be positive");
        }

        final CompletableFuture<List<DeviceRecord>> result = new CompletableFuture<>();
        if (rejectWhenShutdown(result)) return result;

        pendingDiscoveries.add(result);
        final boolean posted = signalHandler.post(() -> {
            startScanning(filter);
            final ScheduledFuture<?> finish = signalHandler.postDelayed(() -> {
                stopScanning();
                final List<DeviceRecord> found = new ArrayList<>();
                for (DeviceRecord record : registry.list(null)) {
                    if (filter.matches(record)) {
                        found.add(record);
                    }
                }
                logger.info(String.format("discovery finished, found %d peripheral(s)", found.size()));
                pendingDiscoveries.remove(result);
                delivery.complete(result, found);
            }, durationMillis);
            if (finish == null) {
                cancelDiscovery(result);
            }
        });
        if (!posted) {
            cancelDiscovery(result);
        }
        return result;
    }

    private void startScanning(@NotNull final ScanFilter filter) {
        if (isScanning) {
            logger.debug("restarting scan with new filter");
            stopAdapterScan();
        }

        scanFilter = filter;
        try {
            adapter.startScan(filter);
            isScanning = true;
            logger.info(String.format("scan started with %s", filter));
            postCallback(bluetoothCentralManagerCallback::onScanStarted);
        } catch (AdapterException e) {
            isScanning = false;
            logger.error(String.format("could not start scan: %s", e.getMessage()));
            postCallback(() -> bluetoothCentralManagerCallback.onScanFailed(e.getStatus()));
        } catch (RuntimeException e) {
            isScanning = false;
            logger.error("could not start scan", e);
            postCallback(() -> bluetoothCentralManagerCallback.onScanFailed(ADAPTER_ERROR));
        }
    }

    private void stopScanning() {
        if (!isScanning) {
            logger.debug("not scanning, ignoring stopScan");
            return;
        }

        stopAdapterScan();
        logger.info("scan stopped");
        postCallback(bluetoothCentralManagerCallback::onScanStopped);
    }

    private void stopAdapterScan() {
        isScanning = false;
        try {
            adapter.stopScan();
        } catch (AdapterException e) {
            logger.error(String.format("could not stop scan: %s", e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("could not stop scan", e);
        }
    }

    private void handleAdvertisement(@NotNull final ScanResult scanResult) {
        if (!isScanning) return;
        if (scanResult.getRssi() < rssiThreshold) return;

        // Implement SCANOPTION_NO_NULL_NAMES
        if (config.getScanOptions().contains(SCANOPTION_NO_NULL_NAMES) && (scanResult.getName() == null)) return;
        if (!scanFilter.matches(scanResult)) return;

        final DeviceRecord record = registry.onAdvertisement(scanResult);
        postCallback(() -> bluetoothCentralManagerCallback.onDiscoveredPeripheral(record));
    }

    private void schedulePrune() {
        signalHandler.postDelayed(() -> {
            registry.prune();
            schedulePrune();
        }, config.getPruneIntervalMillis());
    }

    /*
     * Connection
     */

    /**
     * Connect to a peripheral that was seen while scanning.
     *
     * <p>Fails with UNKNOWN_PERIPHERAL if the peripheral is not in the registry, with BUSY or
     * ALREADY_CONNECTED if a connection exists or is being set up, with TIMEOUT or an adapter
     * status if the link could not be established, and with DISCOVERY_FAILED if services could
     * not be discovered.
     *
     * @param peripheralAddress the address of the peripheral
     * @return future with the discovered services, completing when the peripheral is ready
     */
    @NotNull
    public CompletableFuture<ServiceMap> connect(@NotNull final String peripheralAddress) {
        Objects.requireNonNull(peripheralAddress, NO_VALID_PERIPHERAL_ADDRESS_PROVIDED);

        final CompletableFuture<ServiceMap> result = new CompletableFuture<>();
        if (rejectWhenShutdown(result)) return result;

        final boolean posted = queueHandler.post(() -> {
            if (registry.get(peripheralAddress) == null) {
                logger.warn(String.format("WARNING: Peripheral '%s' has not been discovered", peripheralAddress));
                delivery.fail(result, UNKNOWN_PERIPHERAL, String.format("peripheral '%s' has not been discovered", peripheralAddress));
                return;
            }
            connection.connect(peripheralAddress, result);
        });
        if (!posted) {
            delivery.fail(result, CANCELLED, CENTRAL_MANAGER_IS_SHUT_DOWN);
        }
        return result;
    }

    /**
     * Disconnect from the peripheral, or stop connecting or reconnecting to it. Always ends in
     * DISCONNECTED, also when the radio does not confirm the disconnect in time.
     *
     * @return future completing when the state is DISCONNECTED
     */
    @NotNull
    public CompletableFuture<Void> disconnect() {
        final CompletableFuture<Void> result = new CompletableFuture<>();
        if (isShutdown) {
            result.complete(null);
            return result;
        }

        if (!queueHandler.post(() -> connection.disconnect(result))) {
            result.complete(null);
        }
        return result;
    }

    public @NotNull ConnectionState getState() {
        return connection.getState();
    }

    public boolean isConnected() {
        return connection.getState() == ConnectionState.CONNECTED;
    }

    /**
     * @return the address of the peripheral while CONNECTED, otherwise null
     */
    public @Nullable String getConnectedPeripheralAddress() {
        final ConnectionHandle handle = connection.getHandle();
        if (handle == null || !isConnected()) return null;
        return handle.getAddress();
    }

    /**
     * @return the services of the connected peripheral, or an empty map when not connected
     */
    public @NotNull ServiceMap getServiceMap() {
        final ConnectionHandle handle = connection.getHandle();
        if (handle == null || !isConnected()) return ServiceMap.EMPTY;
        return handle.getServiceMap();
    }

    /*
     * GATT operations
     */

    /**
     * Queue a GATT operation on the connected peripheral.
     *
     * <p>Operations run one at a time in submission order. An operation submitted while
     * connecting waits until the peripheral is ready. It fails with CANCELLED when the
     * connection it was submitted for goes away, with TIMEOUT when the peripheral does not answer
     * in time, and with NOT_CONNECTED when no connection is wanted at all.
     *
     * @param operation the operation
     * @return future with the value read, the value written, or an empty array for subscriptions
     */
    @NotNull
    public CompletableFuture<byte[]> submit(@NotNull final GattOperation operation) {
        Objects.requireNonNull(operation, "no valid operation provided");

        final CompletableFuture<byte[]> result = new CompletableFuture<>();
        if (rejectWhenShutdown(result)) return result;

        if (!queueHandler.post(() -> commandQueue.enqueue(operation, result))) {
            delivery.fail(result, CANCELLED, CENTRAL_MANAGER_IS_SHUT_DOWN);
        }
        return result;
    }

    @NotNull
    public CompletableFuture<byte[]> readCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
        return submit(GattOperation.read(CharacteristicId.of(serviceUUID, characteristicUUID)));
    }

    @NotNull
    public CompletableFuture<byte[]> writeCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final byte[] value, @NotNull final WriteType writeType) {
        return submit(GattOperation.write(CharacteristicId.of(serviceUUID, characteristicUUID), value, writeType));
    }

    /**
     * Turn notifications or indications on or off for a characteristic.
     *
     * @param serviceUUID the service of the characteristic
     * @param characteristicUUID the characteristic
     * @param enable true to turn on, false to turn off
     * @return future completing when the peripheral confirmed the change
     */
    @NotNull
    public CompletableFuture<byte[]> setNotify(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, boolean enable) {
        final CharacteristicId characteristicId = CharacteristicId.of(serviceUUID, characteristicUUID);
        return submit(enable ? GattOperation.subscribe(characteristicId) : GattOperation.unsubscribe(characteristicId));
    }

    /**
     * Open a stream of notifications for a characteristic. Values flow once notifications have
     * been turned on with {@link #setNotify(UUID, UUID, boolean)} or a subscribe operation.
     * Every open stream receives every value.
     *
     * @param characteristicId the characteristic
     * @return the stream; close it when no longer needed
     */
    @NotNull
    public NotificationSubscription subscribe(@NotNull final CharacteristicId characteristicId) {
        Objects.requireNonNull(characteristicId, NO_VALID_CHARACTERISTIC_PROVIDED);
        return notificationFanout.subscribe(characteristicId);
    }

    private void handleNotification(@NotNull ConnectionToken token, @NotNull CharacteristicId characteristicId, @NotNull byte[] value) {
        final ConnectionHandle handle = connection.getHandle();
        final long generation = (handle != null && token.equals(handle.getToken())) ? handle.getGeneration() : -1;
        final NotificationEvent event = new NotificationEvent(characteristicId, value, generation);
        if (notificationFanout.publish(event)) {
            postCallback(() -> bluetoothCentralManagerCallback.onNotification(event));
        }
    }

    /*
     * Registry
     */

    /**
     * Get the peripherals seen recently.
     *
     * @param serviceUUID if not null, only peripherals advertising this service
     * @return snapshot sorted by address
     */
    @NotNull
    public List<DeviceRecord> getDevices(@Nullable final UUID serviceUUID) {
        return registry.list(serviceUUID);
    }

    @Nullable
    public DeviceRecord getDevice(@NotNull final String peripheralAddress) {
        Objects.requireNonNull(peripheralAddress, NO_VALID_PERIPHERAL_ADDRESS_PROVIDED);
        return registry.get(peripheralAddress);
    }

    /**
     * Ignore advertisements with a weaker signal than the threshold.
     *
     * @param threshold RSSI threshold in dBm
     */
    public void setRssiThreshold(final int threshold) {
        this.rssiThreshold = BluetoothCentralConfig.checkRssiThreshold(threshold);
    }

    public boolean isScanning() {
        return isScanning;
    }

    public @NotNull BluetoothCentralConfig getConfig() {
        return config;
    }

    /**
     * Stop scanning, drop the connection and release all threads. Pending operations fail with
     * CANCELLED and open notification streams are closed.
     */
    public void shutdown() {
        if (isShutdown) return;
        isShutdown = true;
        logger.info("shutting down central manager");

        signalHandler.post(() -> {
            if (isScanning) stopAdapterScan();
            registry.clear();
        });
        signalHandler.shutdown();
        for (CompletableFuture<List<DeviceRecord>> discovery : pendingDiscoveries) {
            cancelDiscovery(discovery);
        }

        queueHandler.post(() -> {
            connection.close();
            commandQueue.cancelAll(CANCELLED);
            notificationFanout.deactivateAll();
            notificationFanout.closeAll();
            callBackHandler.post(callBackHandler::shutdown);
        });
        queueHandler.shutdown();
    }

    private void postCallback(@NotNull Runnable runnable) {
        callBackHandler.post(runnable);
    }

    private void cancelDiscovery(@NotNull CompletableFuture<List<DeviceRecord>> discovery) {
        pendingDiscoveries.remove(discovery);
        delivery.fail(discovery, CANCELLED, CENTRAL_MANAGER_IS_SHUT_DOWN);
    }

    private boolean rejectWhenShutdown(@NotNull CompletableFuture<?> result) {
        if (!isShutdown) return false;
        logger.warn("WARNING: Central manager is shut down");
        result.completeExceptionally(new BluetoothException(CANCELLED, CENTRAL_MANAGER_IS_SHUT_DOWN));
        return true;
    }
}
