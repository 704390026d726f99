package com.welie.blecore;

import com.welie.blecore.adapter.BluetoothAdapter;
import com.welie.blecore.adapter.ConnectionToken;
import com.welie.blecore.internal.InternalCallback;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

import static com.welie.blecore.BluetoothCommandStatus.*;
import static com.welie.blecore.ConnectionState.*;

/**
 * Owns the lifecycle of the single connection: connect, discover services, reconnect after link
 * loss and disconnect.
 *
 * <p>Every connection attempt gets a new generation number. Adapter results are tagged with the
 * generation they were requested for and ignored when that generation is no longer current.
 *
 * <p>Apart from the getters, all methods must be called on the queue handler's thread.
 */
class ConnectionStateMachine {
    private static final String TAG = ConnectionStateMachine.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    @NotNull
    private final BluetoothAdapter adapter;

    @NotNull
    private final BluetoothCentralConfig config;

    @NotNull
    private final Handler queueHandler;

    @NotNull
    private final ResultDelivery delivery;

    @NotNull
    private final InternalCallback callback;

    @NotNull
    private final Random random;

    private volatile @NotNull ConnectionState state = DISCONNECTED;

    // Not null exactly when state is not DISCONNECTED
    private volatile @Nullable ConnectionHandle handle;

    private volatile long generation = 0;

    private int reconnectAttempt = 0;

    @Nullable
    private CompletableFuture<ServiceMap> pendingConnect;

    private final List<CompletableFuture<Void>> pendingDisconnects = new ArrayList<>();

    // Guards the connect, discovery or disconnect step in progress
    @Nullable
    private ScheduledFuture<?> timeoutFuture;

    @Nullable
    private ScheduledFuture<?> reconnectFuture;

    ConnectionStateMachine(@NotNull BluetoothAdapter adapter, @NotNull BluetoothCentralConfig config, @NotNull Handler queueHandler, @NotNull ResultDelivery delivery, @NotNull InternalCallback callback, @NotNull Random random) {
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.config = Objects.requireNonNull(config, "no valid config provided");
        this.queueHandler = Objects.requireNonNull(queueHandler, "no valid queue handler provided");
        this.delivery = Objects.requireNonNull(delivery, "no valid result delivery provided");
        this.callback = Objects.requireNonNull(callback, "no valid callback provided");
        this.random = Objects.requireNonNull(random, "no valid random provided");
    }

    @NotNull
    ConnectionState getState() {
        return state;
    }

    long getGeneration() {
        return generation;
    }

    @Nullable
    ConnectionHandle getHandle() {
        return handle;
    }

    void connect(@NotNull final String address, @NotNull final CompletableFuture<ServiceMap> result) {
        if (state != DISCONNECTED) {
            final ConnectionHandle current = handle;
            if (current != null && current.getAddress().equals(address)) {
                logger.warn(String.format("WARNING: Already connected or connecting to '%s'", address));
                delivery.fail(result, ALREADY_CONNECTED, String.format("already connected or connecting to '%s'", address));
            } else {
                logger.warn(String.format("WARNING: Cannot connect to '%s' while %s", address, state));
                delivery.fail(result, BUSY, String.format("cannot connect to '%s' while %s", address, state));
            }
            return;
        }

        pendingConnect = result;
        reconnectAttempt = 0;
        startAttempt(address);
    }

    private void startAttempt(@NotNull final String address) {
        final long attemptGeneration = advanceGeneration();
        handle = new ConnectionHandle(address, attemptGeneration);
        setState(CONNECTING);
        logger.info(String.format("connecting to '%s' (generation %d)", address, attemptGeneration));

        final long connectTimeout = config.getConnectTimeoutMillis();
        timeoutFuture = queueHandler.postDelayed(() -> {
            logger.error(String.format("connect to '%s' timed out after %d ms", address, connectTimeout));
            attemptFailed(attemptGeneration, TIMEOUT);
        }, connectTimeout);

        AdapterCalls.invoke(() -> adapter.connect(address, connectTimeout))
                .whenComplete((token, throwable) -> queueHandler.post(() -> onConnectResult(attemptGeneration, token, throwable)));
    }

    private void onConnectResult(long attemptGeneration, @Nullable ConnectionToken token, @Nullable Throwable throwable) {
        if (attemptGeneration != generation || state != CONNECTING) {
            if (token != null) {
                logger.info(String.format("closing link %s of superseded connection attempt", token));
                closeLink(token);
            } else {
                logger.debug(String.format("ignoring connect result of superseded generation %d", attemptGeneration));
            }
            return;
        }

        final ConnectionHandle current = Objects.requireNonNull(handle);
        cancelTimeout();
        if (throwable != null || token == null) {
            logger.error(String.format("connect to '%s' failed: %s", current.getAddress(), AdapterCalls.describe(throwable)));
            attemptFailed(attemptGeneration, throwable != null ? AdapterCalls.statusOf(throwable) : ADAPTER_ERROR);
            return;
        }

        logger.info(String.format("connected to '%s', discovering services", current.getAddress()));
        current.setToken(token);
        setState(DISCOVERING);
        discoverServices(attemptGeneration, token);
    }

    private void discoverServices(final long attemptGeneration, @NotNull final ConnectionToken token) {
        final long discoveryTimeout = config.getDiscoveryTimeoutMillis();
        timeoutFuture = queueHandler.postDelayed(() -> {
            logger.error(String.format("service discovery timed out after %d ms", discoveryTimeout));
            attemptFailed(attemptGeneration, DISCOVERY_FAILED);
        }, discoveryTimeout);

        AdapterCalls.invoke(() -> adapter.discoverServices(token))
                .whenComplete((services, throwable) -> queueHandler.post(() -> onServicesDiscovered(attemptGeneration, services, throwable)));
    }

    private void onServicesDiscovered(long attemptGeneration, @Nullable List<BluetoothGattService> services, @Nullable Throwable throwable) {
        if (attemptGeneration != generation || state != DISCOVERING) {
            logger.debug(String.format("ignoring service discovery result of superseded generation %d", attemptGeneration));
            return;
        }

        final ConnectionHandle current = Objects.requireNonNull(handle);
        cancelTimeout();
        if (throwable != null || services == null) {
            logger.error(String.format("service discovery for '%s' failed: %s", current.getAddress(), AdapterCalls.describe(throwable)));
            attemptFailed(attemptGeneration, DISCOVERY_FAILED);
            return;
        }

        final ServiceMap serviceMap = new ServiceMap(services);
        current.setServiceMap(serviceMap);
        reconnectAttempt = 0;
        logger.info(String.format("discovered %d services for '%s'", serviceMap.size(), current.getAddress()));
        setState(CONNECTED);
        callback.connected(current.getAddress(), serviceMap);

        final CompletableFuture<ServiceMap> result = pendingConnect;
        pendingConnect = null;
        if (result != null) {
            delivery.complete(result, serviceMap);
        }
    }

    private void attemptFailed(long attemptGeneration, @NotNull BluetoothCommandStatus status) {
        if (attemptGeneration != generation || (state != CONNECTING && state != DISCOVERING)) return;

        final ConnectionHandle failed = Objects.requireNonNull(handle);
        cancelTimeout();
        final ConnectionToken token = failed.getToken();
        if (token != null) {
            failed.setToken(null);
            closeLink(token);
        }

        final String address = failed.getAddress();
        callback.connectFailed(address, status);
        if (reconnectAttempt > 0) {
            scheduleReconnect(address, status);
            return;
        }

        handle = null;
        setState(DISCONNECTED);
        final CompletableFuture<ServiceMap> result = pendingConnect;
        pendingConnect = null;
        if (result != null) {
            delivery.fail(result, status, String.format("connecting to '%s' failed", address));
        }
    }

    private void scheduleReconnect(@NotNull final String address, @NotNull BluetoothCommandStatus lastStatus) {
        final ReconnectPolicy policy = config.getReconnectPolicy();
        final int attempt = reconnectAttempt + 1;
        if (attempt > policy.getMaxAttempts()) {
            logger.error(String.format("giving up reconnecting to '%s' after %d attempts", address, reconnectAttempt));
            reconnectAttempt = 0;
            handle = null;
            setState(DISCONNECTED);
            callback.disconnected(address, lastStatus);
            return;
        }

        reconnectAttempt = attempt;
        final long delay = policy.getDelay(attempt, random);
        setState(RECONNECTING);
        logger.info(String.format("reconnecting to '%s' in %d ms (attempt %d of %d)", address, delay, attempt, policy.getMaxAttempts()));
        reconnectFuture = queueHandler.postDelayed(() -> {
            reconnectFuture = null;
            if (state == RECONNECTING) {
                startAttempt(address);
            }
        }, delay);
    }

    /**
     * The adapter reported that a link went down.
     */
    void onLinkLost(@NotNull ConnectionToken token) {
        final ConnectionHandle current = handle;
        if (current == null || !token.equals(current.getToken())) {
            logger.debug(String.format("ignoring disconnect of stale link %s", token));
            return;
        }

        current.setToken(null);
        switch (state) {
            case CONNECTED:
                logger.info(String.format("link to '%s' lost", current.getAddress()));
                if (config.getReconnectPolicy().isEnabled()) {
                    reconnectAttempt = 0;
                    scheduleReconnect(current.getAddress(), LINK_LOST);
                } else {
                    handle = null;
                    setState(DISCONNECTED);
                    callback.disconnected(current.getAddress(), LINK_LOST);
                }
                break;
            case DISCOVERING:
                logger.error(String.format("link to '%s' lost during service discovery", current.getAddress()));
                attemptFailed(current.getGeneration(), LINK_LOST);
                break;
            default:
                // A disconnect in progress finishes through its own completion
                break;
        }
    }

    void disconnect(@NotNull final CompletableFuture<Void> result) {
        if (state == DISCONNECTED) {
            logger.info("not connected, nothing to disconnect");
            delivery.complete(result, null);
            return;
        }

        pendingDisconnects.add(result);
        if (state == DISCONNECTING) return;

        final ConnectionHandle current = Objects.requireNonNull(handle);
        final String address = current.getAddress();
        cancelTimeout();
        cancelReconnect();
        reconnectAttempt = 0;
        final long disconnectGeneration = advanceGeneration();
        setState(DISCONNECTING);

        final CompletableFuture<ServiceMap> connectResult = pendingConnect;
        pendingConnect = null;
        if (connectResult != null) {
            delivery.fail(connectResult, CANCELLED, String.format("connecting to '%s' was cancelled by disconnect", address));
        }

        final ConnectionToken token = current.getToken();
        if (token == null) {
            finishDisconnect(disconnectGeneration, address);
            return;
        }

        logger.info(String.format("disconnecting from '%s'", address));
        final long disconnectTimeout = config.getDisconnectTimeoutMillis();
        timeoutFuture = queueHandler.postDelayed(() -> {
            logger.warn(String.format("disconnect from '%s' did not complete within %d ms", address, disconnectTimeout));
            finishDisconnect(disconnectGeneration, address);
        }, disconnectTimeout);

        AdapterCalls.invoke(() -> adapter.disconnect(token))
                .whenComplete((ignored, throwable) -> queueHandler.post(() -> {
                    if (throwable != null) {
                        logger.error(String.format("disconnect from '%s' failed: %s", address, AdapterCalls.describe(throwable)));
                    }
                    finishDisconnect(disconnectGeneration, address);
                }));
    }

    private void finishDisconnect(long disconnectGeneration, @NotNull String address) {
        if (disconnectGeneration != generation || state != DISCONNECTING) return;

        cancelTimeout();
        handle = null;
        setState(DISCONNECTED);
        logger.info(String.format("disconnected from '%s'", address));
        callback.disconnected(address, COMMAND_SUCCESS);
        for (CompletableFuture<Void> result : pendingDisconnects) {
            delivery.complete(result, null);
        }
        pendingDisconnects.clear();
    }

    /**
     * Drop the connection without notifying anyone, used when the central shuts down.
     */
    void close() {
        cancelTimeout();
        cancelReconnect();
        final ConnectionHandle current = handle;
        final ConnectionToken token = current != null ? current.getToken() : null;
        if (token != null) {
            closeLink(token);
        }
        handle = null;
        state = DISCONNECTED;
        generation++;

        if (pendingConnect != null) {
            delivery.fail(pendingConnect, CANCELLED, "central was shut down");
            pendingConnect = null;
        }
        for (CompletableFuture<Void> result : pendingDisconnects) {
            delivery.complete(result, null);
        }
        pendingDisconnects.clear();
    }

    private long advanceGeneration() {
        generation++;
        callback.generationChanged(generation);
        return generation;
    }

    private void setState(@NotNull ConnectionState newState) {
        if (state == newState) return;
        logger.debug(String.format("state %s -> %s", state, newState));
        state = newState;
        callback.stateChanged(newState);
    }

    private void closeLink(@NotNull ConnectionToken token) {
        AdapterCalls.invoke(() -> adapter.disconnect(token)).whenComplete((ignored, throwable) -> {
            if (throwable != null) {
                logger.error(String.format("closing link %s failed: %s", token, AdapterCalls.describe(throwable)));
            }
        });
    }

    private void cancelTimeout() {
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }

    private void cancelReconnect() {
        if (reconnectFuture != null) {
            reconnectFuture.cancel(false);
            reconnectFuture = null;
        }
    }
}
