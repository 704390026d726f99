package com.welie.blecore;

/**
 * Lifecycle of the single connection managed by a {@link BluetoothCentralManager}.
 */
public enum ConnectionState {
    /**
     * No connection is desired. Initial and resting state.
     */
    DISCONNECTED,

    /**
     * The adapter is establishing the link.
     */
    CONNECTING,

    /**
     * The link is up and services are being discovered.
     */
    DISCOVERING,

    /**
     * Services are known and commands are executed.
     */
    CONNECTED,

    /**
     * The link is being torn down on request of the application.
     */
    DISCONNECTING,

    /**
     * The link was lost and the next reconnect attempt is scheduled.
     */
    RECONNECTING
}
