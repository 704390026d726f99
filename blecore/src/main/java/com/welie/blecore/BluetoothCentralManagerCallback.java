/*
 *   Copyright (c) 2019 Martijn van Welie
 *
 *   Permission is hereby granted, free of charge, to any person obtaining a copy
 *   of this software and associated documentation files (the "Software"), to deal
 *   in the Software without restriction, including without limitation the rights
 *   to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 *   copies of the Software, and to permit persons to whom the Software is
 *   furnished to do so, subject to the following conditions:
 *
 *   The above copyright notice and this permission notice shall be included in all
 *   copies or substantial portions of the Software.
 *
 *   THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 *   IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 *   FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 *   AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 *   LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 *   OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 *   SOFTWARE.
 *
 */
package com.welie.blecore;

import org.jetbrains.annotations.NotNull;

/**
 * Callbacks for BluetoothCentralManager operations.
 *
 * <p>All callbacks are invoked on the central's callback thread, one at a time, in the order the
 * events happened.
 */
public abstract class BluetoothCentralManagerCallback {

    /**
     * The connection state changed.
     *
     * @param state the new state
     */
    public void onConnectionStateChanged(@NotNull ConnectionState state) {}

    /**
     * Connected with the peripheral and its services are discovered. Commands can now be executed.
     *
     * @param peripheralAddress the address of the peripheral
     * @param serviceMap the discovered services
     */
    public void onReady(@NotNull String peripheralAddress, @NotNull ServiceMap serviceMap) {}

    /**
     * Connecting with the device has failed. Also called for every failed reconnect attempt.
     *
     * @param peripheralAddress the address of the peripheral for which the connection was attempted
     * @param status the status code for the connection failure
     */
    public void onConnectionFailed(@NotNull String peripheralAddress, @NotNull BluetoothCommandStatus status) {}

    /**
     * Device disconnected and no reconnect will be attempted.
     *
     * @param peripheralAddress the address of the peripheral that disconnected.
     * @param status COMMAND_SUCCESS after a requested disconnect, otherwise the reason
     */
    public void onDisconnectedPeripheral(@NotNull String peripheralAddress, @NotNull BluetoothCommandStatus status) {}

    /**
     * Discovered a peripheral, or received a new advertisement from one.
     *
     * @param record what is now known about the peripheral
     */
    public void onDiscoveredPeripheral(@NotNull DeviceRecord record) {}

    /**
     * A subscribed characteristic sent a new value.
     *
     * @param event the notification
     */
    public void onNotification(@NotNull NotificationEvent event) {}

    /**
     * A scan has started
     */
    public void onScanStarted() {}

    /**
     * A scan has stopped
     */
    public void onScanStopped() {}

    /**
     * Scanning failed
     *
     * @param status the status code for the scanning failure
     */
    public void onScanFailed(@NotNull BluetoothCommandStatus status) {}
}
