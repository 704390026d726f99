package com.welie.blecore;

import org.jetbrains.annotations.NotNull;

/**
 * Outcome codes for connection attempts and GATT commands.
 */
@SuppressWarnings("unused")
public enum BluetoothCommandStatus {

    // Values up to 0x7F are the ATT error codes from the Bluetooth Core Specification, Volume 3, Part F, 3.4.1.
    // An adapter reports them through an AdapterException.

    /**
     * Success
     */
    COMMAND_SUCCESS(0x00),

    /**
     * The attribute cannot be read.
     */
    READ_NOT_PERMITTED(0x02),

    /**
     * The attribute cannot be written.
     */
    WRITE_NOT_PERMITTED(0x03),

    /**
     * The attribute requires authentication before it can be read or written.
     */
    INSUFFICIENT_AUTHENTICATION(0x05),

    /**
     * Attribute server does not support the request received from the client.
     */
    REQUEST_NOT_SUPPORTED(0x06),

    /**
     * The attribute requires authorization before it can be read or written.
     */
    INSUFFICIENT_AUTHORIZATION(0x08),

    /**
     * The attribute value length is invalid for the operation.
     */
    INVALID_ATTRIBUTE_VALUE_LENGTH(0x0D),

    /**
     * The attribute requires encryption before it can be read or written.
     */
    INSUFFICIENT_ENCRYPTION(0x0F),

    /**
     * The link layer initiated a connection but it could not be established.
     */
    CONNECTION_FAILED_ESTABLISHMENT(0x3E),

    //
    // (0x80 and up) - outcomes produced by this library
    //

    /**
     * The radio stack reported a failure that has no more specific code
     */
    ADAPTER_ERROR(0x80),

    /**
     * The operation did not complete before its deadline
     */
    TIMEOUT(0x81),

    /**
     * Another connection is being set up or is active
     */
    BUSY(0x82),

    /**
     * The requested peripheral is already connected or being connected
     */
    ALREADY_CONNECTED(0x83),

    /**
     * Peripheral is not connected
     */
    NOT_CONNECTED(0x84),

    /**
     * The connection the operation belonged to was superseded
     */
    CANCELLED(0x85),

    /**
     * Services could not be discovered after connecting
     */
    DISCOVERY_FAILED(0x86),

    /**
     * The peripheral was never seen while scanning
     */
    UNKNOWN_PERIPHERAL(0x87),

    /**
     * The characteristic is not part of the discovered services
     */
    CHARACTERISTIC_NOT_AVAILABLE(0x88),

    /**
     * The characteristic does not support the requested operation
     */
    OPERATION_NOT_SUPPORTED(0x89),

    /**
     * The link to the peripheral was lost unexpectedly
     */
    LINK_LOST(0x8A),

    /**
     * Unknown status
     *
     * Should not ever happen
     */
    UNKNOWN_STATUS(0xFFFF);

    BluetoothCommandStatus(int value) {
        this.value = value;
    }

    private final int value;

    public int getValue() {
        return value;
    }

    @NotNull
    public static BluetoothCommandStatus fromValue(int value) {
        for (BluetoothCommandStatus type : values()) {
            if (type.getValue() == value)
                return type;
        }
        return UNKNOWN_STATUS;
    }
}
