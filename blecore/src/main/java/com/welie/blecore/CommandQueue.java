package com.welie.blecore;

import com.welie.blecore.adapter.BluetoothAdapter;
import com.welie.blecore.adapter.ConnectionToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;

import static com.welie.blecore.BluetoothCommandStatus.*;

/**
 * Executes GATT operations one at a time, in submission order, against the current connection.
 *
 * <p>A command only runs while the connection is CONNECTED and still has the generation the
 * command was submitted against. Each running command has a deadline; when it passes the command
 * fails with TIMEOUT and the next one starts. Commands are never retried.
 *
 * <p>All methods must be called on the queue handler's thread.
 */
class CommandQueue {
    private static final String TAG = CommandQueue.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    private static final byte[] NO_VALUE = new byte[0];

    @NotNull
    private final BluetoothAdapter adapter;

    @NotNull
    private final ConnectionStateMachine connection;

    @NotNull
    private final NotificationFanout fanout;

    @NotNull
    private final Handler queueHandler;

    @NotNull
    private final ResultDelivery delivery;

    private final long defaultTimeoutMillis;

    private final Queue<PendingCommand> commands = new ArrayDeque<>();

    @Nullable
    private PendingCommand currentCommand;

    CommandQueue(@NotNull BluetoothAdapter adapter, @NotNull ConnectionStateMachine connection, @NotNull NotificationFanout fanout, @NotNull Handler queueHandler, @NotNull ResultDelivery delivery, long defaultTimeoutMillis) {
        this.adapter = Objects.requireNonNull(adapter, "no valid adapter provided");
        this.connection = Objects.requireNonNull(connection, "no valid connection provided");
        this.fanout = Objects.requireNonNull(fanout, "no valid fanout provided");
        this.queueHandler = Objects.requireNonNull(queueHandler, "no valid queue handler provided");
        this.delivery = Objects.requireNonNull(delivery, "no valid result delivery provided");
        this.defaultTimeoutMillis = defaultTimeoutMillis;
    }

    /**
     * Add an operation to the queue, bound to the current connection generation.
     */
    void enqueue(@NotNull GattOperation operation, @NotNull CompletableFuture<byte[]> result) {
        final ConnectionState state = connection.getState();
        if (state == ConnectionState.DISCONNECTED || state == ConnectionState.DISCONNECTING) {
            logger.warn(String.format("WARNING: Peripheral not connected, rejecting %s", operation));
            delivery.fail(result, NOT_CONNECTED, "peripheral not connected");
            return;
        }

        final long timeout = operation.getTimeoutMillis() > 0 ? operation.getTimeoutMillis() : defaultTimeoutMillis;
        final PendingCommand command = new PendingCommand(operation, connection.getGeneration(), result, timeout);
        commands.add(command);
        logger.debug(String.format("queued %s (%d waiting)", command, commands.size()));
        nextCommand();
    }

    /**
     * Start the next command if none is running and the connection is ready.
     */
    void nextCommand() {
        while (currentCommand == null && connection.getState() == ConnectionState.CONNECTED) {
            final PendingCommand command = commands.poll();
            if (command == null) return;
            execute(command);
        }
    }

    /**
     * Resolve the running command and everything still waiting with the given status.
     */
    void cancelAll(@NotNull BluetoothCommandStatus status) {
        int cancelled = 0;
        if (currentCommand != null) {
            currentCommand.cancelTimer();
            delivery.fail(currentCommand.result, status, String.format("%s was cancelled", currentCommand.operation));
            currentCommand = null;
            cancelled++;
        }

        PendingCommand command;
        while ((command = commands.poll()) != null) {
            delivery.fail(command.result, status, String.format("%s was cancelled", command.operation));
            cancelled++;
        }

        if (cancelled > 0) {
            logger.info(String.format("cancelled %d command(s)", cancelled));
        }
    }

    int size() {
        return commands.size() + (currentCommand != null ? 1 : 0);
    }

    private void execute(@NotNull final PendingCommand command) {
        final ConnectionHandle handle = connection.getHandle();
        if (handle == null || handle.getGeneration() != command.generation) {
            logger.debug(String.format("cancelling %s, connection generation changed", command));
            delivery.fail(command.result, CANCELLED, String.format("%s belongs to a superseded connection", command.operation));
            return;
        }

        final ConnectionToken token = handle.getToken();
        if (token == null) {
            delivery.fail(command.result, NOT_CONNECTED, "peripheral not connected");
            return;
        }

        final GattOperation operation = command.operation;
        final CharacteristicId characteristicId = operation.getCharacteristicId();
        final BluetoothGattCharacteristic characteristic = handle.getServiceMap().getCharacteristic(characteristicId);
        if (characteristic == null) {
            logger.warn(String.format("WARNING: Characteristic %s not available on '%s'", characteristicId, handle.getAddress()));
            delivery.fail(command.result, CHARACTERISTIC_NOT_AVAILABLE, String.format("characteristic %s not available", characteristicId));
            return;
        }
        if (!supports(characteristic, operation)) {
            logger.warn(String.format("WARNING: Characteristic %s does not support %s", characteristicId, operation.getType()));
            delivery.fail(command.result, OPERATION_NOT_SUPPORTED, String.format("characteristic %s does not support %s", characteristicId, operation.getType()));
            return;
        }

        logger.debug(String.format("executing %s", command));
        if (operation.isWriteWithoutResponse()) {
            writeWithoutResponse(command, token);
            return;
        }

        currentCommand = command;
        final CompletableFuture<byte[]> call;
        switch (operation.getType()) {
            case READ:
                call = AdapterCalls.invoke(() -> adapter.read(token, characteristicId));
                break;
            case WRITE:
                final byte[] value = operation.getValue();
                final BluetoothGattCharacteristic.WriteType writeType = Objects.requireNonNull(operation.getWriteType());
                call = AdapterCalls.invoke(() -> adapter.write(token, characteristicId, value, writeType)).thenApply(ignored -> value);
                break;
            case SUBSCRIBE:
                // Active before the adapter call so the first notification is not lost
                command.activatedNotifications = !fanout.isActive(characteristicId);
                fanout.activate(characteristicId);
                call = AdapterCalls.invoke(() -> adapter.subscribe(token, characteristicId)).thenApply(ignored -> NO_VALUE);
                break;
            case UNSUBSCRIBE:
                fanout.deactivate(characteristicId);
                call = AdapterCalls.invoke(() -> adapter.unsubscribe(token, characteristicId)).thenApply(ignored -> NO_VALUE);
                break;
            default:
                throw new IllegalStateException("unknown operation type " + operation.getType());
        }

        command.timeoutFuture = queueHandler.postDelayed(() -> onTimeout(command), command.timeoutMillis);
        call.whenComplete((response, throwable) -> queueHandler.post(() -> onResult(command, response, throwable)));
    }

    private void writeWithoutResponse(@NotNull final PendingCommand command, @NotNull ConnectionToken token) {
        final GattOperation operation = command.operation;
        final byte[] value = operation.getValue();
        final CompletableFuture<Void> call = AdapterCalls.invoke(() -> adapter.write(token, operation.getCharacteristicId(), value, BluetoothGattCharacteristic.WriteType.WITHOUT_RESPONSE));
        if (call.isCompletedExceptionally()) {
            call.whenComplete((ignored, throwable) -> {
                logger.error(String.format("%s failed: %s", command, AdapterCalls.describe(throwable)));
                delivery.fail(command.result, AdapterCalls.statusOf(throwable), AdapterCalls.describe(throwable));
            });
            return;
        }

        // No acknowledgement will come, so the command is done once handed to the adapter
        delivery.complete(command.result, value);
        call.whenComplete((ignored, throwable) -> {
            if (throwable != null) {
                logger.error(String.format("%s failed after dispatch: %s", command, AdapterCalls.describe(throwable)));
            }
        });
    }

    private void onResult(@NotNull PendingCommand command, @Nullable byte[] value, @Nullable Throwable throwable) {
        if (command != currentCommand) {
            logger.debug(String.format("discarding late result for %s", command));
            return;
        }

        command.cancelTimer();
        currentCommand = null;
        if (throwable != null) {
            rollbackSubscribe(command);
            logger.error(String.format("%s failed: %s", command, AdapterCalls.describe(throwable)));
            delivery.fail(command.result, AdapterCalls.statusOf(throwable), AdapterCalls.describe(throwable));
        } else {
            logger.debug(String.format("completed %s", command));
            delivery.complete(command.result, value != null ? value : NO_VALUE);
        }
        nextCommand();
    }

    private void onTimeout(@NotNull PendingCommand command) {
        if (command != currentCommand) return;

        command.timeoutFuture = null;
        currentCommand = null;
        rollbackSubscribe(command);
        logger.warn(String.format("%s timed out after %d ms", command, command.timeoutMillis));
        delivery.fail(command.result, TIMEOUT, String.format("%s timed out", command.operation));
        nextCommand();
    }

    private void rollbackSubscribe(@NotNull PendingCommand command) {
        if (command.operation.getType() == GattOperation.Type.SUBSCRIBE && command.activatedNotifications) {
            fanout.deactivate(command.operation.getCharacteristicId());
        }
    }

    private static boolean supports(@NotNull BluetoothGattCharacteristic characteristic, @NotNull GattOperation operation) {
        switch (operation.getType()) {
            case READ:
                return characteristic.supportsReading();
            case WRITE:
                return characteristic.supportsWriteType(Objects.requireNonNull(operation.getWriteType()));
            case SUBSCRIBE:
            case UNSUBSCRIBE:
                return characteristic.supportsNotifying();
            default:
                return false;
        }
    }
}
