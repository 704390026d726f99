package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * An operation waiting in, or executing from, the {@link CommandQueue}.
 */
final class PendingCommand {

    @NotNull
    final GattOperation operation;

    /**
     * Generation of the connection this command was submitted against.
     */
    final long generation;

    @NotNull
    final CompletableFuture<byte[]> result;

    final long timeoutMillis;

    @Nullable
    ScheduledFuture<?> timeoutFuture;

    /**
     * True when this subscribe switched notification delivery on, so a failure must switch it off again.
     */
    boolean activatedNotifications;

    PendingCommand(@NotNull GattOperation operation, long generation, @NotNull CompletableFuture<byte[]> result, long timeoutMillis) {
        this.operation = Objects.requireNonNull(operation, "no valid operation provided");
        this.generation = generation;
        this.result = Objects.requireNonNull(result, "no valid result future provided");
        this.timeoutMillis = timeoutMillis;
    }

    void cancelTimer() {
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }

    @Override
    public String toString() {
        return String.format("%s [generation %d]", operation, generation);
    }
}
