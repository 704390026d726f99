package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Completes result futures on the callback handler, so that code chained onto them never runs on
 * the queue thread. Completions keep the order in which they were requested. Once the callback
 * handler is shut down, futures are completed on the calling thread.
 */
final class ResultDelivery {

    @NotNull
    private final Handler callBackHandler;

    ResultDelivery(@NotNull Handler callBackHandler) {
        this.callBackHandler = Objects.requireNonNull(callBackHandler, "no valid handler provided");
    }

    <T> void complete(@NotNull final CompletableFuture<T> future, @Nullable final T value) {
        if (!callBackHandler.post(() -> future.complete(value))) {
            future.complete(value);
        }
    }

    <T> void fail(@NotNull final CompletableFuture<T> future, @NotNull final BluetoothCommandStatus status, @NotNull final String message) {
        final BluetoothException exception = new BluetoothException(status, message);
        if (!callBackHandler.post(() -> future.completeExceptionally(exception))) {
            future.completeExceptionally(exception);
        }
    }

    void post(@NotNull final Runnable callback) {
        callBackHandler.post(callback);
    }
}
