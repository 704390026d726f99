package com.welie.blecore;

import com.welie.blecore.adapter.AdapterException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for calling into a {@link com.welie.blecore.adapter.BluetoothAdapter}.
 */
final class AdapterCalls {

    private AdapterCalls() {
    }

    /**
     * Call the adapter, turning a thrown exception or a missing future into a failed future.
     */
    @NotNull
    static <T> CompletableFuture<T> invoke(@NotNull Supplier<CompletableFuture<T>> call) {
        try {
            final CompletableFuture<T> future = call.get();
            if (future == null) {
                return failed(new AdapterException("adapter returned no result"));
            }
            return future;
        } catch (RuntimeException e) {
            return failed(e);
        }
    }

    @NotNull
    static <T> CompletableFuture<T> failed(@NotNull Throwable throwable) {
        final CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(throwable);
        return future;
    }

    /**
     * Map an adapter failure to a status.
     */
    @NotNull
    static BluetoothCommandStatus statusOf(@Nullable Throwable throwable) {
        final Throwable cause = unwrap(throwable);
        if (cause instanceof AdapterException) {
            return ((AdapterException) cause).getStatus();
        }
        if (cause instanceof BluetoothException) {
            return ((BluetoothException) cause).getStatus();
        }
        return BluetoothCommandStatus.ADAPTER_ERROR;
    }

    @Nullable
    static Throwable unwrap(@Nullable Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    @NotNull
    static String describe(@Nullable Throwable throwable) {
        final Throwable cause = unwrap(throwable);
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
