package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Named single-threaded execution context. Everything posted to one Handler runs sequentially,
 * in posting order, on the same thread.
 *
 * <p>After {@link #shutdown()} runnables that were already posted still run, delayed runnables
 * are discarded and new ones are ignored.
 */
public class Handler {
    private static final String TAG = Handler.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    @NotNull
    private final ScheduledThreadPoolExecutor executor;

    @NotNull
    private final String name;

    public Handler(@NotNull String name) {
        this.name = Objects.requireNonNull(name, "no valid name provided");
        executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            final Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * Run a runnable on this handler.
     *
     * @param runnable the runnable to execute
     * @return false if this handler is shut down and the runnable will never run
     */
    public final boolean post(@NotNull final Runnable runnable) {
        Objects.requireNonNull(runnable, "no valid runnable provided");
        if (executor.isShutdown()) {
            logger.debug(String.format("handler '%s' is shut down, ignoring runnable", name));
            return false;
        }
        try {
            executor.execute(guard(runnable));
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug(String.format("handler '%s' shut down while posting, ignoring runnable", name));
            return false;
        }
    }

    /**
     * Schedule a runnable on this handler.
     *
     * @param runnable the runnable to execute
     * @param delayMillis delay before execution
     * @return future that can be used to cancel the runnable, or null if this handler is shut down
     */
    @Nullable
    public final ScheduledFuture<?> postDelayed(@NotNull final Runnable runnable, long delayMillis) {
        Objects.requireNonNull(runnable, "no valid runnable provided");
        if (executor.isShutdown()) {
            logger.debug(String.format("handler '%s' is shut down, ignoring delayed runnable", name));
            return null;
        }
        try {
            return executor.schedule(guard(runnable), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug(String.format("handler '%s' shut down while posting, ignoring delayed runnable", name));
            return null;
        }
    }

    public final boolean isShutdown() {
        return executor.isShutdown();
    }

    public final void shutdown() {
        executor.shutdown();
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    private Runnable guard(@NotNull final Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (RuntimeException e) {
                logger.error(String.format("uncaught exception on handler '%s'", name), e);
            }
        };
    }
}
