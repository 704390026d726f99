package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * The receiving end of a {@link BluetoothCentralManager#subscribe(CharacteristicId)} call.
 *
 * <p>Events are buffered per subscription. When the buffer is full new events are dropped for
 * this subscription only and counted in {@link #getDroppedCount()}. After {@link #close()} no more
 * events are delivered; subscribe again to start a fresh stream.
 */
public final class NotificationSubscription implements AutoCloseable {

    @NotNull
    private final NotificationFanout fanout;

    @NotNull
    private final NotificationFanout.Slot slot;

    NotificationSubscription(@NotNull NotificationFanout fanout, @NotNull NotificationFanout.Slot slot) {
        this.fanout = Objects.requireNonNull(fanout, "no valid fanout provided");
        this.slot = Objects.requireNonNull(slot, "no valid slot provided");
    }

    public @NotNull CharacteristicId getCharacteristicId() {
        return slot.characteristicId;
    }

    /**
     * Wait for the next event.
     *
     * @return the next event, or null once this subscription is closed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    @Nullable
    public NotificationEvent take() throws InterruptedException {
        return slot.take();
    }

    /**
     * Wait at most the given time for the next event.
     *
     * @return the next event, or null if none arrived in time or this subscription is closed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    @Nullable
    public NotificationEvent poll(long timeout, @NotNull TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(unit, "no valid time unit provided");
        return slot.poll(timeout, unit);
    }

    /**
     * @return the next buffered event or null if there is none
     */
    @Nullable
    public NotificationEvent poll() {
        return slot.poll();
    }

    /**
     * @return number of events dropped because this subscriber did not keep up
     */
    public long getDroppedCount() {
        return slot.getDroppedCount();
    }

    public boolean isClosed() {
        return slot.isClosed();
    }

    @Override
    public void close() {
        fanout.remove(slot);
    }

    @Override
    public String toString() {
        return String.format("NotificationSubscription{%s, token=%d, dropped=%d}", slot.characteristicId, slot.token, getDroppedCount());
    }
}
