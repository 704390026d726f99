package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broadcasts notifications to every subscriber of a characteristic.
 *
 * <p>Subscribers live in a table addressed by token. Adding and removing subscribers takes a
 * short lock; delivery works on a snapshot and never blocks, so a slow subscriber only loses its
 * own events.
 *
 * <p>Only characteristics activated by a successful subscribe command are delivered, and only
 * events of the current connection generation.
 */
public class NotificationFanout {
    private static final String TAG = NotificationFanout.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    private final Object lock = new Object();

    private final Map<Long, Slot> slots = new HashMap<>();

    private final Set<CharacteristicId> activeCharacteristics = ConcurrentHashMap.newKeySet();

    private final AtomicLong nextToken = new AtomicLong();

    private final int bufferSize;

    private volatile long generation;

    public NotificationFanout(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("buffer size must be positive");
        }
        this.bufferSize = bufferSize;
    }

    @NotNull
    public NotificationSubscription subscribe(@NotNull CharacteristicId characteristicId) {
        Objects.requireNonNull(characteristicId, "no valid characteristic id provided");
        final Slot slot = new Slot(nextToken.incrementAndGet(), characteristicId, bufferSize);
        synchronized (lock) {
            slots.put(slot.token, slot);
        }
        logger.debug(String.format("added subscriber %d for %s", slot.token, characteristicId));
        return new NotificationSubscription(this, slot);
    }

    void remove(@NotNull Slot slot) {
        final Slot removed;
        synchronized (lock) {
            removed = slots.remove(slot.token);
        }
        slot.close();
        if (removed != null) {
            logger.debug(String.format("removed subscriber %d for %s", slot.token, slot.characteristicId));
        }
    }

    /**
     * Deliver an event to all subscribers of its characteristic.
     *
     * @param event the event
     * @return true if the event was current and its characteristic active, false if it was discarded
     */
    public boolean publish(@NotNull NotificationEvent event) {
        Objects.requireNonNull(event, "no valid event provided");
        if (event.getGeneration() != generation) {
            logger.debug(String.format("discarding stale notification %s (current generation %d)", event, generation));
            return false;
        }
        if (!activeCharacteristics.contains(event.getCharacteristicId())) {
            logger.debug(String.format("discarding notification for inactive characteristic %s", event.getCharacteristicId()));
            return false;
        }

        for (Slot slot : snapshot(event.getCharacteristicId())) {
            if (!slot.offer(event)) {
                logger.debug(String.format("subscriber %d is full, dropped notification for %s (%d dropped)", slot.token, event.getCharacteristicId(), slot.getDroppedCount()));
            }
        }
        return true;
    }

    void setGeneration(long generation) {
        this.generation = generation;
    }

    void activate(@NotNull CharacteristicId characteristicId) {
        activeCharacteristics.add(characteristicId);
    }

    void deactivate(@NotNull CharacteristicId characteristicId) {
        activeCharacteristics.remove(characteristicId);
    }

    void deactivateAll() {
        activeCharacteristics.clear();
    }

    public boolean isActive(@NotNull CharacteristicId characteristicId) {
        return activeCharacteristics.contains(characteristicId);
    }

    public int getSubscriberCount(@NotNull CharacteristicId characteristicId) {
        return snapshot(characteristicId).size();
    }

    /**
     * Close all subscriptions.
     */
    void closeAll() {
        final List<Slot> all;
        synchronized (lock) {
            all = new ArrayList<>(slots.values());
            slots.clear();
        }
        for (Slot slot : all) {
            slot.close();
        }
    }

    @NotNull
    private List<Slot> snapshot(@NotNull CharacteristicId characteristicId) {
        final List<Slot> result = new ArrayList<>();
        synchronized (lock) {
            for (Slot slot : slots.values()) {
                if (slot.characteristicId.equals(characteristicId)) {
                    result.add(slot);
                }
            }
        }
        return result;
    }

    /**
     * Per-subscriber buffer.
     */
    static final class Slot {
        private static final NotificationEvent CLOSED = new NotificationEvent(new CharacteristicId(new UUID(0, 0), new UUID(0, 0)), new byte[0], -1);

        final long token;

        @NotNull
        final CharacteristicId characteristicId;

        @NotNull
        private final BlockingQueue<NotificationEvent> queue;

        private final int capacity;

        private final AtomicLong dropped = new AtomicLong();

        private volatile boolean closed = false;

        Slot(long token, @NotNull CharacteristicId characteristicId, int capacity) {
            this.token = token;
            this.characteristicId = characteristicId;
            // One extra place for the close marker
            this.queue = new ArrayBlockingQueue<>(capacity + 1);
            this.capacity = capacity;
        }

        boolean offer(@NotNull NotificationEvent event) {
            if (closed) return false;
            synchronized (this) {
                if (queue.size() >= capacity || !queue.offer(event)) {
                    dropped.incrementAndGet();
                    return false;
                }
            }
            return true;
        }

        @Nullable
        NotificationEvent take() throws InterruptedException {
            if (closed && queue.isEmpty()) return null;
            return unmark(queue.take());
        }

        @Nullable
        NotificationEvent poll(long timeout, @NotNull TimeUnit unit) throws InterruptedException {
            if (closed && queue.isEmpty()) return null;
            return unmark(queue.poll(timeout, unit));
        }

        @Nullable
        NotificationEvent poll() {
            return unmark(queue.poll());
        }

        @Nullable
        private NotificationEvent unmark(@Nullable NotificationEvent event) {
            if (event == CLOSED) {
                // Leave the marker for other waiting readers
                queue.offer(CLOSED);
                return null;
            }
            return event;
        }

        long getDroppedCount() {
            return dropped.get();
        }

        boolean isClosed() {
            return closed;
        }

        void close() {
            synchronized (this) {
                if (closed) return;
                closed = true;
                queue.clear();
                queue.offer(CLOSED);
            }
        }
    }
}
