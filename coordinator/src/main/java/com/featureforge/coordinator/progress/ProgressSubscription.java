package com.featureforge.coordinator.progress;

import com.featureforge.coordinator.model.ProgressEvent;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A live feed of progress events backed by a bounded queue.
 *
 * The publisher never waits on a subscriber: when the queue is full the
 * event is dropped for this subscriber only and {@link #droppedCount()}
 * goes up. The persisted history (ProgressPublisher.events) still has it.
 */
public class ProgressSubscription implements AutoCloseable {

    // Wakes a blocked poll() after close().
    private static final ProgressEvent CLOSED = new ProgressEvent("", "subscription_closed", null, null);

    private final String                       taskId;
    private final BlockingQueue<ProgressEvent> queue;
    private final Consumer<ProgressSubscription> onClose;
    private final AtomicBoolean                closed  = new AtomicBoolean(false);
    private final AtomicLong                   dropped = new AtomicLong();

    ProgressSubscription(String taskId, int capacity, Consumer<ProgressSubscription> onClose) {
        this.taskId  = taskId;
        this.queue   = new LinkedBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    /** Task this subscription follows, or null for a subscription to every task. */
    public String taskId() {
        return taskId;
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the event, or empty on timeout or once the subscription is closed
     *         and drained
     */
    public Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
        if (closed.get() && queue.isEmpty()) return Optional.empty();
        ProgressEvent event = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event == null || event == CLOSED) return Optional.empty();
        return Optional.of(event);
    }

    /** Unregister from the publisher. Idempotent. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
            queue.offer(CLOSED);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Events discarded because the queue was full. */
    public long droppedCount() {
        return dropped.get();
    }

    /** Non-blocking hand-off from the publisher; false when the event was dropped. */
    boolean offer(ProgressEvent event) {
        if (closed.get()) return false;
        if (queue.offer(event)) return true;
        dropped.incrementAndGet();
        return false;
    }
}
