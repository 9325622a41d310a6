package com.signalrelay.delivery;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded, multi-producer/multi-consumer hand-off between the webhook admission path and
 * the dispatcher workers.
 *
 * <p>Tasks are ordered by their visible-after time ({@code notBefore}), then by a sequence
 * number assigned at enqueue, so fresh tasks come out in arrival order and a retry slots in
 * once its backoff has elapsed. {@link #take()} never returns a task before its
 * {@code notBefore}; a worker waiting on a future task wakes early if an earlier one arrives.
 *
 * <p>Capacity bounds {@link #enqueue(DeliveryTask)} only. {@link #reschedule(DeliveryTask)}
 * ignores it: a retry already holds an idempotency admission and dropping it would
 * silently lose the signal.
 *
 * <p>Once {@link #close()} is called both refuse new tasks, so nothing can land in the
 * queue after the dispatcher has drained it for shutdown.
 */
@Component
public class DeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(DeliveryQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private final PriorityQueue<DeliveryTask> tasks = new PriorityQueue<>(
            Comparator.comparing(DeliveryTask::getNotBefore).thenComparingLong(DeliveryTask::getSequenceNumber));

    /** Monotonically increasing counter for FIFO ordering among tasks visible at the same instant. */
    private final AtomicLong sequenceCounter = new AtomicLong(0);

    private final int capacity;
    private final Duration enqueueTimeout;
    private final Clock clock;

    private boolean closed;

    @Autowired
    public DeliveryQueue(DeliveryConfig deliveryConfig, Clock clock) {
        this(deliveryConfig.getQueueCapacity(), deliveryConfig.getEnqueueTimeout(), clock);
    }

    public DeliveryQueue(int capacity, Duration enqueueTimeout, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.enqueueTimeout = enqueueTimeout;
        this.clock = clock;
    }

    /**
     * Adds a fresh task, waiting at most the configured enqueue timeout for space.
     *
     * @return false if the queue is closed, stayed full for the whole timeout, or the caller
     *     was interrupted
     */
    public boolean enqueue(DeliveryTask task) {
        long nanos = enqueueTimeout.toNanos();
        lock.lock();
        try {
            while (!closed && tasks.size() >= capacity) {
                if (nanos <= 0L) {
                    log.warn("Delivery queue full: capacity={}, correlationId={}", capacity, task.getCorrelationId());
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            if (closed) {
                log.warn("Delivery queue closed, refusing task: correlationId={}", task.getCorrelationId());
                return false;
            }
            push(task);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for delivery queue space: correlationId={}", task.getCorrelationId());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-enqueues a task after a failed attempt. Not subject to the capacity bound.
     *
     * @return false only if the queue has been closed
     */
    public boolean reschedule(DeliveryTask task) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            push(task);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retrieves and removes the first task whose {@code notBefore} has passed, blocking until
     * there is one.
     *
     * @throws InterruptedException if the waiting worker is interrupted
     */
    public DeliveryTask take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                DeliveryTask head = tasks.peek();
                if (head == null) {
                    available.await();
                    continue;
                }
                long delayNanos = Duration.between(clock.instant(), head.getNotBefore()).toNanos();
                if (delayNanos <= 0L) {
                    return removeHead();
                }
                available.awaitNanos(delayNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #take()} but gives up after {@code timeout}.
     *
     * @return the task, or null if none became visible in time
     */
    public DeliveryTask poll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                DeliveryTask head = tasks.peek();
                long delayNanos = head == null
                        ? Long.MAX_VALUE
                        : Duration.between(clock.instant(), head.getNotBefore()).toNanos();
                if (delayNanos <= 0L) {
                    return removeHead();
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return null;
                }
                available.awaitNanos(Math.min(remaining, delayNanos));
            }
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns every queued task, visible or not. Used during shutdown. */
    public List<DeliveryTask> drainAll() {
        lock.lock();
        try {
            List<DeliveryTask> drained = new ArrayList<>(tasks.size());
            DeliveryTask task;
            while ((task = tasks.poll()) != null) {
                drained.add(task);
            }
            notFull.signalAll();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /** Stops accepting tasks. Producers waiting for space give up. Already queued tasks stay until drained. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Accepts tasks again after {@link #close()}. */
    public void open() {
        lock.lock();
        try {
            closed = false;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    public int remainingCapacity() {
        lock.lock();
        try {
            return Math.max(0, capacity - tasks.size());
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private void push(DeliveryTask task) {
        task.assignSequence(sequenceCounter.incrementAndGet());
        tasks.add(task);
        // Wake every waiter: the new task may be visible earlier than the one they sleep on
        available.signalAll();
        log.debug(
                "Task enqueued: correlationId={}, attempt={}, notBefore={}, queueSize={}",
                task.getCorrelationId(),
                task.getAttempt(),
                task.getNotBefore(),
                tasks.size());
    }

    private DeliveryTask removeHead() {
        DeliveryTask head = tasks.poll();
        notFull.signal();
        return head;
    }
}
