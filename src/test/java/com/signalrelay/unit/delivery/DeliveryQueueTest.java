package com.signalrelay.unit.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signalrelay.delivery.DeliveryQueue;
import com.signalrelay.delivery.DeliveryTask;
import com.signalrelay.support.MutableClock;
import com.signalrelay.support.TestSignals;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeliveryQueueTest {

    private static final Instant START = Instant.parse("2025-08-05T18:30:00Z");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    private DeliveryTask task(String id) {
        return new DeliveryTask(id, TestSignals.btcBuy(), clock.instant());
    }

    private DeliveryTask taskVisibleAt(String id, Instant visibleAt) {
        return new DeliveryTask(id, TestSignals.btcBuy(), visibleAt);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Tasks visible at the same instant come out in arrival order")
        void fifo() throws InterruptedException {
            DeliveryQueue queue = new DeliveryQueue(10, Duration.ofMillis(10), clock);
            queue.enqueue(task("a"));
            queue.enqueue(task("b"));
            queue.enqueue(task("c"));

            assertThat(queue.poll(100, TimeUnit.MILLISECONDS).getCorrelationId()).isEqualTo("a");
            assertThat(queue.poll(100, TimeUnit.MILLISECONDS).getCorrelationId()).isEqualTo("b");
            assertThat(queue.poll(100, TimeUnit.MILLISECONDS).getCorrelationId()).isEqualTo("c");
            assertThat(queue.size()).isZero();
        }

        @Test
        @DisplayName("A task is not handed out before its visible-after time")
        void notBeforeRespected() throws InterruptedException {
            DeliveryQueue queue = new DeliveryQueue(10, Duration.ofMillis(10), clock);
            queue.enqueue(taskVisibleAt("later", START.plusSeconds(2)));
            queue.enqueue(task("now"));

            assertThat(queue.poll(100, TimeUnit.MILLISECONDS).getCorrelationId()).isEqualTo("now");
            assertThat(queue.poll(50, TimeUnit.MILLISECONDS)).isNull();
            assertThat(queue.size()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(2));
            assertThat(queue.poll(100, TimeUnit.MILLISECONDS).getCorrelationId()).isEqualTo("later");
        }

        @Test
        @DisplayName("take() blocks until a task arrives")
        void takeBlocks() throws Exception {
            DeliveryQueue queue = new DeliveryQueue(10, Duration.ofMillis(10), clock);
            CompletableFuture<DeliveryTask> taken = CompletableFuture.supplyAsync(() -> {
                try {
                    return queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            });

            Thread.sleep(50);
            assertThat(taken).isNotDone();

            queue.enqueue(task("late"));
            assertThat(taken.get(2, TimeUnit.SECONDS).getCorrelationId()).isEqualTo("late");
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("Enqueue fails once the queue stays full for the whole timeout")
        void fullQueueRejects() {
            DeliveryQueue queue = new DeliveryQueue(2, Duration.ofMillis(20), clock);

            assertThat(queue.enqueue(task("a"))).isTrue();
            assertThat(queue.enqueue(task("b"))).isTrue();
            assertThat(queue.enqueue(task("c"))).isFalse();
            assertThat(queue.size()).isEqualTo(2);
            assertThat(queue.remainingCapacity()).isZero();
        }

        @Test
        @DisplayName("Enqueue succeeds if space frees up within the timeout")
        void waitsForSpace() throws Exception {
            DeliveryQueue queue = new DeliveryQueue(1, Duration.ofSeconds(2), clock);
            queue.enqueue(task("a"));

            CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(() -> queue.enqueue(task("b")));
            Thread.sleep(50);
            queue.poll(100, TimeUnit.MILLISECONDS);

            assertThat(second.get(2, TimeUnit.SECONDS)).isTrue();
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Reschedule is not bounded by capacity")
        void rescheduleBypassesCapacity() {
            DeliveryQueue queue = new DeliveryQueue(1, Duration.ZERO, clock);
            queue.enqueue(task("a"));

            assertThat(queue.reschedule(task("retry"))).isTrue();

            assertThat(queue.size()).isEqualTo(2);
            assertThat(queue.remainingCapacity()).isZero();
        }

        @Test
        @DisplayName("Non-positive capacity is refused")
        void invalidCapacity() {
            assertThatThrownBy(() -> new DeliveryQueue(0, Duration.ZERO, clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("drainAll empties the queue, future tasks included")
    void drainAll() {
        DeliveryQueue queue = new DeliveryQueue(10, Duration.ofMillis(10), clock);
        queue.enqueue(task("a"));
        queue.reschedule(taskVisibleAt("b", START.plusSeconds(60)));

        assertThat(queue.drainAll()).extracting(DeliveryTask::getCorrelationId).containsExactly("a", "b");
        assertThat(queue.size()).isZero();
        assertThat(queue.remainingCapacity()).isEqualTo(10);
    }

    @Nested
    @DisplayName("Closing")
    class Closing {

        @Test
        @DisplayName("A closed queue refuses fresh tasks and retries but keeps what it holds")
        void closedRefusesTasks() {
            DeliveryQueue queue = new DeliveryQueue(10, Duration.ofMillis(10), clock);
            queue.enqueue(task("a"));

            queue.close();

            assertThat(queue.enqueue(task("b"))).isFalse();
            assertThat(queue.reschedule(task("retry"))).isFalse();
            assertThat(queue.drainAll()).extracting(DeliveryTask::getCorrelationId).containsExactly("a");
        }

        @Test
        @DisplayName("Closing releases a producer waiting for space")
        void closeReleasesWaitingProducer() throws Exception {
            DeliveryQueue queue = new DeliveryQueue(1, Duration.ofSeconds(5), clock);
            queue.enqueue(task("a"));

            CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> queue.enqueue(task("b")));
            Thread.sleep(50);
            queue.close();

            assertThat(blocked.get(1, TimeUnit.SECONDS)).isFalse();
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("A reopened queue accepts tasks again")
        void reopen() {
            DeliveryQueue queue = new DeliveryQueue(10, Duration.ofMillis(10), clock);
            queue.close();

            queue.open();

            assertThat(queue.enqueue(task("a"))).isTrue();
        }
    }
}
