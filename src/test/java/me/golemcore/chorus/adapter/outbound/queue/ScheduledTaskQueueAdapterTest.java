package me.golemcore.chorus.adapter.outbound.queue;

import me.golemcore.chorus.domain.model.RetryPolicy;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledTaskQueueAdapterTest {

    private ScheduledTaskQueueAdapter queue;

    @BeforeEach
    void setUp() {
        ChorusProperties properties = new ChorusProperties();
        properties.getQueue().setWorkers(2);
        queue = new ScheduledTaskQueueAdapter(properties);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    @Test
    void shouldRunSubmittedTask() throws Exception {
        CountDownLatch done = new CountDownLatch(1);

        queue.submit(task("simple", done::countDown));

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldRetryFailingTaskUntilItSucceeds() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);
        RetryPolicy policy = RetryPolicy.of(RetryPolicy.Rule.fixed(3, Duration.ofMillis(10)));

        queue.submit(task("flaky", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            done.countDown();
        }), Duration.ZERO, policy);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(3, attempts.get());
    }

    @Test
    void shouldStopAfterMaxAttempts() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch twoAttempts = new CountDownLatch(2);
        RetryPolicy policy = RetryPolicy.of(RetryPolicy.Rule.fixed(2, Duration.ofMillis(10)));

        queue.submit(task("broken", () -> {
            attempts.incrementAndGet();
            twoAttempts.countDown();
            throw new IllegalStateException("always");
        }), Duration.ZERO, policy);

        assertTrue(twoAttempts.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(2, attempts.get());
    }

    @Test
    void shouldNotRetryWithoutPolicy() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch first = new CountDownLatch(1);

        queue.submit(task("once", () -> {
            attempts.incrementAndGet();
            first.countDown();
            throw new IllegalStateException("boom");
        }), Duration.ZERO, null);

        assertTrue(first.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(1, attempts.get());
    }

    @Test
    void shouldHonorInitialDelay() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        long start = System.nanoTime();

        queue.submit(task("delayed", done::countDown), Duration.ofMillis(150), RetryPolicy.none());

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 140);
    }

    @Test
    void shouldIgnoreSubmissionsAfterShutdown() {
        queue.shutdown();
        AtomicInteger attempts = new AtomicInteger();

        queue.submit(task("late", attempts::incrementAndGet));

        assertEquals(0, attempts.get());
    }

    private static TaskQueuePort.QueuedTask task(String name, Runnable body) {
        return new TaskQueuePort.QueuedTask() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void run() {
                body.run();
            }
        };
    }
}
