package me.golemcore.chorus.adapter.outbound.queue;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chorus.domain.model.RetryPolicy;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process task queue on a scheduled thread pool.
 *
 * <p>
 * A failed attempt is rescheduled while the task's retry policy allows it,
 * after the delay the policy assigns to that error. Terminal failures are
 * logged and dropped. Nothing survives a restart.
 */
@Component
@Slf4j
public class ScheduledTaskQueueAdapter implements TaskQueuePort {

    private final ScheduledExecutorService executor;

    public ScheduledTaskQueueAdapter(ChorusProperties properties) {
        int workers = Math.max(1, properties.getQueue().getWorkers());
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(workers, r -> {
            Thread t = new Thread(r, "chorus-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[TaskQueue] Started with {} worker(s)", workers);
    }

    @Override
    public void submit(QueuedTask task, Duration delay, RetryPolicy retryPolicy) {
        schedule(task, delay, retryPolicy != null ? retryPolicy : RetryPolicy.none(), 1);
    }

    private void schedule(QueuedTask task, Duration delay, RetryPolicy retryPolicy, int attempt) {
        long delayMs = delay != null ? Math.max(0, delay.toMillis()) : 0;
        try {
            executor.schedule(() -> runAttempt(task, retryPolicy, attempt), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[TaskQueue] Rejected {}: queue is shut down", task.name());
        }
    }

    private void runAttempt(QueuedTask task, RetryPolicy retryPolicy, int attempt) {
        try {
            log.debug("[TaskQueue] Running {} (attempt {})", task.name(), attempt);
            task.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[TaskQueue] {} interrupted", task.name());
        } catch (Exception e) {
            if (retryPolicy.shouldRetry(e, attempt)) {
                Duration backoff = retryPolicy.delayAfter(e, attempt);
                log.warn("[TaskQueue] {} failed (attempt {}), retrying in {}ms: {}", task.name(), attempt,
                        backoff.toMillis(), e.getMessage());
                schedule(task, backoff, retryPolicy, attempt + 1);
            } else {
                log.error("[TaskQueue] {} failed after {} attempt(s): {}", task.name(), attempt, e.getMessage(), e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[TaskQueue] Shut down");
    }
}
