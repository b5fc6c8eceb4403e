package me.golemcore.chorus.port.outbound;

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

import java.time.Duration;

/**
 * Durable deferred work. Every unit of work (turn, sequencer step, sweep item,
 * decision) is submitted here and retried according to its policy.
 */
public interface TaskQueuePort {

    void submit(QueuedTask task, Duration delay, RetryPolicy retryPolicy);

    default void submit(QueuedTask task) {
        submit(task, Duration.ZERO, RetryPolicy.none());
    }

    /**
     * A named unit of work. Throwing marks the attempt as failed.
     */
    interface QueuedTask {

        String name();

        void run() throws Exception;
    }
}
