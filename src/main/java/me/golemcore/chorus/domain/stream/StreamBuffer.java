package me.golemcore.chorus.domain.stream;

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

import java.time.Duration;
import java.time.Instant;

/**
 * Debounced accumulation of one stream channel (reply content or reasoning).
 *
 * <p>
 * Chunks go into both the pending buffer and the full accumulator. A flush
 * drains exactly the pending substring, in arrival order, and leaves the
 * accumulator intact for finalization fallback. The buffer keeps no clock of
 * its own: callers pass the current instant, so the flush predicate is pure.
 */
public class StreamBuffer {

    private final Duration interval;
    private final StringBuilder pending = new StringBuilder();
    private final StringBuilder accumulated = new StringBuilder();
    private Instant lastFlushTime;

    public StreamBuffer(Duration interval) {
        this.interval = interval;
    }

    /**
     * Clears both buffers and starts the debounce clock at {@code now}.
     */
    public void reset(Instant now) {
        pending.setLength(0);
        accumulated.setLength(0);
        lastFlushTime = now;
    }

    public void enqueue(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        pending.append(chunk);
        accumulated.append(chunk);
    }

    public boolean shouldFlush(Instant now) {
        if (pending.length() == 0) {
            return false;
        }
        return lastFlushTime == null || Duration.between(lastFlushTime, now).compareTo(interval) >= 0;
    }

    /**
     * Empties the pending buffer.
     *
     * @return the drained text, or {@code null} when nothing was pending
     */
    public String drain(Instant now) {
        if (pending.length() == 0) {
            return null;
        }
        String chunk = pending.toString();
        pending.setLength(0);
        lastFlushTime = now;
        return chunk;
    }

    public boolean hasPending() {
        return pending.length() > 0;
    }

    public String accumulated() {
        return accumulated.toString();
    }

    public Instant lastFlushTime() {
        return lastFlushTime;
    }

    public Duration interval() {
        return interval;
    }
}
