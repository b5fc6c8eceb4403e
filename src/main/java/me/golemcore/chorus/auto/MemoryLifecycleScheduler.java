package me.golemcore.chorus.auto;

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

import me.golemcore.chorus.domain.memory.MemoryConsolidator;
import me.golemcore.chorus.domain.memory.MemoryRefiner;
import me.golemcore.chorus.domain.memory.MemoryReflector;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * Periodically runs the three memory sweeps: consolidation of idle chats,
 * reflection over journals, and consent-gated refinement.
 *
 * <p>
 * Each sweep is non-reentrant: a tick that finds the previous run of the same
 * sweep still in progress is skipped.
 */
@Component
@Slf4j
public class MemoryLifecycleScheduler {

    private final MemoryConsolidator consolidator;
    private final MemoryReflector reflector;
    private final MemoryRefiner refiner;
    private final ChorusProperties properties;

    private final AtomicBoolean consolidating = new AtomicBoolean(false);
    private final AtomicBoolean reflecting = new AtomicBoolean(false);
    private final AtomicBoolean refining = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> ticks = new ArrayList<>();

    private ScheduledExecutorService scheduler;

    public MemoryLifecycleScheduler(MemoryConsolidator consolidator, MemoryReflector reflector,
            MemoryRefiner refiner, ChorusProperties properties) {
        this.consolidator = consolidator;
        this.reflector = reflector;
        this.refiner = refiner;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ChorusProperties.MemoryProperties memory = properties.getMemory();
        if (!memory.isSchedulerEnabled()) {
            log.info("[MemoryScheduler] Memory sweeps disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-lifecycle-scheduler");
            t.setDaemon(true);
            return t;
        });
        every(memory.getConsolidationSweepInterval(), this::consolidationTick);
        every(memory.getReflectionSweepInterval(), this::reflectionTick);
        every(memory.getRefinementSweepInterval(), this::refinementTick);
        log.info("[MemoryScheduler] Started: consolidation every {}, reflection every {}, refinement every {}",
                memory.getConsolidationSweepInterval(), memory.getReflectionSweepInterval(),
                memory.getRefinementSweepInterval());
    }

    @PreDestroy
    public void shutdown() {
        ticks.forEach(tick -> tick.cancel(false));
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[MemoryScheduler] Shut down");
    }

    void consolidationTick() {
        runGuarded("consolidation", consolidating, consolidator::sweep);
    }

    void reflectionTick() {
        runGuarded("reflection", reflecting, reflector::sweep);
    }

    void refinementTick() {
        runGuarded("refinement", refining, refiner::sweep);
    }

    private void every(Duration interval, Runnable tick) {
        long millis = interval.toMillis();
        ticks.add(scheduler.scheduleAtFixedRate(tick, millis, millis, TimeUnit.MILLISECONDS));
    }

    private void runGuarded(String sweep, AtomicBoolean guard, IntSupplier body) {
        if (!guard.compareAndSet(false, true)) {
            log.debug("[MemoryScheduler] {} skipped: previous run still in progress", sweep);
            return;
        }
        try {
            int processed = body.getAsInt();
            if (processed > 0) {
                log.info("[MemoryScheduler] {} sweep processed {}", sweep, processed);
            }
        } catch (RuntimeException e) {
            log.error("[MemoryScheduler] {} sweep failed: {}", sweep, e.getMessage(), e);
        } finally {
            guard.set(false);
        }
    }
}
