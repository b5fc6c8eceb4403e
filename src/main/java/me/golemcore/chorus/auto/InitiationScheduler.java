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

import me.golemcore.chorus.domain.initiation.InitiationDecisionEngine;
import me.golemcore.chorus.domain.initiation.SweepMode;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the daytime and background initiation sweeps.
 */
@Component
@Slf4j
public class InitiationScheduler {

    private final InitiationDecisionEngine engine;
    private final ChorusProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public InitiationScheduler(InitiationDecisionEngine engine, ChorusProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ChorusProperties.InitiationProperties initiation = properties.getInitiation();
        if (!initiation.isEnabled()) {
            log.info("[InitiationScheduler] Initiation disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "initiation-scheduler");
            t.setDaemon(true);
            return t;
        });
        long daytime = initiation.getDaytimeSweepInterval().toMillis();
        long background = initiation.getBackgroundSweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(() -> tick(SweepMode.DAYTIME), daytime, daytime, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(() -> tick(SweepMode.BACKGROUND), background, background,
                TimeUnit.MILLISECONDS);
        log.info("[InitiationScheduler] Started: daytime every {}, background every {}",
                initiation.getDaytimeSweepInterval(), initiation.getBackgroundSweepInterval());
    }

    @PreDestroy
    public void shutdown() {
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
        log.info("[InitiationScheduler] Shut down");
    }

    void tick(SweepMode mode) {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[InitiationScheduler] {} tick skipped: previous sweep still in progress", mode);
            return;
        }
        try {
            engine.sweep(mode);
        } catch (RuntimeException e) {
            log.error("[InitiationScheduler] {} sweep failed: {}", mode, e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }
}
