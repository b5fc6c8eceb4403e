package me.golemcore.chorus.auto;

import me.golemcore.chorus.domain.initiation.InitiationDecisionEngine;
import me.golemcore.chorus.domain.initiation.SweepMode;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class InitiationSchedulerTest {

    private InitiationDecisionEngine engine;
    private ChorusProperties properties;
    private InitiationScheduler scheduler;

    @BeforeEach
    void setUp() {
        engine = mock(InitiationDecisionEngine.class);
        properties = new ChorusProperties();
        scheduler = new InitiationScheduler(engine, properties);
    }

    @Test
    void shouldSweepWithGivenMode() {
        scheduler.tick(SweepMode.DAYTIME);
        scheduler.tick(SweepMode.BACKGROUND);

        verify(engine).sweep(SweepMode.DAYTIME);
        verify(engine).sweep(SweepMode.BACKGROUND);
    }

    @Test
    void shouldSkipOverlappingSweep() {
        when(engine.sweep(SweepMode.DAYTIME)).thenAnswer(invocation -> {
            scheduler.tick(SweepMode.BACKGROUND);
            return 3;
        });

        scheduler.tick(SweepMode.DAYTIME);

        verify(engine, times(1)).sweep(any());
    }

    @Test
    void shouldSurviveFailingSweep() {
        when(engine.sweep(SweepMode.BACKGROUND)).thenThrow(new IllegalStateException("boom")).thenReturn(0);

        assertDoesNotThrow(() -> scheduler.tick(SweepMode.BACKGROUND));
        scheduler.tick(SweepMode.BACKGROUND);

        verify(engine, times(2)).sweep(SweepMode.BACKGROUND);
    }

    @Test
    void shouldStayIdleWhenDisabled() {
        properties.getInitiation().setEnabled(false);

        scheduler.init();
        scheduler.shutdown();

        verifyNoInteractions(engine);
    }
}
