/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.config;

import com.trialgate.application.ExperimentRegistry;
import com.trialgate.application.decorator.MetricsDecoratorFactory;
import com.trialgate.application.selection.SelectionModeRegistry;
import com.trialgate.application.selection.StagedRolloutProvider;
import com.trialgate.domain.model.CircuitState;
import com.trialgate.support.GreetingService;
import com.trialgate.support.PricingService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class TrialgateConfigTest {
    @Autowired
    private ExperimentRegistry experimentRegistry;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private SelectionModeRegistry selectionModes;

    @Test
    void loadsConfiguredExperimentsWithoutConflicts() {
        assertEquals(List.of("greeting", "pricing"),
                experimentRegistry.statuses().stream().map(s -> s.name()).toList());
        assertTrue(experimentRegistry.conflicts().isEmpty());
        assertEquals(CircuitState.CLOSED, experimentRegistry.status("pricing").circuitState());
    }

    @Test
    void configurationValueSelectsCasualGreeting() throws Exception {
        GreetingService greetings = experimentRegistry.proxyFor(GreetingService.class);
        assertEquals("Hey Ada", greetings.greet("Ada"));
        assertFalse(meterRegistry.find(MetricsDecoratorFactory.INVOCATIONS).counters().isEmpty());
    }

    @Test
    void disabledTrialFallsBackToDefaultGreeting() {
        GreetingService greetings = experimentRegistry.proxyFor(GreetingService.class);
        experimentRegistry.disableTrial("greeting", "casual", "test");
        try {
            assertEquals("Good day, Ada", greetings.greet("Ada"));
        } finally {
            experimentRegistry.enableTrial("greeting", "casual", "test");
        }
        assertEquals("Hey Ada", greetings.greet("Ada"));
    }

    @Test
    void featureFlagSelectsDiscountPricing() {
        PricingService pricing = experimentRegistry.proxyFor(PricingService.class);
        assertEquals(900L, pricing.priceCents("sku-1", 1000L));
    }

    @Test
    void registersStagedRolloutModeFromProperties() {
        assertTrue(selectionModes.find(StagedRolloutProvider.MODE).isPresent());
        assertTrue(selectionModes.find("stagedrollout").isPresent());
    }
}
