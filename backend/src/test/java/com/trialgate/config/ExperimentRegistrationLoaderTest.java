/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.config;

import com.trialgate.application.decorator.LoggingDecoratorFactory;
import com.trialgate.application.decorator.MetricsDecoratorFactory;
import com.trialgate.application.metrics.NoopExperimentMetrics;
import com.trialgate.application.registration.Registration;
import com.trialgate.application.resilience.InMemoryKillSwitchProvider;
import com.trialgate.domain.model.ErrorPolicyType;
import com.trialgate.domain.model.FallbackAction;
import com.trialgate.domain.model.SelectionMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperimentRegistrationLoaderTest {
    private final InMemoryKillSwitchProvider killSwitch = new InMemoryKillSwitchProvider();
    private final ExperimentRegistrationLoader loader = new ExperimentRegistrationLoader(
            getClass().getClassLoader(), killSwitch, NoopExperimentMetrics.INSTANCE);

    @Test
    void mapsEveryConfiguredPolicy() {
        TrialsProperties.Experiment experiment = new TrialsProperties.Experiment(
                "jobs",
                "java.lang.Runnable",
                "control",
                trials(),
                "configurationvalue",
                "experiments.jobs",
                new TrialsProperties.ErrorPolicy(ErrorPolicyType.REDIRECT_SPECIFIC, "variant", null),
                "2025-01-01T00:00:00Z",
                "2025-12-31T23:59:59Z",
                new TrialsProperties.Timeout(Duration.ofMillis(250), FallbackAction.FALLBACK_TO_DEFAULT, null),
                new TrialsProperties.CircuitBreaker(null, 5, null, Duration.ofSeconds(10), null, null),
                List.of("logging"),
                true
        );

        Registration<?> registration = loader.load(new TrialsProperties(List.of(experiment), null, null)).get(0);

        assertEquals("jobs", registration.experimentName());
        assertEquals(Runnable.class, registration.serviceType());
        assertEquals(SelectionMode.CONFIGURATION_VALUE, registration.selectionMode());
        assertEquals("experiments.jobs", registration.selectorName());
        assertEquals(ErrorPolicyType.REDIRECT_SPECIFIC, registration.errorPolicy().type());
        assertEquals("variant", registration.errorPolicy().fallbackKey());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), registration.startTime());
        assertEquals(Duration.ofMillis(250), registration.timeoutPolicy().timeout());
        assertEquals(5, registration.circuitBreakerOptions().minimumThroughput());
        assertEquals(Duration.ofSeconds(10), registration.circuitBreakerOptions().breakDuration());
        assertEquals("variantBean", registration.trials().get("variant").beanName());
        assertSame(killSwitch, registration.killSwitch());
        assertInstanceOf(LoggingDecoratorFactory.class, registration.decoratorFactories().get(0));
        assertInstanceOf(MetricsDecoratorFactory.class, registration.decoratorFactories().get(1));
    }

    @Test
    void unknownModeBecomesCustomAndMissingPolicyThrows() {
        Registration<?> registration = loader.load(new TrialsProperties(List.of(minimal("Canary", null)), null, null)).get(0);

        assertEquals(SelectionMode.CUSTOM, registration.selectionMode());
        assertEquals("Canary", registration.modeIdentifier());
        assertEquals(ErrorPolicyType.THROW, registration.errorPolicy().type());
        assertNull(registration.timeoutPolicy());
        assertNull(registration.circuitBreaker());
    }

    @Test
    void configurationDefectsFailWithExperimentName() {
        TrialsProperties.Experiment unknownType = new TrialsProperties.Experiment(
                "ghost", "com.example.Missing", "control", trials(), null, null, null, null, null, null, null, null, false);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load(new TrialsProperties(List.of(unknownType), null, null)));
        assertTrue(e.getMessage().contains("ghost"));

        TrialsProperties.Experiment badTime = new TrialsProperties.Experiment(
                "late", "java.lang.Runnable", "control", trials(), null, null, null, "yesterday", null, null, null, null, false);
        assertThrows(IllegalStateException.class, () -> loader.load(new TrialsProperties(List.of(badTime), null, null)));

        assertThrows(IllegalStateException.class, () -> loader.load(new TrialsProperties(List.of(minimal(null, "tracing")), null, null)));
    }

    private static TrialsProperties.Experiment minimal(String mode, String decorator) {
        return new TrialsProperties.Experiment(
                null, "java.lang.Runnable", "control", trials(), mode, null, null, null, null, null, null,
                decorator == null ? null : List.of(decorator), false);
    }

    private static Map<String, String> trials() {
        Map<String, String> trials = new LinkedHashMap<>();
        trials.put("control", "controlBean");
        trials.put("variant", "variantBean");
        return trials;
    }
}
