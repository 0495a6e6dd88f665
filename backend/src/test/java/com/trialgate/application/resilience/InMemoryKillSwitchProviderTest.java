/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.resilience;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryKillSwitchProviderTest {

    @Test
    void experimentAndTrialSwitchesAreIndependent() {
        InMemoryKillSwitchProvider killSwitch = new InMemoryKillSwitchProvider();

        killSwitch.disableTrial(Runnable.class, "variant");
        assertFalse(killSwitch.isExperimentDisabled(Runnable.class));
        assertTrue(killSwitch.isTrialDisabled(Runnable.class, "variant"));
        assertFalse(killSwitch.isTrialDisabled(Runnable.class, "control"));
        assertFalse(killSwitch.isTrialDisabled(AutoCloseable.class, "variant"));

        killSwitch.disableExperiment(Runnable.class);
        assertTrue(killSwitch.isExperimentDisabled(Runnable.class));

        killSwitch.enableExperiment(Runnable.class);
        assertFalse(killSwitch.isExperimentDisabled(Runnable.class));
        assertTrue(killSwitch.isTrialDisabled(Runnable.class, "variant"));
    }

    @Test
    void listsDisabledTrialsOfOneService() {
        InMemoryKillSwitchProvider killSwitch = new InMemoryKillSwitchProvider();
        killSwitch.disableTrial(Runnable.class, "b");
        killSwitch.disableTrial(Runnable.class, "a");
        killSwitch.disableTrial(AutoCloseable.class, "c");
        killSwitch.enableTrial(Runnable.class, "b");

        assertEquals(Set.of("a"), killSwitch.disabledTrials(Runnable.class));
    }

    @Test
    void noopSwitchNeverDisablesAndRejectsChanges() {
        KillSwitchProvider noop = NoopKillSwitchProvider.INSTANCE;
        assertFalse(noop.isExperimentDisabled(Runnable.class));
        assertFalse(noop.isTrialDisabled(Runnable.class, "a"));
        assertThrows(UnsupportedOperationException.class, () -> noop.disableExperiment(Runnable.class));
    }
}
